package com.tollgate.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers for credential fingerprints. Raw credentials are never stored or logged;
 * only these digests are.
 */
public final class CredentialHashes {

    /** Hex characters of the header digest used in a rate-limit fingerprint. */
    static final int FINGERPRINT_PREFIX = 16;

    static final String UNKNOWN_CLIENT = "unknown";

    private CredentialHashes() {
        // utility class
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code value}.
     */
    public static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Rate-limit fingerprint of a caller: the first 16 hex characters of the header digest and
     * the caller's network origin, joined with {@code :}. Either part is omitted when absent;
     * with neither the fingerprint is {@code unknown}.
     * <p>
     * The origin normally comes from {@code RequestContext.clientIp()}, which prefers the first
     * {@code X-Forwarded-For} hop. That hop is supplied by the client, so a caller can rotate it
     * to get a fresh rate-limit bucket for every attempt. Deploy behind a trusted proxy that
     * strips or overwrites {@code X-Forwarded-For} before it reaches the gateway.
     *
     * @param authorizationHeader raw Authorization header, nullable
     * @param clientOrigin        network origin (first forwarded hop or peer address), nullable
     */
    public static String fingerprint(String authorizationHeader, String clientOrigin) {
        StringBuilder id = new StringBuilder();
        if (authorizationHeader != null && !authorizationHeader.isEmpty()) {
            id.append(sha256Hex(authorizationHeader), 0, FINGERPRINT_PREFIX);
        }
        if (clientOrigin != null && !clientOrigin.isBlank()) {
            if (!id.isEmpty()) {
                id.append(':');
            }
            id.append(clientOrigin.strip());
        }
        return id.isEmpty() ? UNKNOWN_CLIENT : id.toString();
    }
}
