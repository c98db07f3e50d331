package com.tollgate.security;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.ByteBuffer;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Syntactic checks on credentials, applied before anything reaches the database.
 */
public final class CredentialFormats {

    /** Database identifiers accepted as usernames and assumed principals. */
    public static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]{1,30}$");

    private CredentialFormats() {
        // utility class
    }

    public static boolean isValidIdentifier(String candidate) {
        return candidate != null && IDENTIFIER.matcher(candidate).matches();
    }

    /**
     * A bearer token must look like a JWT: three non-empty dot-separated segments.
     * The signature is not verified here; the database does that on connect.
     */
    public static boolean isValidBearerToken(String token) {
        if (token == null || token.isBlank()) {
            return false;
        }
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            return false;
        }
        for (String part : parts) {
            if (part.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Decodes the value of a Basic header.
     *
     * @param encoded base64 of {@code user:secret}
     * @return the decoded pair (both parts trimmed), or empty when the value is not base64,
     *         not UTF-8, or has no {@code :}
     */
    public static Optional<BasicCredentials> decodeBasic(String encoded) {
        if (encoded == null) {
            return Optional.empty();
        }
        String decoded;
        try {
            byte[] bytes = Base64.getDecoder().decode(encoded.strip());
            decoded = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (IllegalArgumentException | CharacterCodingException e) {
            return Optional.empty();
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return Optional.empty();
        }
        return Optional.of(new BasicCredentials(
                decoded.substring(0, colon).strip(),
                decoded.substring(colon + 1).strip()));
    }
}
