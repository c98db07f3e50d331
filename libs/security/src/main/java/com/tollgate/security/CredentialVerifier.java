package com.tollgate.security;

import java.util.Optional;

/**
 * Backend check of a syntactically valid credential. Implementations open a throwaway,
 * unpooled connection; they may throw unchecked exceptions for backend outages, which the
 * validator reports as {@link ValidationFailure#BACKEND_ERROR}.
 */
public interface CredentialVerifier {

    /**
     * @return true if the database accepts {@code username}/{@code secret}
     */
    boolean verifyBasic(String username, String secret);

    /**
     * @return the database's notion of the current user for a connection opened with
     *         {@code token}, or empty if the token is rejected
     */
    Optional<String> resolveBearerIdentity(String token);
}
