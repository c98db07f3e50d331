package com.tollgate.security;

/**
 * Why a credential was rejected. Each kind carries the message returned to the caller.
 */
public enum ValidationFailure {

    MISSING_CREDENTIALS("Authentication required"),
    RATE_LIMITED("Too many authentication attempts. Please try again later."),
    INVALID_FORMAT("Invalid authentication format"),
    UNSUPPORTED_SCHEME("Unsupported auth scheme for basic mode"),
    INVALID_CREDENTIALS("Invalid credentials"),
    BACKEND_ERROR("Invalid credentials");

    private final String publicMessage;

    ValidationFailure(String publicMessage) {
        this.publicMessage = publicMessage;
    }

    public String publicMessage() {
        return publicMessage;
    }
}
