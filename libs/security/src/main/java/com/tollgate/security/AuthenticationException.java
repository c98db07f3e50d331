package com.tollgate.security;

import java.time.Duration;
import java.util.Optional;

/**
 * Permission failure raised while capturing a request context. Transports map it to their own
 * error shape: HTTP 401 (or 429 with {@code Retry-After} for rate limiting) and a JSON-RPC
 * error body.
 */
public class AuthenticationException extends RuntimeException {

    private final ValidationFailure failure;
    private final Duration retryAfter;

    public AuthenticationException(ValidationFailure failure) {
        this(failure, null);
    }

    public AuthenticationException(ValidationFailure failure, Duration retryAfter) {
        super(failure.publicMessage());
        this.failure = failure;
        this.retryAfter = retryAfter;
    }

    public ValidationFailure failure() {
        return failure;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
