package com.tollgate.security;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of {@link CredentialValidator#validate(String, String)}: either a principal, or a
 * failure kind. Callers switch on {@link #failure()}.
 *
 * @param principal  resolved database user, null on failure
 * @param failure    failure kind, null on success
 * @param retryAfter how long to wait before retrying, only for {@link ValidationFailure#RATE_LIMITED}
 */
public record ValidationOutcome(String principal, ValidationFailure failure, Duration retryAfter) {

    public static ValidationOutcome success(String principal) {
        if (principal == null || principal.isBlank()) {
            throw new IllegalArgumentException("principal must not be null or blank");
        }
        return new ValidationOutcome(principal, null, null);
    }

    public static ValidationOutcome failure(ValidationFailure failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new ValidationOutcome(null, failure, null);
    }

    public static ValidationOutcome rateLimited(Duration retryAfter) {
        return new ValidationOutcome(null, ValidationFailure.RATE_LIMITED, retryAfter);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<Duration> retryAfterHint() {
        return Optional.ofNullable(retryAfter);
    }
}
