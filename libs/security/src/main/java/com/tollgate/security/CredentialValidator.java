package com.tollgate.security;

import com.tollgate.observability.GatewayMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Validates an {@code Authorization} header against the database.
 * <p>
 * Order of checks:
 * <ol>
 *   <li>the caller's fingerprint must have budget left in the {@link RateLimiter}; an exhausted
 *       budget fails without touching the database</li>
 *   <li>the scheme must be Basic or Bearer</li>
 *   <li>the credential must be well formed (Basic: base64 {@code user:secret} with an identifier
 *       username; Bearer: three dot-separated segments)</li>
 *   <li>the {@link CredentialVerifier} must accept it</li>
 * </ol>
 * A success clears the fingerprint's budget. Verifier exceptions never escape; they are
 * reported as {@link ValidationFailure#BACKEND_ERROR}.
 */
public class CredentialValidator {

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private final RateLimiter rateLimiter;
    private final CredentialVerifier verifier;
    private final GatewayMetrics metrics;

    public CredentialValidator(RateLimiter rateLimiter, CredentialVerifier verifier) {
        this(rateLimiter, verifier, null);
    }

    /**
     * @param metrics optional; when present every outcome is counted
     */
    public CredentialValidator(RateLimiter rateLimiter, CredentialVerifier verifier, GatewayMetrics metrics) {
        if (rateLimiter == null) {
            throw new IllegalArgumentException("rateLimiter must not be null");
        }
        if (verifier == null) {
            throw new IllegalArgumentException("verifier must not be null");
        }
        this.rateLimiter = rateLimiter;
        this.verifier = verifier;
        this.metrics = metrics;
    }

    /**
     * @param authorizationHeader raw Authorization header, nullable
     * @param clientOrigin        caller's network origin, nullable
     */
    public ValidationOutcome validate(String authorizationHeader, String clientOrigin) {
        ValidationOutcome outcome = doValidate(authorizationHeader, clientOrigin);
        if (metrics != null) {
            metrics.recordAuthAttempt(outcome.isSuccess()
                    ? "success"
                    : outcome.failure().name().toLowerCase(Locale.ROOT));
        }
        return outcome;
    }

    private ValidationOutcome doValidate(String authorizationHeader, String clientOrigin) {
        String clientId = CredentialHashes.fingerprint(authorizationHeader, clientOrigin);
        if (!rateLimiter.isAllowed(clientId)) {
            log.warn("Rate limit exceeded for client {}", clientId);
            return ValidationOutcome.rateLimited(rateLimiter.window());
        }

        Optional<AuthorizationHeader> parsed = AuthorizationHeader.parse(authorizationHeader);
        if (parsed.isEmpty()) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_FORMAT);
        }
        AuthorizationHeader header = parsed.get();

        ValidationOutcome outcome;
        try {
            if (header.isBasic()) {
                outcome = validateBasic(header.value());
            } else if (header.isBearer()) {
                outcome = validateBearer(header.value());
            } else {
                outcome = ValidationOutcome.failure(ValidationFailure.UNSUPPORTED_SCHEME);
            }
        } catch (RuntimeException e) {
            log.error("Credential verification failed against the database: {}", e.getMessage(), e);
            outcome = ValidationOutcome.failure(ValidationFailure.BACKEND_ERROR);
        }

        if (outcome.isSuccess()) {
            rateLimiter.clear(clientId);
            log.info("Authenticated principal {} via {}", outcome.principal(), header.normalizedScheme());
        } else {
            log.warn("Credential validation failed ({}) for client {}", outcome.failure(), clientId);
        }
        return outcome;
    }

    private ValidationOutcome validateBasic(String encoded) {
        Optional<BasicCredentials> decoded = CredentialFormats.decodeBasic(encoded);
        if (decoded.isEmpty()) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_FORMAT);
        }
        BasicCredentials credentials = decoded.get();
        if (credentials.username().isEmpty() || credentials.secret().isEmpty()) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_CREDENTIALS);
        }
        if (!CredentialFormats.isValidIdentifier(credentials.username())) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_FORMAT);
        }
        if (!verifier.verifyBasic(credentials.username(), credentials.secret())) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_CREDENTIALS);
        }
        return ValidationOutcome.success(credentials.username());
    }

    private ValidationOutcome validateBearer(String token) {
        if (!CredentialFormats.isValidBearerToken(token)) {
            return ValidationOutcome.failure(ValidationFailure.INVALID_FORMAT);
        }
        return verifier.resolveBearerIdentity(token)
                .filter(identity -> !identity.isBlank())
                .map(ValidationOutcome::success)
                .orElseGet(() -> ValidationOutcome.failure(ValidationFailure.INVALID_CREDENTIALS));
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }
}
