package com.tollgate.security.capture;

import com.tollgate.observability.RequestContext;
import com.tollgate.observability.SensitiveDataRedactor;
import com.tollgate.security.AuthMode;
import com.tollgate.security.AuthenticationException;
import com.tollgate.security.AuthorizationHeader;
import com.tollgate.security.CredentialFormats;
import com.tollgate.security.CredentialHashes;
import com.tollgate.security.CredentialValidator;
import com.tollgate.security.SessionPrincipalCache;
import com.tollgate.security.ValidationFailure;
import com.tollgate.security.ValidationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Capture for networked transports (streamable HTTP, SSE).
 * <p>
 * Reads correlation, tenant and client headers into the context and, in {@link AuthMode#BASIC},
 * resolves the principal: first from the {@link SessionPrincipalCache} keyed by session and
 * credential hash, then through the {@link CredentialValidator}. In {@link AuthMode#NONE} an
 * optional {@code X-Assume-User} header names the principal.
 */
public class HttpRequestContextCapture implements RequestContextCapture<TransportRequest> {

    private static final Logger log = LoggerFactory.getLogger(HttpRequestContextCapture.class);

    public static final String HEADER_AUTHORIZATION = "authorization";
    public static final String HEADER_ASSUME_USER = "x-assume-user";

    private final AuthMode authMode;
    private final SessionPrincipalCache cache;
    private final CredentialValidator validator;
    private final SensitiveDataRedactor redactor;

    public HttpRequestContextCapture(AuthMode authMode, SessionPrincipalCache cache,
                                     CredentialValidator validator, SensitiveDataRedactor redactor) {
        if (authMode == null) {
            throw new IllegalArgumentException("authMode must not be null");
        }
        if (authMode == AuthMode.BASIC && (cache == null || validator == null)) {
            throw new IllegalArgumentException("basic auth mode requires a cache and a validator");
        }
        this.authMode = authMode;
        this.cache = cache;
        this.validator = validator;
        this.redactor = redactor == null ? new SensitiveDataRedactor() : redactor;
    }

    @Override
    public RequestContext capture(TransportRequest request) {
        String requestId = UUID.randomUUID().toString();
        String rawAuthorization = request.header(HEADER_AUTHORIZATION);
        Optional<AuthorizationHeader> authorization = AuthorizationHeader.parse(rawAuthorization);

        RequestContext.Builder builder = RequestContext.builder(requestId)
                .sessionId(request.protocolSessionId())
                .correlationId(request.firstHeader("x-correlation-id", "correlation-id"))
                .clientSessionId(request.header("x-session-id"))
                .headers(redactor.redactHeaders(request.headers()))
                .tenant(request.firstHeader("x-td-tenant", "x-tenant"))
                .userAgent(request.header("user-agent"))
                .forwardedFor(request.header("x-forwarded-for"))
                .clientOrigin(request.remoteAddress());
        authorization.ifPresent(header -> builder
                .authScheme(header.scheme())
                .authTokenSha256(CredentialHashes.sha256Hex(header.value())));
        RequestContext context = builder.build();

        if (authMode == AuthMode.NONE) {
            return context.withAssumeUser(assumedUser(request));
        }
        return context.withAssumeUser(authenticate(context, rawAuthorization, authorization));
    }

    private String assumedUser(TransportRequest request) {
        String assumed = request.header(HEADER_ASSUME_USER);
        if (assumed == null) {
            return null;
        }
        if (!CredentialFormats.isValidIdentifier(assumed)) {
            log.warn("Ignoring invalid X-Assume-User header");
            return null;
        }
        return assumed;
    }

    private String authenticate(RequestContext context, String rawAuthorization,
                                Optional<AuthorizationHeader> authorization) {
        if (rawAuthorization == null) {
            throw new AuthenticationException(ValidationFailure.MISSING_CREDENTIALS);
        }
        String sessionId = context.sessionId();
        String credentialHash = context.authTokenSha256();

        if (authorization.isPresent()) {
            Optional<String> cached = cache.get(sessionId, credentialHash);
            if (cached.isPresent()) {
                log.debug("Reusing cached principal for session {}", sessionId);
                return cached.get();
            }
            if (!authorization.get().isSupported()) {
                throw new AuthenticationException(ValidationFailure.UNSUPPORTED_SCHEME);
            }
        }

        ValidationOutcome outcome = validator.validate(rawAuthorization, context.clientIp());
        if (outcome.isSuccess()) {
            cache.set(sessionId, outcome.principal(), credentialHash);
            return outcome.principal();
        }
        switch (outcome.failure()) {
            case RATE_LIMITED:
                throw new AuthenticationException(ValidationFailure.RATE_LIMITED, outcome.retryAfter());
            case INVALID_FORMAT:
                throw new AuthenticationException(ValidationFailure.INVALID_FORMAT);
            default:
                throw new AuthenticationException(ValidationFailure.INVALID_CREDENTIALS);
        }
    }

    public AuthMode authMode() {
        return authMode;
    }
}
