package com.tollgate.observability;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable per-request context captured at the transport boundary.
 * <p>
 * One {@code RequestContext} is built for every inbound protocol message (stdio line, HTTP POST,
 * SSE message) and stays read-only until the request completes. Downstream code reads it through
 * {@link RequestContextHolder}; the tool gateway turns it into a session trace tag.
 * <p>
 * The header map never carries credentials: sensitive header values are replaced before the
 * context is built, and the credential itself is only represented by {@link #authTokenSha256()}.
 *
 * @param requestId       unique ID for this request (always present)
 * @param sessionId       protocol session ID, or the request ID when the transport has none
 * @param correlationId   caller-supplied correlation ID ({@code X-Correlation-ID}), nullable
 * @param clientSessionId caller-supplied session ID ({@code X-Session-ID}), nullable
 * @param headers         lower-cased header names to (redacted) values; empty for stdio
 * @param tenant          tenant from {@code X-TD-Tenant} / {@code X-Tenant}, nullable
 * @param userAgent       {@code User-Agent}, nullable
 * @param forwardedFor    raw {@code X-Forwarded-For} chain, nullable
 * @param authScheme      scheme of the Authorization header as sent, nullable
 * @param authTokenSha256 hex SHA-256 of the Authorization credential value, nullable
 * @param assumeUser      resolved principal operations are attributed to, nullable
 * @param clientOrigin    network origin of the caller (socket peer address), nullable
 */
public record RequestContext(
        String requestId,
        String sessionId,
        String correlationId,
        String clientSessionId,
        Map<String, String> headers,
        String tenant,
        String userAgent,
        String forwardedFor,
        String authScheme,
        String authTokenSha256,
        String assumeUser,
        String clientOrigin
) {

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for session ID. */
    public static final String MDC_SESSION_ID = "sessionId";

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant. */
    public static final String MDC_TENANT = "tenant";

    /** MDC key for the resolved principal. */
    public static final String MDC_PRINCIPAL = "principal";

    public RequestContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = requestId;
        }
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /**
     * Minimal context for a local single-client channel: identifiers only, no headers or auth.
     */
    public static RequestContext local(String requestId, String sessionId) {
        return new RequestContext(requestId, sessionId, null, null, Map.of(),
                null, null, null, null, null, null, null);
    }

    /**
     * First hop of the forwarding chain, falling back to the socket peer address. The forwarded
     * hop is client-controlled unless a trusted proxy rewrites the header.
     */
    public String clientIp() {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].strip();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return clientOrigin;
    }

    /**
     * Returns a copy with the resolved principal replaced.
     */
    public RequestContext withAssumeUser(String principal) {
        return new RequestContext(requestId, sessionId, correlationId, clientSessionId, headers,
                tenant, userAgent, forwardedFor, authScheme, authTokenSha256, principal, clientOrigin);
    }

    public static Builder builder(String requestId) {
        return new Builder(requestId);
    }

    /**
     * Builder used by the transport capture strategies, which fill the context field by field.
     */
    public static final class Builder {

        private final String requestId;
        private String sessionId;
        private String correlationId;
        private String clientSessionId;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private String tenant;
        private String userAgent;
        private String forwardedFor;
        private String authScheme;
        private String authTokenSha256;
        private String assumeUser;
        private String clientOrigin;

        private Builder(String requestId) {
            this.requestId = requestId;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder clientSessionId(String clientSessionId) {
            this.clientSessionId = clientSessionId;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (name != null && value != null) {
                        this.headers.put(name, value);
                    }
                });
            }
            return this;
        }

        public Builder tenant(String tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder forwardedFor(String forwardedFor) {
            this.forwardedFor = forwardedFor;
            return this;
        }

        public Builder authScheme(String authScheme) {
            this.authScheme = authScheme;
            return this;
        }

        public Builder authTokenSha256(String authTokenSha256) {
            this.authTokenSha256 = authTokenSha256;
            return this;
        }

        public Builder assumeUser(String assumeUser) {
            this.assumeUser = assumeUser;
            return this;
        }

        public Builder clientOrigin(String clientOrigin) {
            this.clientOrigin = clientOrigin;
            return this;
        }

        public RequestContext build() {
            return new RequestContext(requestId, sessionId, correlationId, clientSessionId, headers,
                    tenant, userAgent, forwardedFor, authScheme, authTokenSha256, assumeUser, clientOrigin);
        }
    }
}
