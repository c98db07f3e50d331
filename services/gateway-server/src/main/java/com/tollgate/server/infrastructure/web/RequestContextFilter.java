package com.tollgate.server.infrastructure.web;

import com.tollgate.gateway.EnvelopeSerializer;
import com.tollgate.observability.RequestContext;
import com.tollgate.observability.RequestContextHolder;
import com.tollgate.security.AuthenticationException;
import com.tollgate.security.ValidationFailure;
import com.tollgate.security.capture.RequestContextCapture;
import com.tollgate.security.capture.TransportRequest;
import com.tollgate.server.mcp.AuthenticationErrors;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Captures the {@link RequestContext} of every MCP request before the transport sees it.
 * <p>
 * The context is installed in {@link RequestContextHolder} for the duration of the filter chain
 * and cleared afterwards. It is also stored as the request attribute {@link #CONTEXT_ATTRIBUTE},
 * from where the streamable transport hands it to tool calls. Authentication failures end the
 * request here: 401 (429 when rate limited, with {@code Retry-After}) and a JSON-RPC error body.
 * Actuator endpoints are not filtered.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestContextFilter.class);

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String SESSION_ID_HEADER = "Mcp-Session-Id";
    public static final String SESSION_ID_PARAM = "sessionId";
    public static final String CONTEXT_ATTRIBUTE = RequestContextFilter.class.getName() + ".CONTEXT";

    private final RequestContextCapture<TransportRequest> capture;

    public RequestContextFilter(RequestContextCapture<TransportRequest> capture) {
        this.capture = capture;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return path.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        RequestContext context;
        try {
            context = capture.capture(toTransportRequest(request));
        } catch (AuthenticationException e) {
            reject(request, response, e);
            return;
        }

        request.setAttribute(CONTEXT_ATTRIBUTE, context);
        RequestContextHolder.set(context);
        response.setHeader(REQUEST_ID_HEADER, context.requestId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContextHolder.clear();
        }
    }

    static TransportRequest toTransportRequest(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        String sessionId = request.getHeader(SESSION_ID_HEADER);
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = request.getParameter(SESSION_ID_PARAM);
        }
        return new TransportRequest(headers, sessionId, request.getRemoteAddr());
    }

    private static void reject(HttpServletRequest request, HttpServletResponse response, AuthenticationException e)
            throws IOException {
        ValidationFailure failure = e.failure();
        boolean rateLimited = failure == ValidationFailure.RATE_LIMITED;
        log.warn("Rejected {} {} from {}: {}", request.getMethod(), request.getRequestURI(),
                request.getRemoteAddr(), failure);

        response.setStatus(rateLimited ? HttpStatus.TOO_MANY_REQUESTS.value() : HttpStatus.UNAUTHORIZED.value());
        if (rateLimited) {
            long seconds = e.retryAfter().map(RequestContextFilter::retryAfterSeconds).orElse(60L);
            response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(seconds));
        } else {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"tollgate\"");
        }
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding("UTF-8");
        EnvelopeSerializer.objectMapper().writeValue(response.getWriter(),
                AuthenticationErrors.toResponse(e));
    }

    static long retryAfterSeconds(Duration duration) {
        long seconds = duration.getSeconds();
        return duration.getNano() > 0 ? seconds + 1 : Math.max(seconds, 1);
    }
}
