package com.tollgate.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Thin wrapper around an OpenTelemetry {@link Tracer} that stamps the current
 * {@link RequestContext} onto every span it opens.
 * <p>
 * The helper does not configure the SDK. Without an SDK on the classpath the global tracer is a
 * no-op and spans cost nothing.
 */
public final class SpanHelper {

    private final Tracer tracer;

    /**
     * @param tracer the OpenTelemetry tracer
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Executes {@code callable} inside a new INTERNAL span.
     *
     * @param spanName   name for the span
     * @param attributes additional span attributes
     * @param callable   the work to execute within the span
     * @return the result of the callable
     * @throws Exception if the callable throws; the span is marked as failed first
     */
    public <T> T withSpan(String spanName, Map<String, String> attributes, Callable<T> callable) throws Exception {
        var spanBuilder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(spanBuilder::setAttribute);
        Span span = spanBuilder.startSpan();

        RequestContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("request.id", ctx.requestId());
            span.setAttribute("session.id", ctx.sessionId());
            if (ctx.tenant() != null) {
                span.setAttribute("tenant", ctx.tenant());
            }
            if (ctx.assumeUser() != null) {
                span.setAttribute("enduser.id", ctx.assumeUser());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = callable.call();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (Exception e) {
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public Tracer tracer() {
        return tracer;
    }
}
