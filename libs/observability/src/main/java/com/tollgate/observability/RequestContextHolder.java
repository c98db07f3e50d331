package com.tollgate.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Thread-local holder for the current {@link RequestContext} with an SLF4J MDC bridge.
 * <p>
 * While a context is set, the MDC carries requestId, sessionId, correlationId, tenant and
 * principal so every log line written on this thread is attributable to the request. Clearing
 * removes the keys again.
 * <p>
 * Tool handlers run on worker threads. The gateway captures the context on the calling thread
 * and re-establishes it on the worker with {@link #callWithContext(RequestContext, Callable)}.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
        // Utility class
    }

    /**
     * Sets the request context for the current thread and populates SLF4J MDC.
     *
     * @param context the request context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(RequestContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's request context, if set.
     */
    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Clears the request context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Runs {@code work} with {@code context} installed, then restores whatever was there before.
     * A null context runs the work with no context installed.
     *
     * @param context the context for the duration of the call, nullable
     * @param work    the work to execute
     * @return the value returned by {@code work}
     * @throws Exception whatever {@code work} throws
     */
    public static <T> T callWithContext(RequestContext context, Callable<T> work) throws Exception {
        RequestContext previous = CONTEXT.get();
        try {
            if (context != null) {
                set(context);
            } else {
                clear();
            }
            return work.call();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Void variant of {@link #callWithContext(RequestContext, Callable)}.
     */
    public static void runWithContext(RequestContext context, Runnable runnable) {
        try {
            callWithContext(context, () -> {
                runnable.run();
                return null;
            });
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected checked exception from runnable", e);
        }
    }

    private static void populateMdc(RequestContext ctx) {
        setMdc(RequestContext.MDC_REQUEST_ID, ctx.requestId());
        setMdc(RequestContext.MDC_SESSION_ID, ctx.sessionId());
        setMdc(RequestContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(RequestContext.MDC_TENANT, ctx.tenant());
        setMdc(RequestContext.MDC_PRINCIPAL, ctx.assumeUser());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(RequestContext.MDC_REQUEST_ID);
        MDC.remove(RequestContext.MDC_SESSION_ID);
        MDC.remove(RequestContext.MDC_CORRELATION_ID);
        MDC.remove(RequestContext.MDC_TENANT);
        MDC.remove(RequestContext.MDC_PRINCIPAL);
    }
}
