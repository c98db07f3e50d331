package com.tollgate.gateway;

import com.tollgate.database.ConnectionProvider;
import com.tollgate.database.DataSession;
import com.tollgate.database.SessionKind;
import com.tollgate.database.SessionTagException;
import com.tollgate.database.SessionTagger;
import com.tollgate.observability.GatewayMetrics;
import com.tollgate.observability.RequestContext;
import com.tollgate.observability.RequestContextHolder;
import com.tollgate.observability.SpanHelper;
import com.tollgate.observability.TraceTagBuilder;
import com.tollgate.security.GatewaySettings;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Single invocation contract for every registered tool.
 * <p>
 * For each call the gateway binds the caller's arguments, makes sure a connection resource
 * exists (reconnecting at most once), opens the session kind the tool declares, applies the
 * trace tag for the current {@link RequestContext}, runs the handler on the worker executor and
 * releases the session on every exit path. The result is always a {@link ResponseEnvelope};
 * no exception crosses this boundary.
 * <p>
 * The caller's request context is captured on the calling thread and re-established on the
 * worker, so handler logging carries the request's MDC keys. Abandoning the returned future
 * does not interrupt the worker: the handler completes, the session is released and the
 * result is discarded.
 */
public class ToolInvocationGateway {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationGateway.class);

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_ERROR = "error";
    static final String OUTCOME_REJECTED = "rejected";

    private final ToolRegistry registry;
    private final ConnectionProvider connectionProvider;
    private final SessionTagger sessionTagger;
    private final GatewaySettings settings;
    private final Map<String, Object> injectables;
    private final Executor executor;
    private final GatewayMetrics metrics;
    private final SpanHelper spanHelper;
    private final String processId;

    public ToolInvocationGateway(ToolRegistry registry, ConnectionProvider connectionProvider,
                                 SessionTagger sessionTagger, GatewaySettings settings,
                                 Map<String, Object> injectables, Executor executor,
                                 GatewayMetrics metrics, SpanHelper spanHelper) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (connectionProvider == null) {
            throw new IllegalArgumentException("connectionProvider must not be null");
        }
        if (sessionTagger == null) {
            throw new IllegalArgumentException("sessionTagger must not be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (spanHelper == null) {
            throw new IllegalArgumentException("spanHelper must not be null");
        }
        this.registry = registry;
        this.connectionProvider = connectionProvider;
        this.sessionTagger = sessionTagger;
        this.settings = settings == null ? GatewaySettings.defaults() : settings;
        this.injectables = injectables == null ? Map.of() : Map.copyOf(injectables);
        this.executor = executor;
        this.metrics = metrics;
        this.spanHelper = spanHelper;
        this.processId = TraceTagBuilder.processIdentity();
    }

    /**
     * Invokes {@code toolName} with decoded JSON {@code arguments}.
     *
     * @return a future that always completes normally with an envelope
     */
    public CompletableFuture<ResponseEnvelope> invoke(String toolName, Map<String, Object> arguments) {
        Optional<RegisteredTool> found = registry.find(toolName);
        if (found.isEmpty()) {
            metrics.recordInvocation(GatewayMetrics.UNKNOWN_TOOL, OUTCOME_REJECTED);
            return CompletableFuture.completedFuture(
                    ResponseEnvelope.error("Unknown tool: " + toolName, metadata(toolName)));
        }
        RegisteredTool tool = found.get();

        ToolArguments bound;
        try {
            bound = ArgumentBinder.bind(tool.descriptor(), arguments, injectables);
        } catch (ToolArgumentException e) {
            log.warn("Rejected call to tool {}: {}", toolName, e.getMessage());
            metrics.recordInvocation(toolName, OUTCOME_REJECTED);
            return CompletableFuture.completedFuture(ResponseEnvelope.error(e.getMessage(), metadata(toolName)));
        }

        RequestContext context = RequestContextHolder.get().orElse(null);
        try {
            return CompletableFuture.supplyAsync(() -> runOnWorker(tool, bound, context), executor);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool saturated; rejecting call to tool {}", toolName);
            metrics.recordInvocation(toolName, OUTCOME_REJECTED);
            return CompletableFuture.completedFuture(
                    ResponseEnvelope.error("Server is busy, please retry", metadata(toolName)));
        }
    }

    private ResponseEnvelope runOnWorker(RegisteredTool tool, ToolArguments arguments, RequestContext context) {
        try {
            return RequestContextHolder.callWithContext(context, () -> execute(tool, arguments, context));
        } catch (Exception e) {
            log.error("Unexpected failure running tool {}", tool.name(), e);
            return ResponseEnvelope.error(describe(e), metadata(tool.name()));
        }
    }

    private ResponseEnvelope execute(RegisteredTool tool, ToolArguments arguments, RequestContext context) {
        String name = tool.name();
        Timer.Sample sample = Timer.start(metrics.registry());
        ResponseEnvelope envelope;
        try {
            envelope = spanHelper.withSpan("tool " + name,
                    Map.of("tool.name", name, "tool.session_kind", tool.descriptor().sessionKind().name()),
                    () -> runHandler(tool, arguments, context));
        } catch (Exception e) {
            log.error("Tool {} failed: {}", name, describe(e), e);
            envelope = ResponseEnvelope.error(describe(e), metadata(name));
        } finally {
            sample.stop(metrics.toolTimer(name));
        }
        metrics.recordInvocation(name, envelope.isError() ? OUTCOME_ERROR : OUTCOME_SUCCESS);
        return envelope;
    }

    private ResponseEnvelope runHandler(RegisteredTool tool, ToolArguments arguments,
                                        RequestContext context) throws Exception {
        ensureConnection();
        if (tool.descriptor().sessionKind() == SessionKind.MANAGED) {
            try (DataSession session = connectionProvider.openSession()) {
                Optional<ResponseEnvelope> refused = applyTag(session.connection(), tool.name(), context);
                if (refused.isPresent()) {
                    return refused.get();
                }
                return toEnvelope(tool.invoke(session, arguments), tool.name());
            }
        }
        try (Connection connection = connectionProvider.openRawConnection()) {
            Optional<ResponseEnvelope> refused = applyTag(connection, tool.name(), context);
            if (refused.isPresent()) {
                return refused.get();
            }
            return toEnvelope(tool.invoke(connection, arguments), tool.name());
        }
    }

    private void ensureConnection() {
        if (!connectionProvider.isAvailable()) {
            log.info("No live database connection; reconnecting");
            connectionProvider.reconnect();
        }
    }

    /**
     * @return an error envelope when the tool must not run
     */
    private Optional<ResponseEnvelope> applyTag(Connection connection, String toolName, RequestContext context) {
        if (context == null) {
            return Optional.empty();
        }
        String tag = TraceTagBuilder.build(settings.applicationName(), settings.profile(), processId, toolName, context);
        try {
            sessionTagger.apply(connection, tag);
            log.debug("Session tag applied: {}", tag);
            return Optional.empty();
        } catch (SessionTagException e) {
            if (settings.requiresCredentials()) {
                log.error("Refusing tool {}: session tag could not be applied", toolName, e);
                return Optional.of(ResponseEnvelope.error("Cannot run tool '" + toolName
                        + "': failed to apply session tag for basic auth. Error: " + e.getMessage(),
                        metadata(toolName)));
            }
            log.warn("Could not apply session tag for tool {}: {}", toolName, e.getMessage());
            return Optional.empty();
        }
    }

    private static ResponseEnvelope toEnvelope(Object result, String toolName) {
        if (result instanceof ResponseEnvelope) {
            return (ResponseEnvelope) result;
        }
        return ResponseEnvelope.success(result, metadata(toolName));
    }

    private static Map<String, Object> metadata(String toolName) {
        return Map.of("tool_name", String.valueOf(toolName));
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    public ToolRegistry registry() {
        return registry;
    }
}
