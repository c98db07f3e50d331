package com.tollgate.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tollgate.gateway.EnvelopeSerializer;
import com.tollgate.gateway.ResponseEnvelope;
import com.tollgate.gateway.ToolDescriptor;
import com.tollgate.gateway.ToolInvocationGateway;
import com.tollgate.observability.RequestContext;
import com.tollgate.observability.RequestContextHolder;
import com.tollgate.security.AuthenticationException;
import com.tollgate.security.capture.RequestContextCapture;
import com.tollgate.security.capture.TransportRequest;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpTransportContext;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Publishes the gateway's registered tools to the MCP server.
 * <p>
 * Each tool becomes an asynchronous tool specification whose input schema lists the
 * caller-visible parameters only. A call runs under the caller's {@link RequestContext},
 * resolved in this order:
 * <ol>
 *   <li>the context placed in the MCP transport context by {@link RequestContextTransportExtractor}</li>
 *   <li>the context installed on the calling thread by the HTTP filter</li>
 *   <li>a local capture under one session per process, which is how stdio callers are seen</li>
 * </ol>
 * The gateway result is returned as a single text item holding the serialized envelope, with
 * {@code isError} mirroring the envelope status.
 */
public class GatewayToolSpecifications {

    private static final Logger log = LoggerFactory.getLogger(GatewayToolSpecifications.class);

    /** Transport context key of the caller's {@link RequestContext}. */
    public static final String CONTEXT_KEY = "tollgate.request-context";

    private final ToolInvocationGateway gateway;
    private final RequestContextCapture<TransportRequest> localCapture;
    private final String localSessionId = UUID.randomUUID().toString();

    public GatewayToolSpecifications(ToolInvocationGateway gateway,
                                     RequestContextCapture<TransportRequest> localCapture) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway must not be null");
        }
        if (localCapture == null) {
            throw new IllegalArgumentException("localCapture must not be null");
        }
        this.gateway = gateway;
        this.localCapture = localCapture;
    }

    public List<McpServerFeatures.AsyncToolSpecification> specifications() {
        List<McpServerFeatures.AsyncToolSpecification> specifications = new ArrayList<>();
        for (ToolDescriptor descriptor : gateway.registry().descriptors()) {
            specifications.add(McpServerFeatures.AsyncToolSpecification.builder()
                    .tool(toTool(descriptor))
                    .callHandler((exchange, request) -> call(request))
                    .build());
        }
        return specifications;
    }

    static McpSchema.Tool toTool(ToolDescriptor descriptor) {
        String schema;
        try {
            schema = EnvelopeSerializer.objectMapper().writeValueAsString(descriptor.inputSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Input schema of tool " + descriptor.name() + " is not serializable", e);
        }
        return McpSchema.Tool.builder()
                .name(descriptor.name())
                .description(descriptor.description())
                .inputSchema(schema)
                .build();
    }

    Mono<McpSchema.CallToolResult> call(McpSchema.CallToolRequest request) {
        return Mono.<ResponseEnvelope>deferContextual(view -> {
            McpTransportContext transport = view.getOrDefault(McpTransportContext.KEY, McpTransportContext.EMPTY);
            RequestContext context;
            try {
                context = resolveContext(transport);
            } catch (AuthenticationException e) {
                log.warn("Refused call to tool {}: {}", request.name(), e.failure());
                return Mono.<ResponseEnvelope>error(AuthenticationErrors.toMcpError(e));
            }
            return Mono.fromFuture(invoke(context, request));
        }).map(GatewayToolSpecifications::toResult);
    }

    RequestContext resolveContext(McpTransportContext transport) {
        Object carried = transport == null ? null : transport.get(CONTEXT_KEY);
        if (carried instanceof RequestContext) {
            return (RequestContext) carried;
        }
        Optional<RequestContext> current = RequestContextHolder.get();
        if (current.isPresent()) {
            return current.get();
        }
        return localCapture.capture(TransportRequest.local(localSessionId));
    }

    private CompletableFuture<ResponseEnvelope> invoke(RequestContext context, McpSchema.CallToolRequest request) {
        try {
            return RequestContextHolder.callWithContext(context,
                    () -> gateway.invoke(request.name(), request.arguments()));
        } catch (Exception e) {
            log.error("Tool {} could not be dispatched", request.name(), e);
            return CompletableFuture.completedFuture(
                    ResponseEnvelope.error("Internal error", Map.of("tool_name", String.valueOf(request.name()))));
        }
    }

    static McpSchema.CallToolResult toResult(ResponseEnvelope envelope) {
        return new McpSchema.CallToolResult(
                List.of(new McpSchema.TextContent(EnvelopeSerializer.serialize(envelope))), envelope.isError());
    }

    public String localSessionId() {
        return localSessionId;
    }
}
