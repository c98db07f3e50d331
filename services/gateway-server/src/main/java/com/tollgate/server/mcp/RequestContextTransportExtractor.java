package com.tollgate.server.mcp;

import com.tollgate.server.infrastructure.web.RequestContextFilter;
import io.modelcontextprotocol.server.McpTransportContext;
import io.modelcontextprotocol.server.McpTransportContextExtractor;
import org.springframework.web.servlet.function.ServerRequest;

/**
 * Hands the context captured by {@link RequestContextFilter} to the MCP server, which carries
 * it to tool handlers in the Reactor context under {@link McpTransportContext#KEY}.
 */
public class RequestContextTransportExtractor implements McpTransportContextExtractor<ServerRequest> {

    @Override
    public McpTransportContext extract(ServerRequest request, McpTransportContext transportContext) {
        request.attribute(RequestContextFilter.CONTEXT_ATTRIBUTE)
                .ifPresent(context -> transportContext.put(GatewayToolSpecifications.CONTEXT_KEY, context));
        return transportContext;
    }
}
