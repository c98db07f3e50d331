package com.tollgate.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.gateway.ToolInvocationGateway;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.capture.RequestContextCapture;
import com.tollgate.security.capture.TransportRequest;
import com.tollgate.server.infrastructure.stdio.EndOfInputLatch;
import com.tollgate.server.mcp.GatewayToolSpecifications;
import com.tollgate.server.mcp.RequestContextTransportExtractor;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.server.transport.WebMvcSseServerTransportProvider;
import io.modelcontextprotocol.server.transport.WebMvcStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

/**
 * MCP server for the configured transport. Exactly one of the nested configurations is active.
 */
@Configuration
public class McpServerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(McpServerConfiguration.class);

    static final String TRANSPORT_PROPERTY = "transport";
    static final String PREFIX = "tollgate.gateway";

    /** Message endpoint of the SSE transport; the stream itself is served on {@code /sse}. */
    public static final String SSE_MESSAGE_ENDPOINT = "/messages";

    @Bean
    public GatewayToolSpecifications gatewayToolSpecifications(ToolInvocationGateway gateway,
                                                               RequestContextCapture<TransportRequest> capture) {
        return new GatewayToolSpecifications(gateway, capture);
    }

    static McpAsyncServer buildServer(McpServer.AsyncSpecification<?> specification, GatewaySettings settings,
                                      GatewayToolSpecifications tools) {
        String version = McpServerConfiguration.class.getPackage().getImplementationVersion();
        McpAsyncServer server = specification
                .serverInfo(settings.applicationName(), version == null ? "dev" : version)
                .capabilities(McpSchema.ServerCapabilities.builder().tools(false).build())
                .tools(tools.specifications())
                .build();
        log.info("MCP server '{}' ready on {} transport", settings.applicationName(), settings.transport().value());
        return server;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = PREFIX, name = TRANSPORT_PROPERTY, havingValue = "streamable-http")
    static class StreamableHttp {

        // TODO: expire idle streamable sessions once the SDK exposes a per-session close.
        @Bean
        WebMvcStreamableServerTransportProvider streamableTransport(ObjectMapper objectMapper,
                                                                   GatewayProperties properties) {
            return WebMvcStreamableServerTransportProvider.builder()
                    .objectMapper(objectMapper)
                    .mcpEndpoint(properties.path())
                    .contextExtractor(new RequestContextTransportExtractor())
                    .build();
        }

        @Bean
        RouterFunction<ServerResponse> mcpRoutes(WebMvcStreamableServerTransportProvider transport) {
            return transport.getRouterFunction();
        }

        @Bean
        McpAsyncServer mcpServer(WebMvcStreamableServerTransportProvider transport, GatewaySettings settings,
                                 GatewayToolSpecifications tools) {
            return buildServer(McpServer.async(transport), settings, tools);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = PREFIX, name = TRANSPORT_PROPERTY, havingValue = "sse")
    static class Sse {

        @Bean
        WebMvcSseServerTransportProvider sseTransport(ObjectMapper objectMapper) {
            return new WebMvcSseServerTransportProvider(objectMapper, SSE_MESSAGE_ENDPOINT);
        }

        @Bean
        RouterFunction<ServerResponse> mcpRoutes(WebMvcSseServerTransportProvider transport) {
            return transport.getRouterFunction();
        }

        @Bean
        McpAsyncServer mcpServer(WebMvcSseServerTransportProvider transport, GatewaySettings settings,
                                 GatewayToolSpecifications tools) {
            return buildServer(McpServer.async(transport), settings, tools);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = PREFIX, name = TRANSPORT_PROPERTY, havingValue = "stdio", matchIfMissing = true)
    static class Stdio {

        @Bean
        EndOfInputLatch stdin() {
            return new EndOfInputLatch(System.in);
        }

        @Bean
        StdioServerTransportProvider stdioTransport(ObjectMapper objectMapper, EndOfInputLatch stdin) {
            return new StdioServerTransportProvider(objectMapper, stdin, System.out);
        }

        @Bean
        McpAsyncServer mcpServer(StdioServerTransportProvider transport, GatewaySettings settings,
                                 GatewayToolSpecifications tools) {
            return buildServer(McpServer.async(transport), settings, tools);
        }
    }
}
