package com.tollgate.server.infrastructure.stdio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tollgate.database.ConnectionProvider;
import com.tollgate.database.DataSession;
import com.tollgate.gateway.ParameterType;
import com.tollgate.gateway.ToolDescriptor;
import com.tollgate.gateway.ToolInvocationGateway;
import com.tollgate.gateway.ToolRegistry;
import com.tollgate.observability.GatewayMetrics;
import com.tollgate.observability.RequestContext;
import com.tollgate.observability.RequestContextHolder;
import com.tollgate.observability.SpanHelper;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.capture.StdioRequestContextCapture;
import com.tollgate.server.mcp.GatewayToolSpecifications;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.modelcontextprotocol.server.McpAsyncServer;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.opentelemetry.api.OpenTelemetry;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

@DisplayName("StdioServerRunner")
class StdioServerRunnerTest {

    @Test
    @DisplayName("returns once stdin has ended and closes the server")
    void returnsAtEndOfInput() throws Exception {
        EndOfInputLatch stdin = new EndOfInputLatch(new ByteArrayInputStream(new byte[0]));
        stdin.readAllBytes();
        McpAsyncServer server = mock(McpAsyncServer.class);
        AtomicBoolean closed = new AtomicBoolean();
        when(server.closeGracefully()).thenReturn(Mono.fromRunnable(() -> closed.set(true)));

        new StdioServerRunner(stdin, server).run(null);

        assertThat(closed).isTrue();
    }

    @Nested
    @DisplayName("over the stdio transport")
    class OverStdio {

        private static final ObjectMapper MAPPER = new ObjectMapper();

        private final List<RequestContext> seen = new CopyOnWriteArrayList<>();
        private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        private PipedOutputStream client;
        private EndOfInputLatch stdin;
        private GatewayToolSpecifications tools;
        private McpAsyncServer server;

        @BeforeEach
        void setUp() throws Exception {
            ConnectionProvider provider = mock(ConnectionProvider.class);
            when(provider.isAvailable()).thenReturn(true);
            when(provider.openSession()).thenReturn(mock(DataSession.class));
            ToolRegistry registry = new ToolRegistry();
            registry.registerManaged(ToolDescriptor.builder("base_echo")
                            .description("Echo")
                            .required("text", ParameterType.STRING, "text to echo")
                            .build(),
                    (session, args) -> {
                        seen.add(RequestContextHolder.get().orElse(null));
                        return args.getString("text");
                    });
            ToolInvocationGateway gateway = new ToolInvocationGateway(registry, provider, (connection, tag) -> { },
                    GatewaySettings.defaults(), Map.of(), Runnable::run,
                    new GatewayMetrics(new SimpleMeterRegistry(), "tollgate-test"),
                    new SpanHelper(OpenTelemetry.noop().getTracer("test")));
            tools = new GatewayToolSpecifications(gateway, new StdioRequestContextCapture());

            client = new PipedOutputStream();
            stdin = new EndOfInputLatch(new PipedInputStream(client, 64 * 1024));
            server = McpServer.async(new StdioServerTransportProvider(MAPPER, stdin, stdout))
                    .serverInfo("tollgate-test", "dev")
                    .tools(tools.specifications())
                    .build();
        }

        @AfterEach
        void tearDown() throws Exception {
            client.close();
            server.close();
        }

        private void send(String line) throws Exception {
            client.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            client.flush();
        }

        private JsonNode awaitResponse(int id) throws Exception {
            long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
            while (System.nanoTime() < deadline) {
                Optional<JsonNode> found = responseWithId(id);
                if (found.isPresent()) {
                    return found.get();
                }
                Thread.sleep(20);
            }
            throw new AssertionError("No response with id " + id + " in: " + stdout);
        }

        private Optional<JsonNode> responseWithId(int id) throws Exception {
            for (String line : stdout.toString(StandardCharsets.UTF_8).split("\n")) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode message = MAPPER.readTree(line);
                if (message.has("id") && message.get("id").asInt() == id) {
                    return Optional.of(message);
                }
            }
            return Optional.empty();
        }

        private void initialize() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":"
                    + "\"2024-11-05\",\"capabilities\":{},\"clientInfo\":{\"name\":\"test\",\"version\":\"1\"}}}");
            awaitResponse(1);
            send("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}");
        }

        @Test
        @DisplayName("answers initialize with the server name")
        void initializeAnswered() throws Exception {
            send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"protocolVersion\":"
                    + "\"2024-11-05\",\"capabilities\":{},\"clientInfo\":{\"name\":\"test\",\"version\":\"1\"}}}");

            JsonNode response = awaitResponse(1);

            assertThat(response.get("result").get("serverInfo").get("name").asText()).isEqualTo("tollgate-test");
        }

        @Test
        @DisplayName("runs tool calls under the process session")
        void toolCallsUseProcessSession() throws Exception {
            initialize();

            send("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
                    + "\"params\":{\"name\":\"base_echo\",\"arguments\":{\"text\":\"hi\"}}}");
            send("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\","
                    + "\"params\":{\"name\":\"base_echo\",\"arguments\":{\"text\":\"again\"}}}");

            JsonNode first = awaitResponse(2);
            awaitResponse(3);
            assertThat(first.get("result").get("isError").asBoolean()).isFalse();
            assertThat(first.get("result").get("content").get(0).get("text").asText()).contains("hi");
            assertThat(seen).hasSize(2).allSatisfy(context ->
                    assertThat(context.sessionId()).isEqualTo(tools.localSessionId()));
        }

        @Test
        @DisplayName("releases the runner when the client closes stdin")
        void endOfInput() throws Exception {
            initialize();

            client.close();

            assertThat(stdin.await(10, TimeUnit.SECONDS)).isTrue();
        }
    }
}
