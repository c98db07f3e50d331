package com.tollgate.server.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.tollgate.observability.RequestContext;
import com.tollgate.observability.RequestContextHolder;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        RequestContextHolder.clear();
    }

    @Test
    @DisplayName("keeps the status of unsupported method errors")
    void unsupportedMethod() {
        ResponseEntity<McpSchema.JSONRPCResponse> result = handler.handleUnsupported(
                new HttpRequestMethodNotSupportedException("PUT"));

        assertThat(result.getStatusCode().value()).isEqualTo(405);
        assertThat(result.getBody().error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_REQUEST);
    }

    @Test
    @DisplayName("answers unknown paths with 404")
    void unknownPath() {
        ResponseEntity<McpSchema.JSONRPCResponse> result = handler.handleUnsupported(
                new NoResourceFoundException(HttpMethod.GET, "nowhere"));

        assertThat(result.getStatusCode().value()).isEqualTo(404);
        assertThat(result.getBody().jsonrpc()).isEqualTo(McpSchema.JSONRPC_VERSION);
    }

    @Test
    @DisplayName("maps unexpected exceptions to 500 without leaking the message")
    @SuppressWarnings("unchecked")
    void genericException() {
        RequestContextHolder.set(RequestContext.builder("req-1").correlationId("corr-9").build());

        ResponseEntity<McpSchema.JSONRPCResponse> result =
                handler.handleGeneric(new IllegalStateException("pool exploded"));

        assertThat(result.getStatusCode().value()).isEqualTo(500);
        McpSchema.JSONRPCResponse.JSONRPCError error = result.getBody().error();
        assertThat(error.code()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR);
        assertThat(error.message()).isEqualTo("Internal error");
        assertThat((Map<String, Object>) error.data())
                .containsEntry("requestId", "req-1")
                .containsEntry("correlationId", "corr-9")
                .containsKey("timestamp");
    }
}
