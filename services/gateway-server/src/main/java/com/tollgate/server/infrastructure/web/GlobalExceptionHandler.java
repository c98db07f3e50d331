package com.tollgate.server.infrastructure.web;

import com.tollgate.observability.RequestContextHolder;
import io.modelcontextprotocol.spec.McpSchema;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions that escape the MCP routes to JSON-RPC error responses. Every error carries a
 * timestamp and, when a request context is installed, the request and correlation ids.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({HttpRequestMethodNotSupportedException.class, HttpMediaTypeNotSupportedException.class,
            NoResourceFoundException.class})
    public ResponseEntity<McpSchema.JSONRPCResponse> handleUnsupported(Exception ex) {
        HttpStatusCode status = ((ErrorResponse) ex).getStatusCode();
        log.debug("Unsupported request: {}", ex.getMessage());
        return respond(status, McpSchema.ErrorCodes.INVALID_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotAcceptableException.class)
    public ResponseEntity<Void> handleNotAcceptable(HttpMediaTypeNotAcceptableException ex) {
        log.debug("Not acceptable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_ACCEPTABLE).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<McpSchema.JSONRPCResponse> handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, McpSchema.ErrorCodes.INTERNAL_ERROR, "Internal error");
    }

    private static ResponseEntity<McpSchema.JSONRPCResponse> respond(HttpStatusCode status, int code, String message) {
        var error = new McpSchema.JSONRPCResponse.JSONRPCError(code, message, diagnostics());
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, null, null, error));
    }

    private static Map<String, Object> diagnostics() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("timestamp", Instant.now().toString());
        RequestContextHolder.get().ifPresent(ctx -> {
            data.put("requestId", ctx.requestId());
            if (ctx.correlationId() != null) {
                data.put("correlationId", ctx.correlationId());
            }
        });
        return data;
    }
}
