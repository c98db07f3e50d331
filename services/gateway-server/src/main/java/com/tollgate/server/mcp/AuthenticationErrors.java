package com.tollgate.server.mcp;

import com.tollgate.security.AuthenticationException;
import com.tollgate.security.ValidationFailure;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;

/**
 * JSON-RPC errors for callers refused by credential checking.
 */
public final class AuthenticationErrors {

    /** Credentials missing, malformed or rejected. */
    public static final int UNAUTHORIZED = -32001;

    /** Too many failed authentication attempts from this client. */
    public static final int RATE_LIMITED = -32002;

    private AuthenticationErrors() {
        // utility class
    }

    public static int codeFor(AuthenticationException e) {
        return e.failure() == ValidationFailure.RATE_LIMITED ? RATE_LIMITED : UNAUTHORIZED;
    }

    /**
     * Standalone error response written before a request reaches the MCP server. The message is
     * the failure's public text only.
     */
    public static McpSchema.JSONRPCResponse toResponse(AuthenticationException e) {
        return new McpSchema.JSONRPCResponse(McpSchema.JSONRPC_VERSION, null, null,
                new McpSchema.JSONRPCResponse.JSONRPCError(codeFor(e), e.getMessage(), null));
    }

    public static McpError toMcpError(AuthenticationException e) {
        return McpError.builder(codeFor(e)).message(e.getMessage()).build();
    }
}
