package com.tollgate.gateway;

/**
 * Caller-supplied arguments do not fit a tool's visible parameters.
 */
public class ToolArgumentException extends IllegalArgumentException {

    public ToolArgumentException(String message) {
        super(message);
    }
}
