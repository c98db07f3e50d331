package com.tollgate.gateway;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Uniform result of a tool invocation, serialized as
 * {@code {"status": "success", "results": ..., "metadata": {...}}} or
 * {@code {"status": "error", "message": "...", "metadata": {...}}}.
 *
 * @param status   {@value #SUCCESS} or {@value #ERROR}
 * @param results  handler output, success only
 * @param message  failure description, error only
 * @param metadata tool-specific facts about the call, nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResponseEnvelope(String status, Object results, String message, Map<String, Object> metadata) {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static ResponseEnvelope success(Object results, Map<String, Object> metadata) {
        return new ResponseEnvelope(SUCCESS, results, null, metadata);
    }

    public static ResponseEnvelope error(String message, Map<String, Object> metadata) {
        return new ResponseEnvelope(ERROR, null, message, metadata);
    }

    @JsonIgnore
    public boolean isError() {
        return ERROR.equals(status);
    }
}
