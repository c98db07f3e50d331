package com.tollgate.gateway;

/**
 * How a handler parameter is supplied.
 */
public enum ParameterRole {

    /** The per-invocation session handle. */
    SESSION,

    /** The name the tool was invoked under. */
    TOOL_NAME,

    /** A named server-side object, such as a feature-store configuration. */
    INJECTED,

    /** Supplied by the caller and advertised in the input schema. */
    VISIBLE
}
