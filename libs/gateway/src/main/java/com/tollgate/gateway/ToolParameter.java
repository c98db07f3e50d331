package com.tollgate.gateway;

/**
 * One handler parameter.
 *
 * @param name         argument name; for {@link ParameterRole#INJECTED} the injectable key
 * @param type         schema type, only meaningful for visible parameters
 * @param description  text shown to clients
 * @param required     whether a caller must supply it
 * @param defaultValue value used when an optional argument is absent, nullable
 * @param role         how the value is supplied
 */
public record ToolParameter(String name, ParameterType type, String description, boolean required,
                            Object defaultValue, ParameterRole role) {

    public ToolParameter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role must not be null");
        }
        if (role == ParameterRole.VISIBLE && type == null) {
            throw new IllegalArgumentException("visible parameter " + name + " needs a type");
        }
        if (description == null) {
            description = "";
        }
        if (defaultValue != null) {
            required = false;
            if (type != null) {
                defaultValue = type.coerce(defaultValue);
            }
        }
    }

    public static ToolParameter required(String name, ParameterType type, String description) {
        return new ToolParameter(name, type, description, true, null, ParameterRole.VISIBLE);
    }

    public static ToolParameter optional(String name, ParameterType type, String description, Object defaultValue) {
        return new ToolParameter(name, type, description, false, defaultValue, ParameterRole.VISIBLE);
    }

    public static ToolParameter toolName(String name) {
        return new ToolParameter(name, null, "", false, null, ParameterRole.TOOL_NAME);
    }

    public static ToolParameter injected(String key) {
        return new ToolParameter(key, null, "", false, null, ParameterRole.INJECTED);
    }

    public boolean isVisible() {
        return role == ParameterRole.VISIBLE;
    }
}
