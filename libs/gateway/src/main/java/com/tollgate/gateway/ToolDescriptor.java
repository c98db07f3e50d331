package com.tollgate.gateway;

import com.tollgate.database.SessionKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registration-time description of a tool: what it is called, which session it needs and how
 * each of its parameters is supplied. Immutable; computed once when the tool is registered.
 *
 * @param name        tool name, unique within a registry
 * @param description text shown to clients
 * @param sessionKind the session handle the handler receives
 * @param parameters  ordered non-session parameters
 */
public record ToolDescriptor(String name, String description, SessionKind sessionKind,
                             List<ToolParameter> parameters) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (sessionKind == null) {
            throw new IllegalArgumentException("sessionKind must not be null");
        }
        description = description == null ? "" : description.strip();
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        Set<String> seen = new HashSet<>();
        for (ToolParameter parameter : parameters) {
            if (parameter.role() == ParameterRole.SESSION) {
                throw new IllegalArgumentException("session parameter is implied by sessionKind");
            }
            if (parameter.isVisible() && !seen.add(parameter.name())) {
                throw new IllegalArgumentException("duplicate parameter " + parameter.name() + " in tool " + name);
            }
        }
    }

    public List<ToolParameter> visibleParameters() {
        return parameters.stream().filter(ToolParameter::isVisible).toList();
    }

    /**
     * JSON Schema object advertised to clients. Lists visible parameters only; a parameter is
     * required when it has no default and is marked required.
     */
    public Map<String, Object> inputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        for (ToolParameter parameter : visibleParameters()) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.type().schemaName());
            if (!parameter.description().isEmpty()) {
                property.put("description", parameter.description());
            }
            if (parameter.defaultValue() != null) {
                property.put("default", parameter.defaultValue());
            }
            properties.put(parameter.name(), property);
            if (parameter.required()) {
                required.add(parameter.name());
            }
        }
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", required);
        return schema;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {

        private final String name;
        private String description;
        private SessionKind sessionKind = SessionKind.MANAGED;
        private final List<ToolParameter> parameters = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sessionKind(SessionKind sessionKind) {
            this.sessionKind = sessionKind;
            return this;
        }

        public Builder parameter(ToolParameter parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder required(String name, ParameterType type, String description) {
            return parameter(ToolParameter.required(name, type, description));
        }

        public Builder optional(String name, ParameterType type, String description, Object defaultValue) {
            return parameter(ToolParameter.optional(name, type, description, defaultValue));
        }

        public ToolDescriptor build() {
            return new ToolDescriptor(name, description, sessionKind, parameters);
        }
    }
}
