package com.tollgate.gateway;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bound arguments of one invocation: visible values (coerced, defaults applied), the invoked
 * tool name and the injectables the handler declared.
 */
public final class ToolArguments {

    private final String toolName;
    private final Map<String, Object> values;
    private final Map<String, Object> injected;

    public ToolArguments(String toolName, Map<String, Object> values, Map<String, Object> injected) {
        this.toolName = toolName;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.injected = Collections.unmodifiableMap(new LinkedHashMap<>(injected));
    }

    public String toolName() {
        return toolName;
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Long getLong(String name) {
        return (Long) values.get(name);
    }

    public Double getDouble(String name) {
        return (Double) values.get(name);
    }

    public Boolean getBoolean(String name) {
        return (Boolean) values.get(name);
    }

    public <T> T injected(String key, Class<T> type) {
        return type.cast(injected.get(key));
    }

    public Object injected(String key) {
        return injected.get(key);
    }

    /** Visible values by name. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ToolArguments[tool=" + toolName + ", values=" + values.keySet() + "]";
    }
}
