package com.tollgate.gateway;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Checks caller arguments against a {@link ToolDescriptor} and binds them.
 */
public final class ArgumentBinder {

    private ArgumentBinder() {
        // utility class
    }

    /**
     * @param descriptor  the tool being invoked
     * @param arguments   decoded JSON arguments from the caller, nullable
     * @param injectables server-side objects by key
     * @throws ToolArgumentException for unknown names, missing required values or type mismatches
     */
    public static ToolArguments bind(ToolDescriptor descriptor, Map<String, Object> arguments,
                                     Map<String, Object> injectables) {
        Map<String, Object> supplied = arguments == null ? Map.of() : arguments;
        List<ToolParameter> visible = descriptor.visibleParameters();

        Set<String> known = visible.stream().map(ToolParameter::name).collect(Collectors.toSet());
        Set<String> unknown = new TreeSet<>(supplied.keySet());
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new ToolArgumentException("Unknown arguments for tool " + descriptor.name() + ": " + unknown);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Set<String> missing = new TreeSet<>();
        for (ToolParameter parameter : visible) {
            Object raw = supplied.get(parameter.name());
            if (raw == null) {
                if (parameter.required()) {
                    missing.add(parameter.name());
                } else {
                    values.put(parameter.name(), parameter.defaultValue());
                }
                continue;
            }
            try {
                values.put(parameter.name(), parameter.type().coerce(raw));
            } catch (IllegalArgumentException e) {
                throw new ToolArgumentException("Invalid value for " + parameter.name() + ": " + e.getMessage());
            }
        }
        if (!missing.isEmpty()) {
            throw new ToolArgumentException("Missing required arguments for tool " + descriptor.name() + ": " + missing);
        }

        Map<String, Object> injected = new LinkedHashMap<>();
        for (ToolParameter parameter : descriptor.parameters()) {
            if (parameter.role() == ParameterRole.INJECTED) {
                injected.put(parameter.name(), injectables == null ? null : injectables.get(parameter.name()));
            }
        }
        return new ToolArguments(descriptor.name(), values, injected);
    }

    /**
     * Converts a canonical value into the Java type a reflective handler declares.
     */
    static Object toJavaType(Object value, Class<?> target) {
        if (value == null) {
            if (target.isPrimitive()) {
                throw new ToolArgumentException("missing value for primitive parameter of type " + target.getName());
            }
            return null;
        }
        if (target.isInstance(value)) {
            return value;
        }
        if (value instanceof Number) {
            Number number = (Number) value;
            if (target == int.class || target == Integer.class) {
                return Math.toIntExact(number.longValue());
            }
            if (target == long.class || target == Long.class) {
                return number.longValue();
            }
            if (target == short.class || target == Short.class) {
                return number.shortValue();
            }
            if (target == double.class || target == Double.class) {
                return number.doubleValue();
            }
            if (target == float.class || target == Float.class) {
                return number.floatValue();
            }
            if (target == BigDecimal.class) {
                return BigDecimal.valueOf(number.doubleValue());
            }
        }
        if (value instanceof Boolean && target == boolean.class) {
            return value;
        }
        if (value instanceof List && target.isArray() && target.getComponentType() == String.class) {
            return ((List<?>) value).stream().map(String::valueOf).toArray(String[]::new);
        }
        throw new ToolArgumentException("cannot convert " + value.getClass().getSimpleName() + " to " + target.getName());
    }
}
