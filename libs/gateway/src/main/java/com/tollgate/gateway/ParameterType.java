package com.tollgate.gateway;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON Schema type of a visible tool parameter, with coercion of decoded JSON values into the
 * canonical Java representation: {@code String}, {@code Long}, {@code Double}, {@code Boolean},
 * {@code List} or {@code Map}.
 */
public enum ParameterType {

    STRING("string"),
    INTEGER("integer"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String schemaName;

    ParameterType(String schemaName) {
        this.schemaName = schemaName;
    }

    public String schemaName() {
        return schemaName;
    }

    /**
     * Converts {@code value} to this type's canonical representation.
     *
     * @throws IllegalArgumentException when the value cannot represent this type
     */
    public Object coerce(Object value) {
        if (value == null) {
            return null;
        }
        switch (this) {
            case STRING:
                if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                    return value.toString();
                }
                break;
            case INTEGER:
                if (value instanceof Long) {
                    return value;
                }
                if (value instanceof Integer || value instanceof Short || value instanceof Byte
                        || value instanceof BigInteger) {
                    return ((Number) value).longValue();
                }
                if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
                    double d = ((Number) value).doubleValue();
                    if (d == Math.rint(d) && !Double.isInfinite(d)) {
                        return (long) d;
                    }
                }
                if (value instanceof String) {
                    try {
                        return Long.parseLong(((String) value).strip());
                    } catch (NumberFormatException e) {
                        throw mismatch(value);
                    }
                }
                break;
            case NUMBER:
                if (value instanceof Number) {
                    return ((Number) value).doubleValue();
                }
                if (value instanceof String) {
                    try {
                        return Double.parseDouble(((String) value).strip());
                    } catch (NumberFormatException e) {
                        throw mismatch(value);
                    }
                }
                break;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                if (value instanceof String) {
                    String s = ((String) value).strip().toLowerCase(Locale.ROOT);
                    if (s.equals("true") || s.equals("false")) {
                        return Boolean.valueOf(s);
                    }
                }
                break;
            case ARRAY:
                if (value instanceof List) {
                    return value;
                }
                if (value instanceof Collection) {
                    return List.copyOf((Collection<?>) value);
                }
                break;
            case OBJECT:
                if (value instanceof Map) {
                    return value;
                }
                break;
            default:
                break;
        }
        throw mismatch(value);
    }

    /**
     * Maps a handler's Java parameter type to the schema type it is exposed as.
     */
    public static ParameterType forJavaType(Class<?> type) {
        if (type == String.class || type == CharSequence.class) {
            return STRING;
        }
        if (type == int.class || type == Integer.class || type == long.class || type == Long.class
                || type == short.class || type == Short.class) {
            return INTEGER;
        }
        if (type == double.class || type == Double.class || type == float.class || type == Float.class
                || type == BigDecimal.class) {
            return NUMBER;
        }
        if (type == boolean.class || type == Boolean.class) {
            return BOOLEAN;
        }
        if (List.class.isAssignableFrom(type) || type.isArray()) {
            return ARRAY;
        }
        if (Map.class.isAssignableFrom(type)) {
            return OBJECT;
        }
        throw new IllegalArgumentException("Unsupported tool parameter type: " + type.getName());
    }

    private IllegalArgumentException mismatch(Object value) {
        return new IllegalArgumentException("expected " + schemaName + " but got "
                + value.getClass().getSimpleName().toLowerCase(Locale.ROOT));
    }
}
