package com.tollgate.security;

import java.util.Locale;

/**
 * How inbound networked requests are authenticated.
 */
public enum AuthMode {

    /** No credential checks; an optional {@code X-Assume-User} header names the principal. */
    NONE("none"),

    /** Every request carries Basic or Bearer credentials validated against the database. */
    BASIC("basic");

    private final String value;

    AuthMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses a configured mode, case-insensitively.
     *
     * @throws IllegalArgumentException for anything other than {@code none} or {@code basic}
     */
    public static AuthMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (AuthMode mode : values()) {
            if (mode.value.equals(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown auth mode: " + raw);
    }
}
