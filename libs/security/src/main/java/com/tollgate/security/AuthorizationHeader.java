package com.tollgate.security;

import java.util.Locale;
import java.util.Optional;

/**
 * A parsed {@code Authorization} header: scheme and credential value, split on the first space.
 *
 * @param scheme the scheme exactly as sent (for example {@code Basic})
 * @param value  the credential part after the scheme, trimmed
 */
public record AuthorizationHeader(String scheme, String value) {

    public static final String SCHEME_BASIC = "basic";
    public static final String SCHEME_BEARER = "bearer";

    /**
     * Parses a raw header value.
     *
     * @param header the raw header (may be null)
     * @return the parsed header, or empty if it is blank or has no credential part
     */
    public static Optional<AuthorizationHeader> parse(String header) {
        if (header == null || header.isBlank()) {
            return Optional.empty();
        }
        String trimmed = header.strip();
        int space = trimmed.indexOf(' ');
        if (space <= 0) {
            return Optional.empty();
        }
        String value = trimmed.substring(space + 1).strip();
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AuthorizationHeader(trimmed.substring(0, space), value));
    }

    /** Lower-cased scheme for comparisons. */
    public String normalizedScheme() {
        return scheme.toLowerCase(Locale.ROOT);
    }

    public boolean isBasic() {
        return SCHEME_BASIC.equals(normalizedScheme());
    }

    public boolean isBearer() {
        return SCHEME_BEARER.equals(normalizedScheme());
    }

    public boolean isSupported() {
        return isBasic() || isBearer();
    }

    @Override
    public String toString() {
        return "AuthorizationHeader[scheme=" + scheme + ", value=***]";
    }
}
