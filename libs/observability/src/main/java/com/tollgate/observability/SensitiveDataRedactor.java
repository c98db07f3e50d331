package com.tollgate.observability;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Replaces credential-bearing header values before they are stored in a {@link RequestContext}
 * or written to a log line.
 * <p>
 * A header is sensitive when its name contains one of the configured fragments
 * (case-insensitive). The default fragments cover Authorization, cookies, API keys, tokens,
 * secrets and passwords.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_FRAGMENTS = Set.of(
            "authorization", "cookie", "token", "secret", "password", "api-key", "apikey", "credential"
    );

    private final Set<String> sensitiveFragments;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive name fragments.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_FRAGMENTS);
    }

    /**
     * Creates a redactor with custom sensitive name fragments (case-insensitive).
     *
     * @param fragments header-name fragments to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            throw new IllegalArgumentException("fragments must not be null or empty");
        }
        this.sensitiveFragments = Set.copyOf(fragments);
        String regex = String.join("|", sensitiveFragments.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with lower-cased header names and sensitive values replaced by
     * {@value #REDACTED}. Null names or values are dropped; null input returns an empty map.
     *
     * @param headers raw header map
     * @return redacted copy preserving iteration order
     */
    public Map<String, String> redactHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(headers.size());
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String name = entry.getKey().toLowerCase(Locale.ROOT);
            result.put(name, isSensitive(name) ? REDACTED : entry.getValue());
        }
        return result;
    }

    /**
     * Checks whether a header name matches any sensitive fragment.
     *
     * @param name the header name to check
     * @return true if the name contains a sensitive fragment
     */
    public boolean isSensitive(String name) {
        if (name == null) {
            return false;
        }
        return compiledPattern.matcher(name).find();
    }

    public Set<String> sensitiveFragments() {
        return sensitiveFragments;
    }
}
