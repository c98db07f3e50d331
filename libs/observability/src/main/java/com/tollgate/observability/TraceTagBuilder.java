package com.tollgate.observability;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Builds the diagnostic trace tag applied to a data-plane session before a tool runs.
 * <p>
 * The tag is a sequence of {@code KEY=value;} pairs suitable for a backend session-tagging
 * statement (for example {@code SET QUERY_BAND = '...' FOR SESSION}). Values are sanitized:
 * {@code ;} becomes {@code _}, {@code '} is doubled, surrounding whitespace is trimmed.
 * A null value produces no segment at all.
 */
public final class TraceTagBuilder {

    /** Number of hex characters of the credential hash carried in the tag. */
    static final int AUTH_HASH_PREFIX = 12;

    private TraceTagBuilder() {
        // utility class
    }

    /**
     * Builds the tag for one tool invocation.
     *
     * @param application application name
     * @param profile     active profile, nullable
     * @param processId   process identity, see {@link #processIdentity()}
     * @param toolName    tool being invoked
     * @param context     request context of the caller, nullable
     * @return the tag string, possibly empty
     */
    public static String build(String application, String profile, String processId,
                               String toolName, RequestContext context) {
        StringBuilder tag = new StringBuilder();
        append(tag, "APPLICATION", application);
        append(tag, "PROFILE", profile);
        append(tag, "PROCESS_ID", processId);
        append(tag, "TOOL_NAME", toolName);

        if (context != null) {
            append(tag, "REQUEST_ID", context.requestId());
            append(tag, "SESSION_ID", context.sessionId());
            append(tag, "TENANT", context.tenant());
            append(tag, "CLIENT_IP", context.clientIp());
            append(tag, "USER_AGENT", context.userAgent());
            append(tag, "AUTH_SCHEME", context.authScheme());
            String authHash = context.authTokenSha256();
            if (authHash != null && !authHash.isEmpty()) {
                append(tag, "AUTH_HASH", authHash.substring(0, Math.min(AUTH_HASH_PREFIX, authHash.length())));
            }
            String principal = context.assumeUser();
            if (principal != null && !principal.isEmpty()) {
                append(tag, "PROXYUSER", principal);
            }
        }
        return tag.toString();
    }

    /**
     * Rewrites a value so it cannot terminate a tag pair or the enclosing SQL literal.
     *
     * @param value raw value, nullable
     * @return the sanitized value, empty for null
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return value.replace(";", "_").replace("'", "''").strip();
    }

    /**
     * Returns {@code host:pid} for the running JVM.
     */
    public static String processIdentity() {
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "unknown-host";
        }
        return host + ":" + ProcessHandle.current().pid();
    }

    private static void append(StringBuilder tag, String key, String value) {
        if (value == null) {
            return;
        }
        tag.append(key).append('=').append(sanitize(value)).append(';');
    }
}
