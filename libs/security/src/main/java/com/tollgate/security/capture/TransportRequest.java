package com.tollgate.security.capture;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Transport-neutral view of one inbound protocol message.
 *
 * @param headers           header names (lower-cased on construction) to values; empty for stdio
 * @param protocolSessionId session ID assigned by the transport ({@code Mcp-Session-Id}, SSE
 *                          session), nullable
 * @param remoteAddress     socket peer address, nullable
 */
public record TransportRequest(Map<String, String> headers, String protocolSessionId, String remoteAddress) {

    public TransportRequest {
        Map<String, String> lowered = new LinkedHashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (name != null && value != null) {
                    lowered.put(name.toLowerCase(Locale.ROOT), value);
                }
            });
        }
        headers = Map.copyOf(lowered);
    }

    /** A request from the local stdio channel. */
    public static TransportRequest local(String protocolSessionId) {
        return new TransportRequest(Map.of(), protocolSessionId, null);
    }

    /**
     * @param name header name, any case
     * @return the value, or null when absent or blank
     */
    public String header(String name) {
        String value = headers.get(name.toLowerCase(Locale.ROOT));
        return value == null || value.isBlank() ? null : value.strip();
    }

    /** First non-blank value among {@code names}, or null. */
    public String firstHeader(String... names) {
        for (String name : names) {
            String value = header(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
