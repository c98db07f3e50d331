package com.tollgate.security;

import java.util.Locale;

/**
 * Transport shape the protocol front end is served over.
 */
public enum TransportKind {

    STDIO("stdio"),
    STREAMABLE_HTTP("streamable-http"),
    SSE("sse");

    private final String value;

    TransportKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Networked transports carry headers and are subject to authentication; stdio is a local,
     * single-client channel.
     */
    public boolean isNetworked() {
        return this != STDIO;
    }

    public static TransportKind parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return STDIO;
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (TransportKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown transport: " + raw);
    }
}
