package com.tollgate.security;

import java.time.Duration;

/**
 * Process-wide gateway settings, built once at startup and never mutated.
 *
 * @param authMode          credential checking mode for networked transports
 * @param cacheTtl          lifetime of a cached session principal
 * @param rateLimitAttempts validation attempts allowed per client within the window
 * @param rateLimitWindow   sliding window for the rate limiter
 * @param transport         transport the server runs on
 * @param applicationName   application name carried in trace tags and metrics
 * @param profile           active tool profile, nullable
 */
public record GatewaySettings(
        AuthMode authMode,
        Duration cacheTtl,
        int rateLimitAttempts,
        Duration rateLimitWindow,
        TransportKind transport,
        String applicationName,
        String profile
) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(300);
    public static final int DEFAULT_RATE_LIMIT_ATTEMPTS = 5;
    public static final Duration DEFAULT_RATE_LIMIT_WINDOW = Duration.ofSeconds(60);
    public static final String DEFAULT_APPLICATION_NAME = "tollgate";

    public GatewaySettings {
        if (authMode == null) {
            authMode = AuthMode.NONE;
        }
        if (cacheTtl == null || cacheTtl.isZero() || cacheTtl.isNegative()) {
            cacheTtl = DEFAULT_CACHE_TTL;
        }
        if (rateLimitAttempts <= 0) {
            rateLimitAttempts = DEFAULT_RATE_LIMIT_ATTEMPTS;
        }
        if (rateLimitWindow == null || rateLimitWindow.isZero() || rateLimitWindow.isNegative()) {
            rateLimitWindow = DEFAULT_RATE_LIMIT_WINDOW;
        }
        if (transport == null) {
            transport = TransportKind.STDIO;
        }
        if (applicationName == null || applicationName.isBlank()) {
            applicationName = DEFAULT_APPLICATION_NAME;
        }
        if (profile != null && profile.isBlank()) {
            profile = null;
        }
    }

    /**
     * Settings with every default applied: no auth, stdio transport.
     */
    public static GatewaySettings defaults() {
        return new GatewaySettings(null, null, 0, null, null, null, null);
    }

    public boolean requiresCredentials() {
        return authMode == AuthMode.BASIC;
    }
}
