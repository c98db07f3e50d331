package com.tollgate.server.config;

import com.tollgate.security.AuthMode;
import com.tollgate.security.GatewaySettings;
import com.tollgate.security.TransportKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Gateway configuration bound from {@code tollgate.gateway.*}.
 *
 * <pre>
 * tollgate:
 *   gateway:
 *     name: tollgate
 *     profile: dba
 *     transport: streamable-http
 *     path: /mcp
 *     worker-threads: 8
 *     auth:
 *       mode: basic
 *       cache-ttl: 300s
 * </pre>
 *
 * @param name          application name used in trace tags, metrics and {@code serverInfo}
 * @param profile       active tool profile, optional
 * @param transport     {@code stdio}, {@code streamable-http} or {@code sse}
 * @param path          request path of the streamable HTTP endpoint
 * @param workerThreads size of the tool worker pool
 * @param queueCapacity calls allowed to wait for a worker before new calls are refused
 * @param auth          credential checking settings
 */
@ConfigurationProperties(prefix = "tollgate.gateway")
@Validated
public record GatewayProperties(
        @NotBlank String name,
        String profile,
        @NotBlank String transport,
        @NotBlank String path,
        @Min(1) Integer workerThreads,
        @Min(0) Integer queueCapacity,
        @Valid Auth auth) {

    public GatewayProperties {
        if (name == null || name.isBlank()) {
            name = GatewaySettings.DEFAULT_APPLICATION_NAME;
        }
        if (transport == null || transport.isBlank()) {
            transport = TransportKind.STDIO.value();
        }
        if (path == null || path.isBlank()) {
            path = "/mcp";
        }
        if (workerThreads == null) {
            workerThreads = 8;
        }
        if (queueCapacity == null) {
            queueCapacity = 100;
        }
        if (auth == null) {
            auth = new Auth(null, null, null, null, null);
        }
    }

    /**
     * @param mode                {@code none} or {@code basic}
     * @param cacheTtl            lifetime of a cached session principal
     * @param rateLimitAttempts   validation attempts per client within the window
     * @param rateLimitWindow     sliding rate-limit window
     * @param maintenanceInterval delay between cache and rate-limiter cleanup runs
     */
    public record Auth(
            String mode,
            Duration cacheTtl,
            @Min(1) Integer rateLimitAttempts,
            Duration rateLimitWindow,
            Duration maintenanceInterval) {

        public Auth {
            if (mode == null || mode.isBlank()) {
                mode = AuthMode.NONE.value();
            }
            if (cacheTtl == null) {
                cacheTtl = GatewaySettings.DEFAULT_CACHE_TTL;
            }
            if (rateLimitAttempts == null) {
                rateLimitAttempts = GatewaySettings.DEFAULT_RATE_LIMIT_ATTEMPTS;
            }
            if (rateLimitWindow == null) {
                rateLimitWindow = GatewaySettings.DEFAULT_RATE_LIMIT_WINDOW;
            }
            if (maintenanceInterval == null || maintenanceInterval.isZero() || maintenanceInterval.isNegative()) {
                maintenanceInterval = Duration.ofSeconds(60);
            }
        }
    }

    /**
     * @throws IllegalArgumentException for an unknown auth mode or transport
     */
    public GatewaySettings toSettings() {
        return new GatewaySettings(
                AuthMode.parse(auth.mode()),
                auth.cacheTtl(),
                auth.rateLimitAttempts(),
                auth.rateLimitWindow(),
                TransportKind.parse(transport),
                name,
                profile);
    }
}
