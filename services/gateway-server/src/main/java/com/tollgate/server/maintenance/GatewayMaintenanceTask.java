package com.tollgate.server.maintenance;

import com.tollgate.observability.GatewayMetrics;
import com.tollgate.security.RateLimiter;
import com.tollgate.security.SessionPrincipalCache;
import com.tollgate.server.config.GatewayProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired cache entries and idle rate-limiter clients, and exposes both
 * structures' sizes as gauges.
 */
@Component
public class GatewayMaintenanceTask implements SchedulingConfigurer {

    private static final Logger log = LoggerFactory.getLogger(GatewayMaintenanceTask.class);

    public static final String CACHE_SIZE_GAUGE = "tollgate.auth.cache.size";
    public static final String RATE_LIMIT_CLIENTS_GAUGE = "tollgate.auth.ratelimit.clients";

    private final SessionPrincipalCache cache;
    private final RateLimiter rateLimiter;
    private final Duration interval;

    public GatewayMaintenanceTask(SessionPrincipalCache cache, RateLimiter rateLimiter, GatewayMetrics metrics,
                                  GatewayProperties properties) {
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.interval = properties.auth().maintenanceInterval();
        metrics.gauge(CACHE_SIZE_GAUGE, "Cached session principals", cache, SessionPrincipalCache::size);
        metrics.gauge(RATE_LIMIT_CLIENTS_GAUGE, "Clients with authentication attempts in the current window",
                rateLimiter, RateLimiter::trackedClients);
    }

    @Override
    public void configureTasks(ScheduledTaskRegistrar registrar) {
        registrar.addFixedDelayTask(this::runMaintenance, interval);
    }

    public void runMaintenance() {
        int expired = cache.cleanupExpired();
        int idle = rateLimiter.cleanupOld();
        log.debug("Maintenance removed {} expired principals and {} idle rate-limit clients", expired, idle);
    }
}
