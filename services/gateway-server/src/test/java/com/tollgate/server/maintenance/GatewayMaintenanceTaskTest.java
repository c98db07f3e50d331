package com.tollgate.server.maintenance;

import static org.assertj.core.api.Assertions.assertThat;

import com.tollgate.observability.GatewayMetrics;
import com.tollgate.security.RateLimiter;
import com.tollgate.security.SessionPrincipalCache;
import com.tollgate.security.testing.MutableClock;
import com.tollgate.server.config.GatewayProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GatewayMaintenanceTask")
class GatewayMaintenanceTaskTest {

    private MutableClock clock;
    private SessionPrincipalCache cache;
    private RateLimiter rateLimiter;
    private SimpleMeterRegistry registry;
    private GatewayMaintenanceTask task;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        cache = new SessionPrincipalCache(Duration.ofMinutes(5), clock);
        rateLimiter = new RateLimiter(5, Duration.ofSeconds(60), clock);
        registry = new SimpleMeterRegistry();
        task = new GatewayMaintenanceTask(cache, rateLimiter, new GatewayMetrics(registry, "tollgate-test"),
                new GatewayProperties(null, null, null, null, null, null, null));
    }

    private double gauge(String name) {
        return registry.get(name).gauge().value();
    }

    @Test
    @DisplayName("gauges follow cache and rate limiter sizes")
    void gauges() {
        cache.set("s1", "alice", "hash-a");
        cache.set("s2", "bob", "hash-b");
        rateLimiter.isAllowed("10.0.0.1");

        assertThat(gauge(GatewayMaintenanceTask.CACHE_SIZE_GAUGE)).isEqualTo(2.0);
        assertThat(gauge(GatewayMaintenanceTask.RATE_LIMIT_CLIENTS_GAUGE)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("drops expired principals and idle clients")
    void removesStaleEntries() {
        cache.set("s1", "alice", "hash-a");
        rateLimiter.isAllowed("10.0.0.1");
        clock.advance(Duration.ofMinutes(6));
        cache.set("s2", "bob", "hash-b");

        task.runMaintenance();

        assertThat(cache.size()).isEqualTo(1);
        assertThat(rateLimiter.trackedClients()).isZero();
        assertThat(gauge(GatewayMaintenanceTask.CACHE_SIZE_GAUGE)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("keeps live entries")
    void keepsLiveEntries() {
        cache.set("s1", "alice", "hash-a");
        rateLimiter.isAllowed("10.0.0.1");
        clock.advance(Duration.ofSeconds(30));

        task.runMaintenance();

        assertThat(cache.size()).isEqualTo(1);
        assertThat(rateLimiter.trackedClients()).isEqualTo(1);
    }

    @Test
    @DisplayName("drops state of sessions that were never closed")
    void abandonedSessions() {
        for (int i = 0; i < 1_000; i++) {
            cache.set("abandoned-" + i, "alice", "hash-a");
            rateLimiter.isAllowed("10.0.0." + (i % 250));
        }
        assertThat(gauge(GatewayMaintenanceTask.CACHE_SIZE_GAUGE)).isEqualTo(1_000.0);

        clock.advance(Duration.ofDays(30));
        task.runMaintenance();

        assertThat(cache.size()).isZero();
        assertThat(rateLimiter.trackedClients()).isZero();
        assertThat(gauge(GatewayMaintenanceTask.CACHE_SIZE_GAUGE)).isZero();
    }
}
