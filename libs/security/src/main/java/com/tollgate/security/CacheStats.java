package com.tollgate.security;

import java.time.Duration;

/**
 * Snapshot of {@link SessionPrincipalCache} occupancy.
 */
public record CacheStats(int totalEntries, int activeEntries, int expiredEntries, Duration ttl) {
}
