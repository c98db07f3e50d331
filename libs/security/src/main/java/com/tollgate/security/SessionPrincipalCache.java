package com.tollgate.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Caches validated principals per protocol session so that every request of an established
 * session does not reach the database.
 * <p>
 * A lookup hits only when the entry is unexpired and its credential hash equals the caller's.
 * A different credential on the same session is a miss, and the entry stays in place until it
 * is re-validated, invalidated or expires. Expired entries are evicted lazily on lookup and in
 * bulk by {@link #cleanupExpired()}.
 */
public class SessionPrincipalCache {

    private static final Logger log = LoggerFactory.getLogger(SessionPrincipalCache.class);

    private final Duration ttl;
    private final Clock clock;
    private final Map<String, AuthCacheEntry> entries = new HashMap<>();

    public SessionPrincipalCache(Duration ttl, Clock clock) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * @return the cached principal, or empty on miss, expiry or credential mismatch
     */
    public synchronized Optional<String> get(String sessionId, String credentialHash) {
        AuthCacheEntry entry = entries.get(sessionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(clock.instant())) {
            entries.remove(sessionId);
            log.debug("Cached principal expired for session {}", sessionId);
            return Optional.empty();
        }
        if (!entry.credentialHash().equals(credentialHash)) {
            log.warn("Credential changed within session {}; cached principal not reused", sessionId);
            return Optional.empty();
        }
        return Optional.of(entry.principal());
    }

    /**
     * Stores or replaces the entry for {@code sessionId}, expiring {@code ttl} from now.
     */
    public synchronized void set(String sessionId, String principal, String credentialHash) {
        Instant now = clock.instant();
        entries.put(sessionId, new AuthCacheEntry(principal, credentialHash, now, now.plus(ttl)));
    }

    public synchronized void invalidate(String sessionId) {
        entries.remove(sessionId);
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        int before = entries.size();
        entries.values().removeIf(entry -> entry.isExpired(now));
        return before - entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    /** Number of stored entries, expired ones included. */
    public synchronized int size() {
        return entries.size();
    }

    public synchronized CacheStats stats() {
        Instant now = clock.instant();
        int expired = (int) entries.values().stream().filter(entry -> entry.isExpired(now)).count();
        return new CacheStats(entries.size(), entries.size() - expired, expired, ttl);
    }

    public Duration ttl() {
        return ttl;
    }
}
