package com.tollgate.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Sliding-window limiter for credential validation attempts, keyed by client fingerprint.
 * <p>
 * Each client has a queue of attempt timestamps. Before every decision the queue is pruned of
 * entries older than {@code now - window}; an attempt is accepted only while fewer than
 * {@code maxAttempts} remain. Rejected attempts are not recorded. All operations hold the
 * instance lock briefly and never perform I/O.
 */
public class RateLimiter {

    private final int maxAttempts;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> attempts = new HashMap<>();

    public RateLimiter(int maxAttempts, Duration window, Clock clock) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.maxAttempts = maxAttempts;
        this.window = window;
        this.clock = clock;
    }

    /**
     * Records an attempt for {@code clientId} if the budget allows it.
     *
     * @return true when the attempt is allowed (and recorded), false when the budget is exhausted
     */
    public synchronized boolean isAllowed(String clientId) {
        Instant now = clock.instant();
        Deque<Instant> queue = attempts.computeIfAbsent(clientId, id -> new ArrayDeque<>());
        prune(queue, now);
        if (queue.size() >= maxAttempts) {
            return false;
        }
        queue.addLast(now);
        return true;
    }

    /**
     * Attempts left for {@code clientId} in the current window, without recording one.
     */
    public synchronized int remainingAttempts(String clientId) {
        Deque<Instant> queue = attempts.get(clientId);
        if (queue == null) {
            return maxAttempts;
        }
        prune(queue, clock.instant());
        return Math.max(0, maxAttempts - queue.size());
    }

    /**
     * Forgets every attempt of {@code clientId}; called after a successful authentication.
     */
    public synchronized void clear(String clientId) {
        attempts.remove(clientId);
    }

    /**
     * Prunes every queue and drops the ones left empty.
     *
     * @return number of clients removed
     */
    public synchronized int cleanupOld() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, Deque<Instant>>> it = attempts.entrySet().iterator();
        while (it.hasNext()) {
            Deque<Instant> queue = it.next().getValue();
            prune(queue, now);
            if (queue.isEmpty()) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    /** Number of clients currently tracked. */
    public synchronized int trackedClients() {
        return attempts.size();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration window() {
        return window;
    }

    private void prune(Deque<Instant> queue, Instant now) {
        Instant cutoff = now.minus(window);
        while (!queue.isEmpty() && queue.peekFirst().isBefore(cutoff)) {
            queue.pollFirst();
        }
    }
}
