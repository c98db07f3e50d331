package com.tollgate.security;

import java.time.Instant;

/**
 * A validated principal bound to the credential hash that proved it.
 *
 * @param principal      the resolved database user
 * @param credentialHash hex SHA-256 of the credential value
 * @param createdAt      when the principal was validated
 * @param expiresAt      first instant at which the entry no longer counts
 */
public record AuthCacheEntry(String principal, String credentialHash, Instant createdAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
