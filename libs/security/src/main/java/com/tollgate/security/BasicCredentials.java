package com.tollgate.security;

/**
 * Decoded Basic credentials. The secret is masked in {@link #toString()}.
 */
public record BasicCredentials(String username, String secret) {

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", secret=***]";
    }
}
