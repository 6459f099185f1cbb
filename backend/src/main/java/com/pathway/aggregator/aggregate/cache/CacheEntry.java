package com.pathway.aggregator.aggregate.cache;

import java.time.Instant;

public record CacheEntry(
    String key,
    Object value,
    Instant storedAt,
    long ttlSeconds
) {
    public CacheEntry {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive for key " + key);
        }
    }

    public Instant expiresAt() {
        return storedAt.plusSeconds(ttlSeconds);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
