package com.pathway.aggregator.aggregate.ratelimit;

import java.time.Instant;

/**
 * Admission state for one provider. {@code lastAdmittedAt} only moves forward and is written
 * exclusively by {@link ProviderRateLimiter} while holding this instance's monitor.
 */
public final class ProviderConfig {
    private static final long MILLIS_PER_HOUR = 3_600_000L;

    private final String name;
    private final int rateLimitPerHour;
    private Instant lastAdmittedAt;

    public ProviderConfig(String name, int rateLimitPerHour) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name is required");
        }
        if (rateLimitPerHour <= 0) {
            throw new IllegalArgumentException("rateLimitPerHour must be positive for " + name);
        }
        this.name = name;
        this.rateLimitPerHour = rateLimitPerHour;
    }

    public String name() {
        return name;
    }

    public int rateLimitPerHour() {
        return rateLimitPerHour;
    }

    public long minIntervalMs() {
        return MILLIS_PER_HOUR / rateLimitPerHour;
    }

    public synchronized Instant lastAdmittedAt() {
        return lastAdmittedAt;
    }

    synchronized boolean tryAdmit(Instant now) {
        if (lastAdmittedAt != null && now.toEpochMilli() - lastAdmittedAt.toEpochMilli() < minIntervalMs()) {
            return false;
        }
        if (lastAdmittedAt == null || now.isAfter(lastAdmittedAt)) {
            lastAdmittedAt = now;
        }
        return true;
    }
}
