package com.pathway.aggregator.aggregate.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class ProviderRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(ProviderRateLimiter.class);

    private final Map<String, ProviderConfig> configs = new ConcurrentHashMap<>();
    private final Clock clock;

    public ProviderRateLimiter(Clock clock) {
        this.clock = clock;
    }

    public void register(String provider, int rateLimitPerHour) {
        String key = key(provider);
        configs.put(key, new ProviderConfig(key, rateLimitPerHour));
    }

    public boolean tryAdmit(String provider) {
        ProviderConfig config = configs.get(key(provider));
        if (config == null) {
            log.debug("Provider {} has no rate limit registration; denying", provider);
            return false;
        }
        boolean admitted = config.tryAdmit(Instant.now(clock));
        if (!admitted) {
            log.debug("Provider {} denied: min interval {} ms not elapsed since {}",
                provider, config.minIntervalMs(), config.lastAdmittedAt());
        }
        return admitted;
    }

    public ProviderConfig config(String provider) {
        return configs.get(key(provider));
    }

    public List<ProviderConfig> configs() {
        return new ArrayList<>(configs.values());
    }

    private static String key(String provider) {
        return provider == null ? "" : provider.trim().toLowerCase(Locale.ROOT);
    }
}
