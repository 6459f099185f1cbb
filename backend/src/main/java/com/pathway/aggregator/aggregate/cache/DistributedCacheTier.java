package com.pathway.aggregator.aggregate.cache;

import java.time.Duration;
import java.util.Optional;

public interface DistributedCacheTier {
    Optional<String> get(String key);

    void set(String key, String json, Duration ttl);

    /**
     * Removes every key starting with {@code prefix}; an empty prefix removes all keys owned by this tier.
     */
    long clear(String prefix);
}
