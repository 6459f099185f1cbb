package com.pathway.aggregator.aggregate.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Two-tier read-through cache: local Caffeine first, optional distributed tier second.
 * Distributed failures are logged and never reach the caller.
 */
public class TieredCache {
    public static final String SCOPE_ALL = "all";
    private static final Logger log = LoggerFactory.getLogger(TieredCache.class);

    private final Cache<String, CacheEntry> local;
    private final DistributedCacheTier distributed;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long defaultTtlSeconds;

    public TieredCache(
        ObjectMapper objectMapper,
        Clock clock,
        long maxEntries,
        long defaultTtlSeconds,
        DistributedCacheTier distributed
    ) {
        if (defaultTtlSeconds <= 0) {
            throw new IllegalArgumentException("defaultTtlSeconds must be positive");
        }
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtlSeconds = defaultTtlSeconds;
        this.distributed = distributed;
        this.local = Caffeine.newBuilder()
            .maximumSize(Math.max(1, maxEntries))
            .expireAfter(new EntryTtlExpiry())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        CacheEntry entry = local.getIfPresent(key);
        if (entry != null) {
            if (entry.isExpired(Instant.now(clock))) {
                local.invalidate(key);
            } else {
                @SuppressWarnings("unchecked")
                T value = (T) entry.value();
                return Optional.of(value);
            }
        }
        if (distributed == null) {
            return Optional.empty();
        }
        Optional<String> remote;
        try {
            remote = distributed.get(key);
        } catch (CacheUnavailableException e) {
            log.warn("Distributed cache unavailable on get key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
        if (remote.isEmpty()) {
            return Optional.empty();
        }
        try {
            RemoteEntry stored = objectMapper.readValue(remote.get(), RemoteEntry.class);
            if (stored.ttlSeconds() <= 0 || stored.value() == null) {
                log.warn("Discarding distributed cache value without ttl or payload key={}", key);
                return Optional.empty();
            }
            T value = objectMapper.readerFor(type).readValue(stored.value());
            CacheEntry backfill = new CacheEntry(key, value, Instant.ofEpochMilli(stored.storedAtMillis()), stored.ttlSeconds());
            if (backfill.isExpired(Instant.now(clock))) {
                return Optional.empty();
            }
            local.put(key, backfill);
            return Optional.ofNullable(value);
        } catch (IOException e) {
            log.warn("Discarding unreadable distributed cache value key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void set(String key, Object value, long ttlSeconds) {
        CacheEntry entry = new CacheEntry(key, value, Instant.now(clock), ttlSeconds);
        local.put(key, entry);
        if (distributed == null) {
            return;
        }
        try {
            RemoteEntry stored = new RemoteEntry(
                entry.storedAt().toEpochMilli(),
                ttlSeconds,
                objectMapper.valueToTree(value)
            );
            distributed.set(key, objectMapper.writeValueAsString(stored), Duration.ofSeconds(ttlSeconds));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Skipping distributed cache write key={}: value not serializable ({})", key, e.getMessage());
        } catch (CacheUnavailableException e) {
            log.warn("Distributed cache unavailable on set key={}; kept local copy only: {}", key, e.getMessage());
        }
    }

    public void set(String key, Object value) {
        set(key, value, defaultTtlSeconds);
    }

    public long clear(String scope) {
        boolean all = scope == null || scope.isBlank() || SCOPE_ALL.equalsIgnoreCase(scope.trim());
        String prefix = all ? "" : scope.trim();
        long before = entryCount();
        if (all) {
            local.invalidateAll();
        } else {
            local.asMap().keySet().removeIf(key -> key.startsWith(prefix));
        }
        long removed = Math.max(0, before - entryCount());
        if (distributed != null) {
            try {
                long remoteRemoved = distributed.clear(prefix);
                log.info("Cleared cache scope={} local={} distributed={}", all ? SCOPE_ALL : prefix, removed, remoteRemoved);
                return removed;
            } catch (CacheUnavailableException e) {
                log.warn("Distributed cache unavailable on clear scope={}: {}", prefix, e.getMessage());
            }
        }
        log.info("Cleared cache scope={} local={}", all ? SCOPE_ALL : prefix, removed);
        return removed;
    }

    public long entryCount() {
        local.cleanUp();
        return local.estimatedSize();
    }

    public long defaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public boolean isDistributedEnabled() {
        return distributed != null;
    }

    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {
        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return remainingNanos(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return remainingNanos(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        // ticker time is clock millis in nanos, so the entry's own expiry instant lines up with it
        private static long remainingNanos(CacheEntry value, long currentTime) {
            long expiresAtNanos = TimeUnit.MILLISECONDS.toNanos(value.expiresAt().toEpochMilli());
            return Math.max(0, expiresAtNanos - currentTime);
        }
    }
}
