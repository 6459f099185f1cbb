package com.pathway.aggregator.aggregate.cache;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

public class RedisCacheTier implements DistributedCacheTier {
    static final String KEY_PREFIX = "aggregator:";

    private final StringRedisTemplate redisTemplate;

    public RedisCacheTier(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(KEY_PREFIX + key));
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("redis get failed for " + key, e);
        }
    }

    @Override
    public void set(String key, String json, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(KEY_PREFIX + key, json, ttl);
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("redis set failed for " + key, e);
        }
    }

    @Override
    public long clear(String prefix) {
        String pattern = KEY_PREFIX + (prefix == null ? "" : prefix) + "*";
        try {
            Set<String> keys = redisTemplate.keys(pattern);
            if (keys == null || keys.isEmpty()) {
                return 0;
            }
            Long deleted = redisTemplate.delete(keys);
            return deleted == null ? 0 : deleted;
        } catch (DataAccessException e) {
            throw new CacheUnavailableException("redis clear failed for " + pattern, e);
        }
    }
}
