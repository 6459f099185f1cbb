package com.pathway.aggregator.aggregate.model;

public record CacheStatus(
    long entryCount,
    long ttlSeconds,
    boolean distributedEnabled
) {
}
