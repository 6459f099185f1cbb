package com.pathway.aggregator.aggregate.cache;

import com.fasterxml.jackson.databind.JsonNode;

public record RemoteEntry(
    long storedAtMillis,
    long ttlSeconds,
    JsonNode value
) {
}
