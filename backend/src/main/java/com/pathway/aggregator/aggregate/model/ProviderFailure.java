package com.pathway.aggregator.aggregate.model;

public record ProviderFailure(
    String provider,
    String reason
) {
}
