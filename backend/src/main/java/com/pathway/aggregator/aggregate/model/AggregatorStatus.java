package com.pathway.aggregator.aggregate.model;

import java.util.List;

public record AggregatorStatus(
    List<ProviderStatus> providers,
    CacheStatus cache
) {
}
