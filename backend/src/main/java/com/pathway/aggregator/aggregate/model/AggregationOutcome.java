package com.pathway.aggregator.aggregate.model;

import java.util.List;

public record AggregationOutcome(
    List<NormalizedRecord> records,
    List<String> providersSucceeded,
    List<ProviderFailure> providersFailed,
    List<String> providersSkipped,
    boolean usedFallback
) {
    public AggregationOutcome {
        records = records == null ? List.of() : List.copyOf(records);
        providersSucceeded = providersSucceeded == null ? List.of() : List.copyOf(providersSucceeded);
        providersFailed = providersFailed == null ? List.of() : List.copyOf(providersFailed);
        providersSkipped = providersSkipped == null ? List.of() : List.copyOf(providersSkipped);
    }

    public static AggregationOutcome exhausted(List<ProviderFailure> failures, List<String> skipped) {
        return new AggregationOutcome(List.of(), List.of(), failures, skipped, false);
    }

    public boolean isExhausted() {
        return records.isEmpty();
    }
}
