package com.pathway.aggregator.aggregate.model;

import java.time.Instant;

public record ProviderStatus(
    String name,
    RecordKind kind,
    boolean configured,
    int rateLimitPerHour,
    Instant lastAdmittedAt
) {
}
