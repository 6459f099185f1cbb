package com.pathway.aggregator.aggregate.model;

public record NormalizedRecord(
    String id,
    RecordKind kind,
    String title,
    String description,
    String provider,
    RecordAttributes attributes,
    String url,
    boolean synthetic
) {
}
