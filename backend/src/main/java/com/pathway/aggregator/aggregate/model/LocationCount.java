package com.pathway.aggregator.aggregate.model;

public record LocationCount(
    String location,
    int count
) {
}
