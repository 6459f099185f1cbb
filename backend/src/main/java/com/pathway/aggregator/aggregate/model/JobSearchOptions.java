package com.pathway.aggregator.aggregate.model;

import java.util.List;

public record JobSearchOptions(
    Integer limit,
    String location,
    Boolean remote,
    List<String> providers
) {
    public static JobSearchOptions defaults() {
        return new JobSearchOptions(null, null, null, null);
    }
}
