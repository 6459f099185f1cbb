package com.pathway.aggregator.aggregate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DemandLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
