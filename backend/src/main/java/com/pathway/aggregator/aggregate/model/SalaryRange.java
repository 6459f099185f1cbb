package com.pathway.aggregator.aggregate.model;

public record SalaryRange(
    Double min,
    Double max,
    String currency,
    String type
) {
    public boolean hasBounds() {
        return min != null && max != null;
    }

    public double midpoint() {
        return (min + max) / 2.0;
    }
}
