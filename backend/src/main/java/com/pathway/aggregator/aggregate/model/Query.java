package com.pathway.aggregator.aggregate.model;

import com.pathway.aggregator.aggregate.service.InvalidQueryException;

public record Query(
    String text,
    RecordKind kind,
    QueryFilters filters,
    int limit
) {
    public Query {
        if (text == null || text.isBlank()) {
            throw new InvalidQueryException("query text must not be blank");
        }
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be positive, got " + limit);
        }
        if (kind == null) {
            throw new InvalidQueryException("record kind is required");
        }
        text = text.trim();
        filters = filters == null ? QueryFilters.none() : filters;
    }

    public static Query courses(String text, QueryFilters filters, int limit) {
        return new Query(text, RecordKind.COURSE, filters, limit);
    }

    public static Query jobs(String text, QueryFilters filters, int limit) {
        return new Query(text, RecordKind.JOB, filters, limit);
    }
}
