package com.pathway.aggregator.aggregate.model;

import java.util.List;

public record CourseSearchOptions(
    List<String> providers,
    Integer limit,
    String skillLevel,
    String language
) {
    public static CourseSearchOptions defaults() {
        return new CourseSearchOptions(null, null, null, null);
    }
}
