package com.pathway.aggregator.aggregate.model;

import java.time.Instant;
import java.util.List;

public record RecordAttributes(
    Double rating,
    Long enrollments,
    Double price,
    SalaryRange salaryRange,
    String location,
    Boolean remote,
    List<String> skills,
    String level,
    String language,
    String instructor,
    String company,
    Instant postedAt
) {
    public RecordAttributes {
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
