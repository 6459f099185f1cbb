package com.pathway.aggregator.aggregate.model;

import java.util.List;

public record AnalyticsResult(
    String skill,
    DemandLevel demand,
    Long averageSalary,
    List<LocationCount> topLocations,
    double growthRatePercent,
    List<SkillFrequency> requiredSkills,
    int jobCount
) {
}
