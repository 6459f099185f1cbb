package com.pathway.aggregator.aggregate.model;

public record SkillFrequency(
    String skill,
    int frequency
) {
}
