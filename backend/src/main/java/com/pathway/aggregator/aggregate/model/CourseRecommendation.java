package com.pathway.aggregator.aggregate.model;

import java.util.List;
import java.util.Map;

public record CourseRecommendation(
    String skill,
    List<NormalizedRecord> courses,
    Map<String, Double> relevanceScores
) {
}
