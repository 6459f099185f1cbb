package com.pathway.aggregator.aggregate.analytics;

import com.pathway.aggregator.aggregate.model.AnalyticsResult;
import com.pathway.aggregator.aggregate.model.DemandLevel;
import com.pathway.aggregator.aggregate.model.LocationCount;
import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.SalaryRange;
import com.pathway.aggregator.aggregate.model.SkillFrequency;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class MarketAnalytics {
    static final int HIGH_DEMAND_THRESHOLD = 100;
    static final int MEDIUM_DEMAND_THRESHOLD = 50;
    static final int TOP_LOCATIONS = 5;
    static final int TOP_SKILLS = 10;
    static final String UNKNOWN_LOCATION = "Remote";

    private final GrowthRateTable growthRates;

    public MarketAnalytics(GrowthRateTable growthRates) {
        this.growthRates = growthRates;
    }

    public AnalyticsResult analyze(String skill, Collection<NormalizedRecord> jobs) {
        List<NormalizedRecord> sample = jobs == null ? List.of() : List.copyOf(jobs);
        return new AnalyticsResult(
            skill,
            demand(sample.size()),
            averageSalary(sample),
            topLocations(sample),
            growthRates.rateFor(skill),
            requiredSkills(sample),
            sample.size()
        );
    }

    static DemandLevel demand(int jobCount) {
        if (jobCount > HIGH_DEMAND_THRESHOLD) {
            return DemandLevel.HIGH;
        }
        if (jobCount > MEDIUM_DEMAND_THRESHOLD) {
            return DemandLevel.MEDIUM;
        }
        return DemandLevel.LOW;
    }

    static Long averageSalary(List<NormalizedRecord> jobs) {
        double sum = 0;
        int count = 0;
        for (NormalizedRecord job : jobs) {
            SalaryRange range = job.attributes().salaryRange();
            if (range != null && range.hasBounds()) {
                sum += range.midpoint();
                count++;
            }
        }
        return count == 0 ? null : Math.round(sum / count);
    }

    static List<LocationCount> topLocations(List<NormalizedRecord> jobs) {
        Map<String, Integer> counts = new HashMap<>();
        for (NormalizedRecord job : jobs) {
            String location = job.attributes().location();
            String key = location == null || location.isBlank() ? UNKNOWN_LOCATION : location.trim();
            counts.merge(key, 1, Integer::sum);
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
            .limit(TOP_LOCATIONS)
            .map(entry -> new LocationCount(entry.getKey(), entry.getValue()))
            .toList();
    }

    static List<SkillFrequency> requiredSkills(List<NormalizedRecord> jobs) {
        Map<String, Integer> counts = new HashMap<>();
        for (NormalizedRecord job : jobs) {
            for (String skill : job.attributes().skills()) {
                if (skill != null && !skill.isBlank()) {
                    counts.merge(skill.trim().toLowerCase(Locale.ROOT), 1, Integer::sum);
                }
            }
        }
        return counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
            .limit(TOP_SKILLS)
            .map(entry -> new SkillFrequency(entry.getKey(), entry.getValue()))
            .toList();
    }
}
