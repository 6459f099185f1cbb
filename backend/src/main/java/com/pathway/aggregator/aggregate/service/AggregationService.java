package com.pathway.aggregator.aggregate.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.pathway.aggregator.aggregate.analytics.MarketAnalytics;
import com.pathway.aggregator.aggregate.cache.TieredCache;
import com.pathway.aggregator.aggregate.model.AggregationOutcome;
import com.pathway.aggregator.aggregate.model.AggregatorStatus;
import com.pathway.aggregator.aggregate.model.AnalyticsResult;
import com.pathway.aggregator.aggregate.model.CacheStatus;
import com.pathway.aggregator.aggregate.model.CourseRecommendation;
import com.pathway.aggregator.aggregate.model.CourseSearchOptions;
import com.pathway.aggregator.aggregate.model.JobSearchOptions;
import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.QueryFilters;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.normalize.RecordRanker;
import com.pathway.aggregator.aggregate.provider.ProviderAdapter;
import com.pathway.aggregator.aggregate.provider.ProviderRegistry;
import com.pathway.aggregator.aggregate.util.HashUtils;
import com.pathway.aggregator.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class AggregationService {
    private static final Logger log = LoggerFactory.getLogger(AggregationService.class);
    private static final TypeReference<List<NormalizedRecord>> RECORD_LIST = new TypeReference<>() {
    };
    private static final TypeReference<AnalyticsResult> ANALYTICS_RESULT = new TypeReference<>() {
    };

    private final AggregationOrchestrator orchestrator;
    private final ProviderRegistry registry;
    private final TieredCache cache;
    private final MarketAnalytics marketAnalytics;
    private final AggregatorProperties properties;

    public AggregationService(
        AggregationOrchestrator orchestrator,
        ProviderRegistry registry,
        TieredCache cache,
        MarketAnalytics marketAnalytics,
        AggregatorProperties properties
    ) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.cache = cache;
        this.marketAnalytics = marketAnalytics;
        this.properties = properties;
    }

    public List<NormalizedRecord> searchCourses(String text, CourseSearchOptions options) {
        CourseSearchOptions opts = options == null ? CourseSearchOptions.defaults() : options;
        AggregatorProperties.Search search = properties.getSearch();
        int limit = effectiveLimit(opts.limit(), search.getDefaultCourseLimit());
        Query query = Query.courses(text, QueryFilters.forCourses(opts.skillLevel(), opts.language()), limit);
        List<String> requested = opts.providers() == null || opts.providers().isEmpty()
            ? search.getDefaultCourseProviders()
            : opts.providers();
        return search(HashUtils.COURSES_NAMESPACE, query, registry.resolve(requested, RecordKind.COURSE));
    }

    public List<NormalizedRecord> searchJobs(String text, JobSearchOptions options) {
        JobSearchOptions opts = options == null ? JobSearchOptions.defaults() : options;
        AggregatorProperties.Search search = properties.getSearch();
        int limit = effectiveLimit(opts.limit(), search.getDefaultJobLimit());
        Query query = Query.jobs(text, QueryFilters.forJobs(opts.location(), opts.remote()), limit);
        List<String> requested = opts.providers() == null || opts.providers().isEmpty()
            ? search.getDefaultJobProviders()
            : opts.providers();
        return search(HashUtils.JOBS_NAMESPACE, query, registry.resolve(requested, RecordKind.JOB));
    }

    public List<CourseRecommendation> getCourseRecommendations(List<String> skills, String userLevel) {
        AggregatorProperties.Recommendations config = properties.getRecommendations();
        if (skills != null && skills.size() > config.getMaxRequestedSkills()) {
            throw new InvalidQueryException("at most " + config.getMaxRequestedSkills() + " skills may be requested");
        }
        List<String> selected = distinctSkills(skills, config.getMaxSkills());
        List<CourseRecommendation> recommendations = new ArrayList<>();
        for (String skill : selected) {
            List<NormalizedRecord> courses = searchCourses(
                skill,
                new CourseSearchOptions(null, config.getCoursesPerSkill(), userLevel, null)
            );
            Map<String, Double> scores = new LinkedHashMap<>();
            for (NormalizedRecord course : courses) {
                scores.put(course.id(), RecordRanker.relevanceScore(course, skill));
            }
            recommendations.add(new CourseRecommendation(skill, courses, scores));
        }
        return recommendations;
    }

    public List<AnalyticsResult> getJobMarketTrends(List<String> skills) {
        AggregatorProperties.Analytics config = properties.getAnalytics();
        List<String> selected = distinctSkills(skills, config.getMaxSkills());
        List<ProviderAdapter> providers = registry.resolve(registry.namesOfKind(RecordKind.JOB), RecordKind.JOB);
        List<String> providerNames = providers.stream().map(ProviderAdapter::name).toList();
        List<AnalyticsResult> results = new ArrayList<>();
        for (String skill : selected) {
            Query query = Query.jobs(skill, QueryFilters.none(), config.getJobSampleSize());
            String key = HashUtils.queryKey(HashUtils.JOB_TRENDS_NAMESPACE, query, providerNames);
            Optional<AnalyticsResult> cached = cache.get(key, ANALYTICS_RESULT);
            if (cached.isPresent()) {
                log.debug("Trend cache hit skill={}", skill);
                results.add(cached.get());
                continue;
            }
            AggregationOutcome outcome = orchestrator.aggregate(query, providers);
            AnalyticsResult result = marketAnalytics.analyze(skill, outcome.records());
            if (!outcome.usedFallback() && !outcome.isExhausted()) {
                cache.set(key, result);
            }
            results.add(result);
        }
        return results;
    }

    public void clearCache(String scope) {
        long removed = cache.clear(scope);
        log.info("Cache clear requested scope={} removedLocal={}", scope, removed);
    }

    public AggregatorStatus getStatus() {
        return new AggregatorStatus(
            registry.statuses(),
            new CacheStatus(cache.entryCount(), cache.defaultTtlSeconds(), cache.isDistributedEnabled())
        );
    }

    private List<NormalizedRecord> search(String namespace, Query query, List<ProviderAdapter> providers) {
        List<String> names = providers.stream().map(ProviderAdapter::name).toList();
        String key = HashUtils.queryKey(namespace, query, names);
        Optional<List<NormalizedRecord>> cached = cache.get(key, RECORD_LIST);
        if (cached.isPresent()) {
            log.debug("Cache hit {} '{}'", namespace, query.text());
            return cached.get();
        }
        AggregationOutcome outcome = orchestrator.aggregate(query, providers);
        if (!outcome.usedFallback() && !outcome.isExhausted()) {
            cache.set(key, outcome.records());
        }
        return outcome.records();
    }

    private int effectiveLimit(Integer requested, int defaultLimit) {
        int limit = requested == null ? defaultLimit : requested;
        if (limit <= 0) {
            throw new InvalidQueryException("limit must be positive, got " + limit);
        }
        return Math.min(limit, properties.getSearch().getMaxLimit());
    }

    private static List<String> distinctSkills(List<String> skills, int max) {
        if (skills == null || skills.isEmpty()) {
            throw new InvalidQueryException("at least one skill is required");
        }
        LinkedHashSet<String> selected = new LinkedHashSet<>();
        for (String skill : skills) {
            if (skill != null && !skill.isBlank()) {
                selected.add(skill.trim());
            }
            if (selected.size() == max) {
                break;
            }
        }
        if (selected.isEmpty()) {
            throw new InvalidQueryException("at least one non-blank skill is required");
        }
        return new ArrayList<>(selected);
    }
}
