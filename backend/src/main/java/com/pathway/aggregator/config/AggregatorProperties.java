package com.pathway.aggregator.config;

import com.pathway.aggregator.aggregate.model.RecordKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "aggregator")
public class AggregatorProperties {
    private static final String DEFAULT_USER_AGENT = "provider-aggregator/0.1 (+contact)";
    private static final int MAX_PROVIDER_TIMEOUT_SECONDS = 30;

    private String userAgent;
    private int providerTimeoutSeconds = 8;
    private int aggregationTimeoutSeconds = 10;
    private int providerConcurrency = 8;
    private Cache cache = new Cache();
    private Search search = new Search();
    private Recommendations recommendations = new Recommendations();
    private Analytics analytics = new Analytics();
    private Map<String, Provider> providers = new LinkedHashMap<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getProviderTimeoutSeconds() {
        return clamp(providerTimeoutSeconds, 1, MAX_PROVIDER_TIMEOUT_SECONDS);
    }

    public void setProviderTimeoutSeconds(int providerTimeoutSeconds) {
        this.providerTimeoutSeconds = clamp(providerTimeoutSeconds, 1, MAX_PROVIDER_TIMEOUT_SECONDS);
    }

    public int getAggregationTimeoutSeconds() {
        return Math.max(1, aggregationTimeoutSeconds);
    }

    public void setAggregationTimeoutSeconds(int aggregationTimeoutSeconds) {
        this.aggregationTimeoutSeconds = Math.max(1, aggregationTimeoutSeconds);
    }

    public int getProviderConcurrency() {
        return Math.max(1, providerConcurrency);
    }

    public void setProviderConcurrency(int providerConcurrency) {
        this.providerConcurrency = Math.max(1, providerConcurrency);
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Search getSearch() {
        return search;
    }

    public void setSearch(Search search) {
        this.search = search;
    }

    public Recommendations getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(Recommendations recommendations) {
        this.recommendations = recommendations;
    }

    public Analytics getAnalytics() {
        return analytics;
    }

    public void setAnalytics(Analytics analytics) {
        this.analytics = analytics;
    }

    public Map<String, Provider> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, Provider> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public static String normalizeUserAgent(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return value.trim();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    public static class Cache {
        private long ttlSeconds = 3600;
        private long maxEntries = 1000;
        private Distributed distributed = new Distributed();

        public long getTtlSeconds() {
            return Math.max(1, ttlSeconds);
        }

        public void setTtlSeconds(long ttlSeconds) {
            this.ttlSeconds = Math.max(1, ttlSeconds);
        }

        public long getMaxEntries() {
            return Math.max(1, maxEntries);
        }

        public void setMaxEntries(long maxEntries) {
            this.maxEntries = Math.max(1, maxEntries);
        }

        public Distributed getDistributed() {
            return distributed;
        }

        public void setDistributed(Distributed distributed) {
            this.distributed = distributed;
        }
    }

    public static class Distributed {
        private boolean enabled;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Search {
        private int defaultCourseLimit = 20;
        private int defaultJobLimit = 25;
        private int maxLimit = 50;
        private List<String> defaultCourseProviders = new ArrayList<>(List.of("coursera", "udemy", "edx"));
        private List<String> defaultJobProviders = new ArrayList<>(List.of("adzuna", "github"));

        public int getDefaultCourseLimit() {
            return Math.max(1, defaultCourseLimit);
        }

        public void setDefaultCourseLimit(int defaultCourseLimit) {
            this.defaultCourseLimit = Math.max(1, defaultCourseLimit);
        }

        public int getDefaultJobLimit() {
            return Math.max(1, defaultJobLimit);
        }

        public void setDefaultJobLimit(int defaultJobLimit) {
            this.defaultJobLimit = Math.max(1, defaultJobLimit);
        }

        public int getMaxLimit() {
            return Math.max(1, maxLimit);
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = Math.max(1, maxLimit);
        }

        public List<String> getDefaultCourseProviders() {
            return defaultCourseProviders;
        }

        public void setDefaultCourseProviders(List<String> defaultCourseProviders) {
            this.defaultCourseProviders = defaultCourseProviders == null ? new ArrayList<>() : defaultCourseProviders;
        }

        public List<String> getDefaultJobProviders() {
            return defaultJobProviders;
        }

        public void setDefaultJobProviders(List<String> defaultJobProviders) {
            this.defaultJobProviders = defaultJobProviders == null ? new ArrayList<>() : defaultJobProviders;
        }
    }

    public static class Recommendations {
        private int maxSkills = 5;
        private int coursesPerSkill = 3;
        private int maxRequestedSkills = 10;

        public int getMaxSkills() {
            return Math.max(1, maxSkills);
        }

        public void setMaxSkills(int maxSkills) {
            this.maxSkills = Math.max(1, maxSkills);
        }

        public int getCoursesPerSkill() {
            return Math.max(1, coursesPerSkill);
        }

        public void setCoursesPerSkill(int coursesPerSkill) {
            this.coursesPerSkill = Math.max(1, coursesPerSkill);
        }

        public int getMaxRequestedSkills() {
            return Math.max(1, maxRequestedSkills);
        }

        public void setMaxRequestedSkills(int maxRequestedSkills) {
            this.maxRequestedSkills = Math.max(1, maxRequestedSkills);
        }
    }

    public static class Analytics {
        private int maxSkills = 10;
        private int jobSampleSize = 150;

        public int getMaxSkills() {
            return Math.max(1, maxSkills);
        }

        public void setMaxSkills(int maxSkills) {
            this.maxSkills = Math.max(1, maxSkills);
        }

        public int getJobSampleSize() {
            return Math.max(1, jobSampleSize);
        }

        public void setJobSampleSize(int jobSampleSize) {
            this.jobSampleSize = Math.max(1, jobSampleSize);
        }
    }

    public static class Provider {
        private RecordKind kind = RecordKind.COURSE;
        private String baseUrl;
        private String apiKey;
        private String clientId;
        private String clientSecret;
        private String appId;
        private String appKey;
        private String country = "gb";
        private int rateLimitPerHour = 100;

        public RecordKind getKind() {
            return kind;
        }

        public void setKind(RecordKind kind) {
            this.kind = kind == null ? RecordKind.COURSE : kind;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getClientSecret() {
            return clientSecret;
        }

        public void setClientSecret(String clientSecret) {
            this.clientSecret = clientSecret;
        }

        public String getAppId() {
            return appId;
        }

        public void setAppId(String appId) {
            this.appId = appId;
        }

        public String getAppKey() {
            return appKey;
        }

        public void setAppKey(String appKey) {
            this.appKey = appKey;
        }

        public String getCountry() {
            return country;
        }

        public void setCountry(String country) {
            this.country = country == null || country.isBlank() ? "gb" : country.trim();
        }

        public int getRateLimitPerHour() {
            return Math.max(1, rateLimitPerHour);
        }

        public void setRateLimitPerHour(int rateLimitPerHour) {
            this.rateLimitPerHour = Math.max(1, rateLimitPerHour);
        }
    }
}
