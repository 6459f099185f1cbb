package com.pathway.aggregator.config;

import com.pathway.aggregator.aggregate.model.RecordKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AggregatorPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToDefault() {
        AggregatorProperties properties = new AggregatorProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("provider-aggregator/0.1"));
    }

    @Test
    void timeoutsAndConcurrencyAreClamped() {
        AggregatorProperties properties = new AggregatorProperties();
        properties.setProviderTimeoutSeconds(120);
        properties.setAggregationTimeoutSeconds(0);
        properties.setProviderConcurrency(-3);
        assertEquals(30, properties.getProviderTimeoutSeconds());
        assertEquals(1, properties.getAggregationTimeoutSeconds());
        assertEquals(1, properties.getProviderConcurrency());
    }

    @Test
    void providerDefaultsAreUsable() {
        AggregatorProperties.Provider provider = new AggregatorProperties.Provider();
        provider.setRateLimitPerHour(0);
        provider.setKind(null);
        provider.setCountry(" ");
        assertEquals(1, provider.getRateLimitPerHour());
        assertEquals(RecordKind.COURSE, provider.getKind());
        assertEquals("gb", provider.getCountry());
    }

    @Test
    void cacheAndSearchDefaults() {
        AggregatorProperties properties = new AggregatorProperties();
        assertEquals(3600, properties.getCache().getTtlSeconds());
        assertEquals(20, properties.getSearch().getDefaultCourseLimit());
        assertEquals(25, properties.getSearch().getDefaultJobLimit());
        assertEquals(150, properties.getAnalytics().getJobSampleSize());
        assertEquals(5, properties.getRecommendations().getMaxSkills());
    }
}
