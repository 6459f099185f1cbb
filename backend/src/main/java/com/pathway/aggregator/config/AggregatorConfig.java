package com.pathway.aggregator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pathway.aggregator.aggregate.analytics.GrowthRateTable;
import com.pathway.aggregator.aggregate.analytics.MarketAnalytics;
import com.pathway.aggregator.aggregate.cache.DistributedCacheTier;
import com.pathway.aggregator.aggregate.cache.RedisCacheTier;
import com.pathway.aggregator.aggregate.cache.TieredCache;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.normalize.RecordNormalizer;
import com.pathway.aggregator.aggregate.normalize.RecordRanker;
import com.pathway.aggregator.aggregate.provider.FallbackRecordGenerator;
import com.pathway.aggregator.aggregate.provider.ProviderRegistry;
import com.pathway.aggregator.aggregate.ratelimit.ProviderRateLimiter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AggregatorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "providerExecutor", destroyMethod = "shutdown")
    public ExecutorService providerExecutor(AggregatorProperties properties) {
        return Executors.newFixedThreadPool(properties.getProviderConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AggregatorProperties properties) {
        int size = Math.max(4, properties.getProviderConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ProviderRateLimiter providerRateLimiter(Clock clock) {
        return new ProviderRateLimiter(clock);
    }

    @Bean
    public ProviderRegistry providerRegistry(
        AggregatorProperties properties,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper,
        ProviderRateLimiter rateLimiter,
        Clock clock
    ) {
        return ProviderRegistry.fromProperties(properties, httpClient, objectMapper, rateLimiter, clock);
    }

    @Bean
    public RecordNormalizer recordNormalizer() {
        return new RecordNormalizer();
    }

    @Bean
    public RecordRanker recordRanker() {
        return new RecordRanker();
    }

    @Bean
    public FallbackRecordGenerator fallbackRecordGenerator(Clock clock) {
        return new FallbackRecordGenerator(clock);
    }

    @Bean
    public GrowthRateTable growthRateTable() {
        return GrowthRateTable.fromClasspath(GrowthRateTable.DEFAULT_RESOURCE);
    }

    @Bean
    public MarketAnalytics marketAnalytics(GrowthRateTable growthRateTable) {
        return new MarketAnalytics(growthRateTable);
    }

    @Bean
    @ConditionalOnProperty(prefix = "aggregator.cache.distributed", name = "enabled", havingValue = "true")
    public DistributedCacheTier redisCacheTier(StringRedisTemplate redisTemplate) {
        return new RedisCacheTier(redisTemplate);
    }

    @Bean
    public TieredCache tieredCache(
        AggregatorProperties properties,
        ObjectMapper objectMapper,
        Clock clock,
        ObjectProvider<DistributedCacheTier> distributedTier
    ) {
        AggregatorProperties.Cache cache = properties.getCache();
        return new TieredCache(
            objectMapper,
            clock,
            cache.getMaxEntries(),
            cache.getTtlSeconds(),
            distributedTier.getIfAvailable()
        );
    }
}
