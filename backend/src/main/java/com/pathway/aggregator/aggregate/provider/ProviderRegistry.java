package com.pathway.aggregator.aggregate.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pathway.aggregator.aggregate.http.ProviderHttpClient;
import com.pathway.aggregator.aggregate.model.ProviderStatus;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.ratelimit.ProviderConfig;
import com.pathway.aggregator.aggregate.ratelimit.ProviderRateLimiter;
import com.pathway.aggregator.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ProviderRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderAdapter> adapters = new LinkedHashMap<>();
    private final ProviderRateLimiter rateLimiter;

    public ProviderRegistry(Collection<ProviderAdapter> adapters, Map<String, Integer> rateLimitsPerHour, ProviderRateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
        for (ProviderAdapter adapter : adapters) {
            String key = key(adapter.name());
            this.adapters.put(key, adapter);
            Integer limit = rateLimitsPerHour == null ? null : rateLimitsPerHour.get(key);
            rateLimiter.register(key, limit == null ? 1 : limit);
        }
    }

    public static ProviderRegistry fromProperties(
        AggregatorProperties properties,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper,
        ProviderRateLimiter rateLimiter,
        Clock clock
    ) {
        List<ProviderAdapter> adapters = new ArrayList<>();
        Map<String, Integer> limits = new LinkedHashMap<>();
        properties.getProviders().forEach((rawName, config) -> {
            String name = key(rawName);
            ProviderAdapter adapter = liveAdapter(name, config, httpClient, objectMapper);
            if (adapter == null) {
                adapter = new SyntheticAdapter(name, config.getKind(), clock);
                log.info("Provider {} ({}) has no credentials; serving sample data", name, config.getKind());
            } else {
                log.info("Provider {} ({}) configured with live adapter {}", name, config.getKind(), adapter.getClass().getSimpleName());
            }
            adapters.add(adapter);
            limits.put(name, config.getRateLimitPerHour());
        });
        return new ProviderRegistry(adapters, limits, rateLimiter);
    }

    static ProviderAdapter liveAdapter(
        String name,
        AggregatorProperties.Provider config,
        ProviderHttpClient httpClient,
        ObjectMapper objectMapper
    ) {
        return switch (name) {
            case "coursera" -> CourseraAdapter.hasCredentials(config)
                ? new CourseraAdapter(name, config, httpClient, objectMapper) : null;
            case "udemy" -> UdemyAdapter.hasCredentials(config)
                ? new UdemyAdapter(name, config, httpClient, objectMapper) : null;
            case "edx" -> EdxAdapter.hasCredentials(config)
                ? new EdxAdapter(name, config, httpClient, objectMapper) : null;
            case "adzuna" -> AdzunaAdapter.hasCredentials(config)
                ? new AdzunaAdapter(name, config, httpClient, objectMapper) : null;
            default -> null;
        };
    }

    public List<ProviderAdapter> resolve(Collection<String> requested, RecordKind kind) {
        LinkedHashSet<String> names = new LinkedHashSet<>();
        if (requested != null) {
            for (String name : requested) {
                if (name != null && !name.isBlank()) {
                    names.add(key(name));
                }
            }
        }
        List<ProviderAdapter> resolved = new ArrayList<>();
        for (String name : names) {
            ProviderAdapter adapter = adapters.get(name);
            if (adapter == null) {
                log.debug("Ignoring unknown provider {}", name);
                continue;
            }
            if (adapter.kind() != kind) {
                log.debug("Ignoring provider {}: serves {} not {}", name, adapter.kind(), kind);
                continue;
            }
            resolved.add(adapter);
        }
        return resolved;
    }

    public List<String> namesOfKind(RecordKind kind) {
        List<String> names = new ArrayList<>();
        adapters.forEach((name, adapter) -> {
            if (adapter.kind() == kind) {
                names.add(name);
            }
        });
        return names;
    }

    public List<ProviderStatus> statuses() {
        List<ProviderStatus> statuses = new ArrayList<>();
        adapters.forEach((name, adapter) -> {
            ProviderConfig config = rateLimiter.config(name);
            statuses.add(new ProviderStatus(
                name,
                adapter.kind(),
                !adapter.isSynthetic(),
                config == null ? 0 : config.rateLimitPerHour(),
                config == null ? null : config.lastAdmittedAt()
            ));
        });
        return statuses;
    }

    private static String key(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    }
}
