package com.pathway.aggregator.aggregate.service;

import com.pathway.aggregator.aggregate.model.AggregationOutcome;
import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.ProviderFailure;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.normalize.RecordNormalizer;
import com.pathway.aggregator.aggregate.normalize.RecordRanker;
import com.pathway.aggregator.aggregate.provider.FallbackRecordGenerator;
import com.pathway.aggregator.aggregate.provider.ProviderAdapter;
import com.pathway.aggregator.aggregate.provider.ProviderException;
import com.pathway.aggregator.aggregate.ratelimit.ProviderRateLimiter;
import com.pathway.aggregator.aggregate.util.ProviderFailureReasons;
import com.pathway.aggregator.config.AggregatorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a query out to every admitted provider, waits for all calls to settle within the
 * aggregation timeout and ranks whatever came back. Provider failures are recorded, never thrown.
 */
@Service
public class AggregationOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(AggregationOrchestrator.class);

    private final ProviderRateLimiter rateLimiter;
    private final ExecutorService providerExecutor;
    private final RecordNormalizer normalizer;
    private final RecordRanker ranker;
    private final FallbackRecordGenerator fallbackGenerator;
    private final long aggregationTimeoutMs;

    @Autowired
    public AggregationOrchestrator(
        ProviderRateLimiter rateLimiter,
        @Qualifier("providerExecutor") ExecutorService providerExecutor,
        RecordNormalizer normalizer,
        RecordRanker ranker,
        FallbackRecordGenerator fallbackGenerator,
        AggregatorProperties properties
    ) {
        this(rateLimiter, providerExecutor, normalizer, ranker, fallbackGenerator,
            TimeUnit.SECONDS.toMillis(properties.getAggregationTimeoutSeconds()));
    }

    AggregationOrchestrator(
        ProviderRateLimiter rateLimiter,
        ExecutorService providerExecutor,
        RecordNormalizer normalizer,
        RecordRanker ranker,
        FallbackRecordGenerator fallbackGenerator,
        long aggregationTimeoutMs
    ) {
        this.rateLimiter = rateLimiter;
        this.providerExecutor = providerExecutor;
        this.normalizer = normalizer;
        this.ranker = ranker;
        this.fallbackGenerator = fallbackGenerator;
        this.aggregationTimeoutMs = Math.max(1, aggregationTimeoutMs);
    }

    public AggregationOutcome aggregate(Query query, List<ProviderAdapter> providers) {
        if (query == null) {
            throw new InvalidQueryException("query is required");
        }
        final long t0 = System.nanoTime();
        List<ProviderAdapter> admitted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (ProviderAdapter provider : providers == null ? List.<ProviderAdapter>of() : providers) {
            if (rateLimiter.tryAdmit(provider.name())) {
                admitted.add(provider);
            } else {
                skipped.add(provider.name());
            }
        }
        if (!skipped.isEmpty()) {
            log.debug("[Aggregate] '{}' skipped by rate limiter: {}", query.text(), skipped);
        }

        int perProviderLimit = admitted.isEmpty() ? query.limit() : ceilDiv(query.limit(), admitted.size());
        Map<ProviderAdapter, CompletableFuture<List<RawRecord>>> calls = new LinkedHashMap<>();
        List<ProviderFailure> failed = new ArrayList<>();
        for (ProviderAdapter provider : admitted) {
            try {
                calls.put(provider, CompletableFuture.supplyAsync(() -> provider.search(query, perProviderLimit), providerExecutor));
            } catch (RejectedExecutionException e) {
                log.warn("[Aggregate] Could not dispatch provider={}: {}", provider.name(), e.getMessage());
                failed.add(new ProviderFailure(provider.name(), ProviderFailureReasons.UNEXPECTED_ERROR));
            }
        }
        boolean interrupted = awaitSettled(calls, query);

        List<RawRecord> collected = new ArrayList<>();
        List<String> succeeded = new ArrayList<>();
        boolean realContribution = false;
        for (Map.Entry<ProviderAdapter, CompletableFuture<List<RawRecord>>> call : calls.entrySet()) {
            ProviderAdapter provider = call.getKey();
            CompletableFuture<List<RawRecord>> future = call.getValue();
            if (!future.isDone()) {
                String reason = interrupted ? ProviderFailureReasons.INTERRUPTED : ProviderFailureReasons.TIMEOUT;
                log.warn("[Aggregate] provider={} still outstanding after {} ms; recorded as {}", provider.name(), aggregationTimeoutMs, reason);
                failed.add(new ProviderFailure(provider.name(), reason));
                continue;
            }
            try {
                List<RawRecord> records = future.join();
                int count = records == null ? 0 : records.size();
                if (records != null) {
                    collected.addAll(records);
                }
                succeeded.add(provider.name());
                realContribution = realContribution || (!provider.isSynthetic() && count > 0);
                log.debug("[Aggregate] provider={} returned {} listings", provider.name(), count);
            } catch (CompletionException | CancellationException e) {
                String reason = failureReason(e);
                log.warn("[Aggregate] provider={} failed reason={}: {}", provider.name(), reason, rootMessage(e));
                failed.add(new ProviderFailure(provider.name(), reason));
            }
        }

        boolean fallbackFired = false;
        if (collected.isEmpty()) {
            try {
                collected.addAll(fallbackGenerator.generate(query));
                fallbackFired = true;
                log.info("[Aggregate] No provider data for '{}'; generated {} fallback listings", query.text(), collected.size());
            } catch (RuntimeException e) {
                log.error("[Aggregate] Fallback generation failed for '{}'; returning empty outcome", query.text(), e);
                return AggregationOutcome.exhausted(failed, skipped);
            }
        }

        List<NormalizedRecord> normalized = normalizer.normalize(collected);
        List<NormalizedRecord> ranked = ranker.rank(normalized, query.text(), query.limit());
        if (ranked.isEmpty()) {
            return AggregationOutcome.exhausted(failed, skipped);
        }
        boolean usedFallback = fallbackFired || !realContribution;
        log.info("[Aggregate] '{}' kind={} records={} succeeded={} failed={} skipped={} usedFallback={} ({} ms)",
            query.text(), query.kind(), ranked.size(), succeeded, failed, skipped, usedFallback,
            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        return new AggregationOutcome(ranked, succeeded, failed, skipped, usedFallback);
    }

    private boolean awaitSettled(Map<ProviderAdapter, CompletableFuture<List<RawRecord>>> calls, Query query) {
        if (calls.isEmpty()) {
            return false;
        }
        CompletableFuture<Void> all = CompletableFuture.allOf(calls.values().toArray(new CompletableFuture[0]));
        try {
            all.get(aggregationTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("[Aggregate] '{}' hit aggregation timeout of {} ms", query.text(), aggregationTimeoutMs);
        } catch (ExecutionException e) {
            // every call has settled; individual failures are read per future
            log.debug("[Aggregate] '{}' settled with at least one provider failure", query.text());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Aggregate] '{}' interrupted while waiting for providers", query.text());
            return true;
        }
        return false;
    }

    static String failureReason(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ProviderException providerException) {
            return providerException.reason();
        }
        if (cause instanceof CancellationException) {
            return ProviderFailureReasons.TIMEOUT;
        }
        return ProviderFailureReasons.UNEXPECTED_ERROR;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }

    private static int ceilDiv(int value, int divisor) {
        return (value + divisor - 1) / divisor;
    }
}
