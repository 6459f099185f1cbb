package com.pathway.aggregator.aggregate.service;

import com.pathway.aggregator.aggregate.MutableClock;
import com.pathway.aggregator.aggregate.model.AggregationOutcome;
import com.pathway.aggregator.aggregate.model.NormalizedRecord;
import com.pathway.aggregator.aggregate.model.ProviderFailure;
import com.pathway.aggregator.aggregate.model.Query;
import com.pathway.aggregator.aggregate.model.QueryFilters;
import com.pathway.aggregator.aggregate.model.RawRecord;
import com.pathway.aggregator.aggregate.model.RecordKind;
import com.pathway.aggregator.aggregate.normalize.RecordNormalizer;
import com.pathway.aggregator.aggregate.normalize.RecordRanker;
import com.pathway.aggregator.aggregate.provider.FallbackRecordGenerator;
import com.pathway.aggregator.aggregate.provider.ProviderAdapter;
import com.pathway.aggregator.aggregate.provider.ProviderException;
import com.pathway.aggregator.aggregate.provider.SyntheticAdapter;
import com.pathway.aggregator.aggregate.ratelimit.ProviderRateLimiter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

class AggregationOrchestratorTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ProviderRateLimiter rateLimiter = new ProviderRateLimiter(clock);
    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void oneFailingProviderOutOfSixStillYieldsResults() {
        List<ProviderAdapter> adapters = List.of(
            StubAdapter.courses("p1", 5),
            StubAdapter.courses("p2", 5),
            StubAdapter.courses("p3", 5),
            new StubAdapter("p4", RecordKind.COURSE, false, (q, limit) -> {
                throw new ProviderException("p4", "http_503", "unavailable");
            }),
            StubAdapter.courses("p5", 5),
            StubAdapter.courses("p6", 5)
        );
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("python", null, 20), adapters);

        assertThat(outcome.providersSucceeded()).containsExactly("p1", "p2", "p3", "p5", "p6");
        assertThat(outcome.providersFailed()).containsExactly(new ProviderFailure("p4", "http_503"));
        assertThat(outcome.records()).isNotEmpty().hasSizeLessThanOrEqualTo(20);
        assertThat(outcome.usedFallback()).isFalse();
    }

    @Test
    void twoProvidersWithThreeRecordsEachAreRankedAndTruncatedToLimit() {
        List<ProviderAdapter> adapters = List.of(StubAdapter.courses("alpha", 3), StubAdapter.courses("beta", 3));
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("python", null, 5), adapters);

        assertThat(outcome.records()).hasSize(5);
        assertThat(outcome.providersFailed()).isEmpty();
        assertThat(outcome.providersSucceeded()).containsExactly("alpha", "beta");
        assertThat(outcome.usedFallback()).isFalse();
        List<Double> scores = outcome.records().stream()
            .map(record -> RecordRanker.courseScore(record, "python"))
            .toList();
        assertThat(scores).isSortedAccordingTo(Comparator.reverseOrder());
    }

    @Test
    void timedOutProviderLeavesTheOtherProvidersRecords() {
        List<ProviderAdapter> adapters = List.of(
            new StubAdapter("stuck", RecordKind.COURSE, false, (q, limit) -> {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return StubAdapter.courseRecords("stuck", q, 2);
            }),
            StubAdapter.courses("quick", 2)
        );
        register(adapters);

        AggregationOutcome outcome = orchestrator(300).aggregate(Query.courses("python", null, 5), adapters);

        assertThat(outcome.records()).hasSize(2).extracting(NormalizedRecord::provider).containsOnly("quick");
        assertThat(outcome.providersFailed()).containsExactly(new ProviderFailure("stuck", "timeout"));
        assertThat(outcome.usedFallback()).isFalse();
    }

    @Test
    void unexpectedExceptionIsRecordedAsUnexpectedError() {
        List<ProviderAdapter> adapters = List.of(
            StubAdapter.courses("good", 2),
            new StubAdapter("broken", RecordKind.COURSE, false, (q, limit) -> {
                throw new IllegalStateException("boom");
            })
        );
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("java", null, 4), adapters);

        assertThat(outcome.providersFailed()).containsExactly(new ProviderFailure("broken", "unexpected_error"));
        assertThat(outcome.records()).hasSize(2);
    }

    @Test
    void slowProviderIsRecordedAsTimeoutWithoutBlockingCaller() {
        List<ProviderAdapter> adapters = List.of(
            StubAdapter.courses("fast", 3),
            new StubAdapter("slow", RecordKind.COURSE, false, (q, limit) -> {
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return StubAdapter.courseRecords("slow", q, 3);
            })
        );
        register(adapters);

        long started = System.nanoTime();
        AggregationOutcome outcome = orchestrator(300).aggregate(Query.courses("rust", null, 10), adapters);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertThat(elapsedMs).isLessThan(5_000);
        assertThat(outcome.providersSucceeded()).containsExactly("fast");
        assertThat(outcome.providersFailed()).containsExactly(new ProviderFailure("slow", "timeout"));
        assertThat(outcome.records()).extracting(NormalizedRecord::provider).containsOnly("fast");
    }

    @Test
    void everyProviderRateLimitedProducesFallbackRecord() {
        List<ProviderAdapter> adapters = List.of(StubAdapter.courses("a", 3), StubAdapter.courses("b", 3));
        register(adapters);
        rateLimiter.tryAdmit("a");
        rateLimiter.tryAdmit("b");

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("go", null, 5), adapters);

        assertThat(outcome.providersSkipped()).containsExactly("a", "b");
        assertThat(outcome.providersSucceeded()).isEmpty();
        assertThat(outcome.usedFallback()).isTrue();
        assertThat(outcome.records()).hasSize(1);
        NormalizedRecord fallback = outcome.records().get(0);
        assertThat(fallback.provider()).isEqualTo(FallbackRecordGenerator.PROVIDER);
        assertThat(fallback.title()).isEqualTo("Learn go - Free Resources");
        assertThat(fallback.attributes().price()).isEqualTo(0.0);
    }

    @Test
    void syntheticProvidersAnswerButAreFlaggedAsFallback() {
        List<ProviderAdapter> adapters = List.of(
            new SyntheticAdapter("coursera", RecordKind.COURSE, clock),
            new SyntheticAdapter("udemy", RecordKind.COURSE, clock),
            new SyntheticAdapter("edx", RecordKind.COURSE, clock)
        );
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("python", null, 10), adapters);

        assertThat(outcome.records()).isNotEmpty().allMatch(NormalizedRecord::synthetic);
        assertThat(outcome.records()).allSatisfy(record ->
            assertThat(record.description()).startsWith("[Sample data]"));
        assertThat(outcome.usedFallback()).isTrue();
        assertThat(outcome.providersSucceeded()).containsExactly("coursera", "udemy", "edx");
    }

    @Test
    void failedFallbackYieldsExhaustedOutcome() {
        FallbackRecordGenerator generator = Mockito.mock(FallbackRecordGenerator.class);
        when(generator.generate(any())).thenThrow(new IllegalStateException("no fallback"));
        List<ProviderAdapter> adapters = List.of(new StubAdapter("down", RecordKind.JOB, false, (q, limit) -> {
            throw new ProviderException("down", "io_error", "connection refused");
        }));
        register(adapters);
        AggregationOrchestrator orchestrator = new AggregationOrchestrator(
            rateLimiter, executor, new RecordNormalizer(), new RecordRanker(), generator, 2_000);

        AggregationOutcome outcome = orchestrator.aggregate(Query.jobs("cobol", null, 5), adapters);

        assertThat(outcome.isExhausted()).isTrue();
        assertThat(outcome.records()).isEmpty();
        assertThat(outcome.usedFallback()).isFalse();
        assertThat(outcome.providersFailed()).containsExactly(new ProviderFailure("down", "io_error"));
    }

    @Test
    void limitIsSplitAcrossAdmittedProviders() {
        StubAdapter a = StubAdapter.courses("a", 10);
        StubAdapter b = StubAdapter.courses("b", 10);
        StubAdapter c = StubAdapter.courses("c", 10);
        List<ProviderAdapter> adapters = List.of(a, b, c);
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("sql", null, 10), adapters);

        assertThat(a.lastLimit.get()).isEqualTo(4);
        assertThat(b.lastLimit.get()).isEqualTo(4);
        assertThat(c.lastLimit.get()).isEqualTo(4);
        assertThat(outcome.records()).hasSize(10);
    }

    @Test
    void orderIsIndependentOfCompletionOrder() {
        List<ProviderAdapter> adapters = List.of(jittery("a"), jittery("b"), jittery("c"), jittery("d"));
        register(adapters);
        AggregationOrchestrator orchestrator = orchestrator(5_000);
        Query query = Query.courses("kotlin", null, 12);

        List<String> first = orchestrator.aggregate(query, adapters).records().stream().map(NormalizedRecord::id).toList();
        clock.advance(Duration.ofHours(1));
        List<String> second = orchestrator.aggregate(query, adapters).records().stream().map(NormalizedRecord::id).toList();

        assertThat(first).hasSize(12).doesNotHaveDuplicates();
        assertThat(second).isEqualTo(first);
    }

    @Test
    void duplicateListingsCollapseAndIdsStayDistinctAcrossProviders() {
        List<ProviderAdapter> adapters = List.of(
            new StubAdapter("a", RecordKind.COURSE, false, (q, limit) -> {
                List<RawRecord> one = StubAdapter.courseRecords("a", q, 1);
                return List.of(one.get(0), one.get(0));
            }),
            StubAdapter.courses("b", 1)
        );
        register(adapters);

        AggregationOutcome outcome = orchestrator(2_000).aggregate(Query.courses("css", QueryFilters.none(), 10), adapters);

        assertThat(outcome.records()).extracting(NormalizedRecord::id).containsExactlyInAnyOrder("a_1", "b_1");
    }

    @Test
    void blankQueryIsRejected() {
        assertThatThrownBy(() -> Query.courses("   ", null, 10)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> Query.jobs("java", null, 0)).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> orchestrator(1_000).aggregate(null, List.of()))
            .isInstanceOf(InvalidQueryException.class);
    }

    private StubAdapter jittery(String name) {
        return new StubAdapter(name, RecordKind.COURSE, false, (q, limit) -> {
            try {
                Thread.sleep(ThreadLocalRandom.current().nextInt(1, 40));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return StubAdapter.courseRecords(name, q, limit);
        });
    }

    private void register(List<ProviderAdapter> adapters) {
        for (ProviderAdapter adapter : adapters) {
            rateLimiter.register(adapter.name(), 100);
        }
    }

    private AggregationOrchestrator orchestrator(long timeoutMs) {
        return new AggregationOrchestrator(
            rateLimiter,
            executor,
            new RecordNormalizer(),
            new RecordRanker(),
            new FallbackRecordGenerator(clock),
            timeoutMs
        );
    }
}
