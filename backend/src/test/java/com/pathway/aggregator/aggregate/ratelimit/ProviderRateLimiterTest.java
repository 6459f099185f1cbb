package com.pathway.aggregator.aggregate.ratelimit;

import com.pathway.aggregator.aggregate.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderRateLimiterTest {
    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void deniesUntilMinimumIntervalHasElapsed() {
        MutableClock clock = new MutableClock(START);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock);
        limiter.register("coursera", 3600);

        assertThat(limiter.tryAdmit("coursera")).isTrue();
        clock.advance(Duration.ofMillis(999));
        assertThat(limiter.tryAdmit("coursera")).isFalse();
        clock.advance(Duration.ofMillis(1));
        assertThat(limiter.tryAdmit("coursera")).isTrue();
        assertThat(limiter.config("coursera").lastAdmittedAt()).isEqualTo(START.plusMillis(1000));
    }

    @Test
    void deniedAttemptDoesNotMoveLastAdmittedAt() {
        MutableClock clock = new MutableClock(START);
        ProviderRateLimiter limiter = new ProviderRateLimiter(clock);
        limiter.register("github", 60);

        assertThat(limiter.tryAdmit("github")).isTrue();
        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.tryAdmit("github")).isFalse();
        assertThat(limiter.config("github").lastAdmittedAt()).isEqualTo(START);
        assertThat(limiter.config("github").minIntervalMs()).isEqualTo(60_000L);
    }

    @Test
    void unknownProviderIsDeniedAndNamesAreCaseInsensitive() {
        ProviderRateLimiter limiter = new ProviderRateLimiter(new MutableClock(START));
        limiter.register("Udemy", 200);

        assertThat(limiter.tryAdmit("nope")).isFalse();
        assertThat(limiter.tryAdmit("UDEMY")).isTrue();
        assertThat(limiter.configs()).extracting(ProviderConfig::name).containsExactly("udemy");
    }

    @Test
    void concurrentAttemptsAdmitExactlyOneWithinInterval() throws Exception {
        ProviderRateLimiter limiter = new ProviderRateLimiter(new MutableClock(START));
        limiter.register("edx", 1000);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                attempts.add(() -> limiter.tryAdmit("edx"));
            }
            long admitted = 0;
            for (Future<Boolean> result : executor.invokeAll(attempts)) {
                if (result.get()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
}
