package com.medimind.intake.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class InMemoryRpmRateLimiterTest {

    private InMemoryRpmRateLimiter limiter;
    private static final int RPM_LIMIT = 3;

    @BeforeEach
    void setUp() {
        limiter = new InMemoryRpmRateLimiter(RPM_LIMIT);
    }

    @Test
    void shouldEnforceRpmLimit() {
        String key = "completion";
        AtomicInteger counter = new AtomicInteger(0);

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.execute(key, 1, counter::incrementAndGet);
        }

        assertThat(counter.get()).isEqualTo(RPM_LIMIT);

        CompletableFuture<Integer> blockedTask = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, counter::incrementAndGet)
        );

        assertThrows(TimeoutException.class, () -> blockedTask.get(200, TimeUnit.MILLISECONDS));
        assertThat(counter.get()).isEqualTo(RPM_LIMIT);
    }

    @Test
    void shouldCountEachCallOnceWhateverThePermits() {
        String key = "big-prompts";

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.execute(key, 50_000, () -> "ok");
        }

        CompletableFuture<String> blockedTask = CompletableFuture.supplyAsync(() ->
            limiter.execute(key, 1, () -> "denied")
        );

        assertThrows(TimeoutException.class, () -> blockedTask.get(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldIsolateLimitsByKey() {
        String keyA = "user-a";
        String keyB = "user-b";

        for (int i = 0; i < RPM_LIMIT; i++) {
            limiter.acquire(keyA, 1);
        }

        CompletableFuture<String> independentTask = CompletableFuture.supplyAsync(() ->
            limiter.execute(keyB, 1, () -> "success")
        );

        assertThat(independentTask.join()).isEqualTo("success");
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThatThrownBy(() -> new InMemoryRpmRateLimiter(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
