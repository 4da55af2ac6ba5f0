package com.medimind.intake.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter backed by one greedy bucket4j bucket per key.
 * Every call costs a single request regardless of the permits asked for.
 */
@Slf4j
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("rpmLimit must be positive, got " + rpmLimit);
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    @SneakyThrows
    public void acquire(String key, int permits) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        if (bucket.getAvailableTokens() == 0) {
            log.debug("Rate limit reached for '{}', waiting for refill", key);
        }
        bucket.asBlocking().consume(1);
    }
}
