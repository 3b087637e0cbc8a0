package com.letterdesk.reviewcore.domain.generation;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt-1)} plus up to {@code maxJitter} of random slack.
 * {@code maxRetries} counts retries, so a provider is called at most {@code maxRetries + 1} times.
 */
public final class BackoffPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxJitter;

    public BackoffPolicy(int maxRetries, Duration baseDelay, Duration maxJitter) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxJitter = maxJitter == null ? Duration.ZERO : maxJitter;
    }

    public static BackoffPolicy noRetries() {
        return new BackoffPolicy(0, Duration.ZERO, Duration.ZERO);
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public boolean canRetry(int failedAttempts) {
        return failedAttempts <= maxRetries;
    }

    /**
     * Delay before retry number {@code retry} (1-based).
     */
    public Duration delayBeforeRetry(int retry) {
        long base = baseDelay.toMillis() * (1L << Math.max(0, retry - 1));
        long jitter = maxJitter.isZero() ? 0 : ThreadLocalRandom.current().nextLong(maxJitter.toMillis() + 1);
        return Duration.ofMillis(base + jitter);
    }

    @Override
    public String toString() {
        return "BackoffPolicy{maxRetries=" + maxRetries + ", baseDelay=" + baseDelay + ", maxJitter=" + maxJitter + '}';
    }
}
