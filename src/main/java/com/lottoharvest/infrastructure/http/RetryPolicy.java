package com.lottoharvest.infrastructure.http;

import java.time.Duration;
import java.util.Set;

/**
 * Shared retry rules for every request the harvester makes.
 */
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;
    private final Set<Integer> retryableStatuses;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
                       Duration maxBackoff, Set<Integer> retryableStatuses) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
        this.retryableStatuses = Set.copyOf(retryableStatuses);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, Set.of());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the delay after the first failed attempt
     */
    public Duration backoffFor(int retry) {
        if (retry < 1) {
            return Duration.ZERO;
        }
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, retry - 1);
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean isRetryable(int statusCode) {
        return retryableStatuses.contains(statusCode);
    }
}
