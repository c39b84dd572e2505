package com.devpipeline.orchestrator.service;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts    total invocations allowed, first attempt included
 * @param initialBackoff delay after the first failed attempt
 * @param maxBackoff     upper bound for any single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff must not be negative");
        }
    }

    public boolean canRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /** Delay before attempt {@code failedAttempt + 1}: initial * 2^(failedAttempt-1), capped. */
    public Duration delayAfter(int failedAttempt) {
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 30);
        long millis = initialBackoff.toMillis() * (1L << shift);
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }
}
