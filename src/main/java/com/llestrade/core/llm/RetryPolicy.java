package com.llestrade.core.llm;

import com.llestrade.core.config.EngineProperties;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient provider failures.
 *
 * @param maxAttempts    attempts per provider, including the first
 * @param initialBackoff wait after the first failure
 * @param multiplier     growth factor between waits
 * @param maxBackoff     cap on a single wait
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy from(EngineProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getInitialBackoffMs()),
                retry.getMultiplier(),
                Duration.ofMillis(retry.getMaxBackoffMs()));
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /** Wait before attempt {@code failedAttempt + 1}; {@code failedAttempt} starts at 1. */
    public Duration backoffAfter(int failedAttempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
    }
}
