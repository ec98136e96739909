package com.stagehand.orchestrator.config;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.util.function.Predicate;

/**
 * Factory for the two backoff policies the orchestrator uses: store lock
 * contention and issue-tracker HTTP calls.
 */
public final class RetryPolicies {

    static final double MULTIPLIER    = 2.0;
    static final double RANDOMIZATION = 0.25;

    private RetryPolicies() {}

    /**
     * Exponential backoff with randomized jitter, clamped at {@code settings.maxDelay()}.
     * Only throwables matching {@code retryOn} are retried.
     *
     * @throws IllegalArgumentException if maxAttempts is below 1
     */
    public static Retry exponential(String name,
                                    StagehandProperties.RetrySettings settings,
                                    Predicate<Throwable> retryOn) {
        if (settings.maxAttempts() < 1) {
            throw new IllegalArgumentException(
                    "maxAttempts must be at least 1, got " + settings.maxAttempts());
        }
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        settings.baseDelay(), MULTIPLIER, RANDOMIZATION, settings.maxDelay()))
                .retryOnException(retryOn)
                .build();
        return Retry.of(name, config);
    }
}
