package com.stagehand.orchestrator.config;

import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPoliciesTest {

    private static final StagehandProperties.RetrySettings FAST =
            new StagehandProperties.RetrySettings(3, Duration.ofMillis(1), Duration.ofMillis(5));

    @Test
    void exponential_retriesMatchingFailuresUpToMaxAttempts() {
        Retry retry = RetryPolicies.exponential("t", FAST, e -> e instanceof UncheckedIOException);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            calls.incrementAndGet();
            throw new UncheckedIOException(new IOException("reset"));
        })).isInstanceOf(UncheckedIOException.class);

        assertThat(calls).hasValue(3);
    }

    @Test
    void exponential_nonMatchingFailure_isNotRetried() {
        Retry retry = RetryPolicies.exponential("t", FAST, e -> e instanceof UncheckedIOException);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.executeSupplier(() -> {
            calls.incrementAndGet();
            throw new IllegalStateException("401");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void exponential_succeedsAfterTransientFailure() {
        Retry retry = RetryPolicies.exponential("t", FAST, e -> true);
        AtomicInteger calls = new AtomicInteger();

        String result = retry.executeSupplier(() -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("busy");
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    void exponential_zeroAttempts_rejected() {
        StagehandProperties.RetrySettings none =
                new StagehandProperties.RetrySettings(0, Duration.ofMillis(1), Duration.ofMillis(1));

        assertThatThrownBy(() -> RetryPolicies.exponential("t", none, e -> true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }
}
