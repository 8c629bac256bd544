package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.RetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for BackoffCalculator.
 */
class BackoffCalculatorTest {

    private final RetryPolicy policy = RetryPolicy.builder()
            .maxAttempts(5)
            .initialDelayMs(1000)
            .maxDelayMs(10000)
            .multiplier(2.0)
            .build();

    @Test
    @DisplayName("Base delay grows by multiplier per attempt made")
    void baseDelayIsExponential() {
        assertThat(BackoffCalculator.baseDelayMs(policy, 1)).isEqualTo(1000);
        assertThat(BackoffCalculator.baseDelayMs(policy, 2)).isEqualTo(2000);
        assertThat(BackoffCalculator.baseDelayMs(policy, 3)).isEqualTo(4000);
        assertThat(BackoffCalculator.baseDelayMs(policy, 4)).isEqualTo(8000);
    }

    @Test
    @DisplayName("Base delay is capped at max delay")
    void baseDelayIsCapped() {
        assertThat(BackoffCalculator.baseDelayMs(policy, 5)).isEqualTo(10000);
        assertThat(BackoffCalculator.baseDelayMs(policy, 60)).isEqualTo(10000);
    }

    @Test
    @DisplayName("Jitter stays within [delay, delay * (1 + ratio)]")
    void jitterIsBounded() {
        Random random = new Random(42);
        for (int i = 0; i < 1000; i++) {
            long delay = BackoffCalculator.computeDelayMs(policy, 2, 0.1, random);
            assertThat(delay).isBetween(2000L, 2200L);
        }
    }

    @Test
    @DisplayName("Zero jitter ratio yields the base delay")
    void zeroJitter() {
        assertThat(BackoffCalculator.computeDelayMs(policy, 3, 0.0, new Random())).isEqualTo(4000);
    }
}
