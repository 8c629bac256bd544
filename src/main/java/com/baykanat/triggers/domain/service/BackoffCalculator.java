package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.domain.model.RetryPolicy;

import java.util.Random;

/** Retry gecikmesi: min(maxDelay, initialDelay * multiplier^(denemeler - 1)) + [0, delay * jitterRatio] jitter. */
public final class BackoffCalculator {

    private BackoffCalculator() {
    }

    /**
     * @param attemptsMade başarısız olanlar dahil yapılmış deneme sayısı (>= 1)
     */
    public static long computeDelayMs(RetryPolicy policy, int attemptsMade, double jitterRatio, Random random) {
        long baseDelay = baseDelayMs(policy, attemptsMade);
        long jitter = jitterRatio > 0 ? (long) (random.nextDouble() * baseDelay * jitterRatio) : 0;
        return baseDelay + jitter;
    }

    /** Jitter'sız gecikme. */
    public static long baseDelayMs(RetryPolicy policy, int attemptsMade) {
        int exponent = Math.max(0, attemptsMade - 1);
        double delay = policy.getInitialDelayMs() * Math.pow(policy.getMultiplier(), exponent);
        if (Double.isNaN(delay) || delay > policy.getMaxDelayMs()) {
            return policy.getMaxDelayMs();
        }
        return Math.max(0, (long) delay);
    }
}
