package com.baykanat.triggers.infrastructure.ratelimit;

import com.baykanat.triggers.domain.model.RateLimitDecision;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the in-memory token bucket.
 */
class InMemoryRateLimitStoreTest {

    private static final long NOW = 1_700_000_000_000L;

    private final InMemoryRateLimitStore store = new InMemoryRateLimitStore();

    @Test
    @DisplayName("Burst admits exactly capacity requests, then denies")
    void burstEqualsCapacity() {
        int allowed = 0;
        for (int i = 0; i < 15; i++) {
            if (store.tryConsume("key", 10, 1.0, NOW).isAllowed()) {
                allowed++;
            }
        }
        assertThat(allowed).isEqualTo(10);
    }

    @Test
    @DisplayName("Denied request does not consume a token and reports retry-after")
    void denyDoesNotConsume() {
        for (int i = 0; i < 2; i++) {
            store.tryConsume("key", 2, 1.0, NOW);
        }

        RateLimitDecision denied = store.tryConsume("key", 2, 1.0, NOW);
        assertThat(denied.isAllowed()).isFalse();
        assertThat(denied.getRemaining()).isZero();
        assertThat(denied.getRetryAfterSeconds()).isEqualTo(1);

        // bir saniye sonra tam bir token birikmiş olmalı
        assertThat(store.tryConsume("key", 2, 1.0, NOW + 1000).isAllowed()).isTrue();
        assertThat(store.tryConsume("key", 2, 1.0, NOW + 1000).isAllowed()).isFalse();
    }

    @Test
    @DisplayName("Refill never exceeds capacity")
    void refillIsCapped() {
        store.tryConsume("key", 3, 10.0, NOW);

        RateLimitDecision decision = store.tryConsume("key", 3, 10.0, NOW + 60_000);
        assertThat(decision.isAllowed()).isTrue();
        assertThat(decision.getRemaining()).isEqualTo(2);
        assertThat(decision.getLimit()).isEqualTo(3);
    }

    @Test
    @DisplayName("Buckets are independent per key")
    void bucketsPerKey() {
        store.tryConsume("a", 1, 1.0, NOW);

        assertThat(store.tryConsume("a", 1, 1.0, NOW).isAllowed()).isFalse();
        assertThat(store.tryConsume("b", 1, 1.0, NOW).isAllowed()).isTrue();
    }
}
