package com.baykanat.triggers.infrastructure.ratelimit;

import com.baykanat.triggers.domain.model.RateLimitDecision;

/** Bucket matematiği; store implementasyonları ortak kullanır. */
final class TokenBucket {

    private TokenBucket() {
    }

    /** Son refill'den bu yana biriken token'ları kapasiteyle sınırlayarak ekler. */
    static double refill(double tokens, long lastRefillMillis, int capacity, double refillPerSecond, long nowMillis) {
        long elapsed = Math.max(0, nowMillis - lastRefillMillis);
        return Math.min(capacity, tokens + elapsed / 1000.0 * refillPerSecond);
    }

    /** Tüketim sonrası kalan token'dan header değerlerini üretir. */
    static RateLimitDecision decision(boolean allowed, double tokensLeft, int capacity, double refillPerSecond, long nowMillis) {
        long nowSeconds = nowMillis / 1000;
        long secondsUntilFull = refillPerSecond > 0
                ? (long) Math.ceil((capacity - tokensLeft) / refillPerSecond)
                : 0;
        long retryAfter = 0;
        if (!allowed) {
            retryAfter = refillPerSecond > 0
                    ? Math.max(1, (long) Math.ceil((1 - tokensLeft) / refillPerSecond))
                    : 60;
        }
        return RateLimitDecision.builder()
                .allowed(allowed)
                .limit(capacity)
                .remaining((int) Math.floor(tokensLeft))
                .resetAt(nowSeconds + secondsUntilFull)
                .retryAfterSeconds(retryAfter)
                .build();
    }
}
