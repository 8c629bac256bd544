package com.baykanat.triggers.infrastructure.ratelimit;

import com.baykanat.triggers.domain.model.RateLimitDecision;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Tek node (ve test) için bucket deposu; key başına atomiklik ConcurrentHashMap.compute ile. */
@Component
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "memory")
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitDecision tryConsume(String key, int capacity, double refillPerSecond, long nowMillis) {
        RateLimitDecision[] result = new RateLimitDecision[1];
        buckets.compute(key, (k, bucket) -> {
            double tokens = bucket == null
                    ? capacity
                    : TokenBucket.refill(bucket.tokens, bucket.lastRefillMillis, capacity, refillPerSecond, nowMillis);
            boolean allowed = tokens >= 1;
            if (allowed) {
                tokens -= 1;
            }
            result[0] = TokenBucket.decision(allowed, tokens, capacity, refillPerSecond, nowMillis);
            return new Bucket(tokens, nowMillis);
        });
        return result[0];
    }

    private static final class Bucket {
        private final double tokens;
        private final long lastRefillMillis;

        private Bucket(double tokens, long lastRefillMillis) {
            this.tokens = tokens;
            this.lastRefillMillis = lastRefillMillis;
        }
    }
}
