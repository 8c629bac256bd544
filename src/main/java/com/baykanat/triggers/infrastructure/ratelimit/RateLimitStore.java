package com.baykanat.triggers.infrastructure.ratelimit;

import com.baykanat.triggers.domain.model.RateLimitDecision;

/**
 * Token bucket deposu. Refill ve tüketim tek atomik adımda yapılır;
 * token yoksa hiçbir şey tüketilmez.
 */
public interface RateLimitStore {

    RateLimitDecision tryConsume(String key, int capacity, double refillPerSecond, long nowMillis);
}
