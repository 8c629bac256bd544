package com.baykanat.triggers.domain.exception;

import com.baykanat.triggers.domain.model.RateLimitDecision;

/** Token bitti; 429 + Retry-After ve rate limit header'ları. */
public class RateLimitExceededException extends RuntimeException {

    private final transient RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super("Rate limit exceeded, retry after " + decision.getRetryAfterSeconds() + " seconds");
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }
}
