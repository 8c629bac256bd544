package com.baykanat.triggers.api.controller;

import com.baykanat.triggers.domain.model.RateLimitDecision;
import org.springframework.http.HttpHeaders;

/** X-RateLimit-* header'ları; 429 yanıtına Retry-After eklenir. */
public final class RateLimitHeaders {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";
    public static final String RETRY_AFTER = "Retry-After";

    private RateLimitHeaders() {
    }

    public static HttpHeaders of(RateLimitDecision decision) {
        HttpHeaders headers = new HttpHeaders();
        if (decision == null) {
            return headers;
        }
        headers.set(LIMIT, String.valueOf(decision.getLimit()));
        headers.set(REMAINING, String.valueOf(decision.getRemaining()));
        headers.set(RESET, String.valueOf(decision.getResetAt()));
        if (!decision.isAllowed()) {
            headers.set(RETRY_AFTER, String.valueOf(Math.max(1, decision.getRetryAfterSeconds())));
        }
        return headers;
    }
}
