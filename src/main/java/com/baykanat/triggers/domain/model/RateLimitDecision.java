package com.baykanat.triggers.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Token bucket kontrol sonucu; resetAt epoch saniye. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitDecision {

    private boolean allowed;
    private int limit;
    private int remaining;
    private long resetAt;
    private long retryAfterSeconds;

    /** Store erişilemediğinde kullanılan fail-open kararı. */
    public static RateLimitDecision allowAll(int limit, long nowEpochSeconds) {
        return new RateLimitDecision(true, limit, limit, nowEpochSeconds, 0);
    }
}
