package com.baykanat.triggers.domain.service;

import com.baykanat.triggers.config.AppProperties;
import com.baykanat.triggers.domain.model.ApiCredential;
import com.baykanat.triggers.domain.model.RateLimitDecision;
import com.baykanat.triggers.infrastructure.ratelimit.RateLimitStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/** Ingestion sınırında credential başına token bucket. Store hatasında fail-open. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

    private final RateLimitStore rateLimitStore;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Bir token tüketmeyi dener; ret durumunda token harcanmaz. */
    public RateLimitDecision check(ApiCredential credential) {
        AppProperties.TierProperties tier = appProperties.getRateLimit().resolveTier(credential.getTier());
        long now = clock.millis();
        try {
            RateLimitDecision decision = rateLimitStore.tryConsume(
                    credential.rateLimitKey(), tier.getCapacity(), tier.getRefillPerSecond(), now);
            if (!decision.isAllowed()) {
                log.debug("Rate limited key_id={}, retry_after={}s", credential.getKeyId(), decision.getRetryAfterSeconds());
            }
            return decision;
        } catch (Exception e) {
            log.warn("Rate limit store unavailable, allowing request for key_id={}: {}",
                    credential.getKeyId(), e.getMessage());
            return RateLimitDecision.allowAll(tier.getCapacity(), now / 1000);
        }
    }
}
