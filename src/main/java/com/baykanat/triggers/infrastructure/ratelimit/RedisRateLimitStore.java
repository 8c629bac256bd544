package com.baykanat.triggers.infrastructure.ratelimit;

import com.baykanat.triggers.domain.model.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;

/** Replica'lar arası paylaşılan bucket; refill + tüketim tek Lua script'inde atomik. */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisRateLimitStore implements RateLimitStore {

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<String> tokenBucketScript;

    public RedisRateLimitStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.tokenBucketScript = new DefaultRedisScript<>();
        this.tokenBucketScript.setLocation(new ClassPathResource("ratelimit/token_bucket.lua"));
        this.tokenBucketScript.setResultType(String.class);
    }

    @Override
    public RateLimitDecision tryConsume(String key, int capacity, double refillPerSecond, long nowMillis) {
        // Bucket dolana kadar geçen süreden biraz uzun TTL; boşta kalan key'ler kendiliğinden silinir
        long ttlMillis = refillPerSecond > 0
                ? (long) Math.ceil(capacity / refillPerSecond * 1000) + 60000
                : 3600000;

        String result = redisTemplate.execute(tokenBucketScript, Collections.singletonList(key),
                Integer.toString(capacity),
                Double.toString(refillPerSecond / 1000.0),
                Long.toString(nowMillis),
                Long.toString(ttlMillis));
        ScriptResult parsed = parseResult(key, result);
        return TokenBucket.decision(parsed.allowed, parsed.tokensLeft, capacity, refillPerSecond, nowMillis);
    }

    /** Script çıktısı "allowed:tokens" biçiminde, örn. "1:4.5". */
    static ScriptResult parseResult(String key, String result) {
        int separator = result == null ? -1 : result.indexOf(':');
        if (separator <= 0) {
            throw new IllegalStateException("Unexpected token bucket script result for key " + key + ": " + result);
        }
        try {
            boolean allowed = Integer.parseInt(result.substring(0, separator)) == 1;
            double tokensLeft = Double.parseDouble(result.substring(separator + 1));
            return new ScriptResult(allowed, tokensLeft);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Unexpected token bucket script result for key " + key + ": " + result, e);
        }
    }

    static final class ScriptResult {
        final boolean allowed;
        final double tokensLeft;

        ScriptResult(boolean allowed, double tokensLeft) {
            this.allowed = allowed;
            this.tokensLeft = tokensLeft;
        }
    }
}
