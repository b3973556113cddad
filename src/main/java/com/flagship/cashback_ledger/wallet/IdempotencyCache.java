package com.flagship.cashback_ledger.wallet;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path in front of the journal's unique idempotency-key index.
 *
 * Strategy:
 * 1. Look the key up in Redis (fast, may be unavailable)
 * 2. On a miss or any Redis error, fall through to the journal
 * 3. Remember keys of completed rows for future replays
 *
 * The journal stays the source of truth: a Redis hit only saves a lookup and
 * is always confirmed against the journal row it points to.
 */
@Component
@Slf4j
public class IdempotencyCache {

    private static final String REDIS_KEY_PREFIX = "ledger:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;

    public IdempotencyCache(Optional<StringRedisTemplate> redisTemplate,
                            @Value("${ledger.idempotency.redis-enabled:false}") boolean enabled) {
        this.redisTemplate = redisTemplate;
        this.enabled = enabled && redisTemplate.isPresent();
    }

    /**
     * A cache that never hits, for wiring without Redis.
     */
    public static IdempotencyCache disabled() {
        return new IdempotencyCache(Optional.empty(), false);
    }

    /**
     * @param idempotencyKey Key of the operation
     * @return Id of the completed journal row, if Redis knows it
     */
    public Optional<String> lookup(String idempotencyKey) {
        if (!enabled) {
            return Optional.empty();
        }
        try {
            String transactionId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            if (transactionId != null) {
                log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            }
            return Optional.ofNullable(transactionId);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key: {}. Falling back to journal. Error: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Records a completed row. Best effort: failures are logged and ignored.
     */
    public void remember(String idempotencyKey, String transactionId) {
        if (!enabled) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, transactionId, REDIS_TTL);
        } catch (Exception e) {
            log.debug("Failed to cache idempotency key in Redis: {}", e.getMessage());
        }
    }

    public boolean isEnabled() {
        return enabled;
    }
}
