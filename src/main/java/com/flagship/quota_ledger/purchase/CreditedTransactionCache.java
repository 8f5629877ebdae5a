package com.flagship.quota_ledger.purchase;

import com.flagship.quota_ledger.config.LedgerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis fast path for "has this transaction already been credited?".
 *
 * Entries are only written after the credit committed, so a hit is always
 * a true duplicate. A miss, a disabled cache or an unreachable Redis all
 * fall through to the purchase journal, which stays authoritative.
 */
@Component
@Slf4j
public class CreditedTransactionCache {

    private final Optional<StringRedisTemplate> redisTemplate;
    private final boolean enabled;
    private final Duration ttl;
    private final String keyPrefix;

    public CreditedTransactionCache(Optional<StringRedisTemplate> redisTemplate,
                                    LedgerProperties properties) {
        LedgerProperties.IdempotencyCache settings = properties.getIdempotencyCache();
        this.redisTemplate = redisTemplate;
        this.enabled = settings.isEnabled() && redisTemplate.isPresent();
        this.ttl = settings.getTtl();
        this.keyPrefix = settings.getKeyPrefix();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isCredited(String transactionId) {
        if (!enabled) {
            return false;
        }
        try {
            Boolean present = redisTemplate.get().hasKey(keyPrefix + transactionId);
            if (Boolean.TRUE.equals(present)) {
                log.debug("Transaction {} found in credited cache", transactionId);
                return true;
            }
        } catch (Exception e) {
            log.warn("Credited cache lookup failed for {}, falling back to journal: {}",
                transactionId, e.getMessage());
        }
        return false;
    }

    /**
     * Remembers a committed credit. Failures only cost the fast path.
     */
    public void markCredited(String transactionId, String userKey) {
        if (!enabled) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(keyPrefix + transactionId, userKey, ttl);
        } catch (Exception e) {
            log.warn("Failed to cache credited transaction {}: {}", transactionId, e.getMessage());
        }
    }

    /**
     * @return true if Redis answered a ping
     */
    public boolean ping() {
        if (redisTemplate.isEmpty() || redisTemplate.get().getConnectionFactory() == null) {
            return false;
        }
        try (var connection = redisTemplate.get().getConnectionFactory().getConnection()) {
            return "PONG".equalsIgnoreCase(connection.ping());
        }
    }
}
