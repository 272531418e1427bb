package com.flagship.exchange_ledger.settlement;

import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Settlement idempotency keys.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the unique idempotency_key column of exchange_transactions
 * 3. Cache database hits back into Redis
 *
 * The database is the source of truth; Redis failures are logged and ignored.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "settlement-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);
    private static final int MAX_KEY_LENGTH = 255;

    private final ExchangeTransactionRepository transactionRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(ExchangeTransactionRepository transactionRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.transactionRepository = transactionRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the transaction already settled under this key, if any
     */
    public Optional<UUID> findSettledTransaction(String idempotencyKey) {
        requireKey(idempotencyKey);
        String redisKey = REDIS_KEY_PREFIX + idempotencyKey;

        if (redisTemplate.isPresent()) {
            try {
                String transactionId = redisTemplate.get().opsForValue().get(redisKey);
                if (transactionId != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(transactionId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key: {}. Falling back to database. Error: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = transactionRepository.findByIdempotencyKey(idempotencyKey)
            .map(ExchangeTransactionEntity::getId);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(redisKey, id);
        });
        return stored;
    }

    /**
     * Caches a settled key in Redis. The database row written by settlement already holds it.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        cache(REDIS_KEY_PREFIX + idempotencyKey, transactionId);
    }

    public void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new ValidationException("Idempotency key cannot exceed " + MAX_KEY_LENGTH + " characters");
        }
    }

    private void cache(String redisKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(redisKey, transactionId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key in Redis: {}. Error: {}", redisKey, e.getMessage());
        }
    }
}
