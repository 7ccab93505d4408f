package com.flagship.pawn_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Receipt number to payment id lookups for idempotent payment recording.
 *
 * Redis is the fast path and may be absent or down; the unique receipt number
 * in {@code pledge_payments} is the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:receipt:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentRepository paymentRepository;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(PaymentRepository paymentRepository,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.paymentRepository = paymentRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Finds the payment already recorded under a receipt number.
     */
    public Optional<UUID> findPaymentId(String receiptNumber) {
        if (receiptNumber == null || receiptNumber.isBlank()) {
            return Optional.empty();
        }

        if (redisTemplate.isPresent()) {
            try {
                String paymentId = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + receiptNumber);
                if (paymentId != null) {
                    log.debug("Receipt {} found in Redis", receiptNumber);
                    return Optional.of(UUID.fromString(paymentId));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for receipt {}, falling back to database: {}",
                    receiptNumber, e.getMessage());
            }
        }

        Optional<UUID> paymentId = paymentRepository.findByReceiptNumber(receiptNumber).map(PaymentEntity::getId);
        paymentId.ifPresent(id -> {
            log.debug("Receipt {} found in database", receiptNumber);
            remember(receiptNumber, id);
        });
        return paymentId;
    }

    /**
     * Caches the mapping in Redis. Best effort; the database row already holds it.
     */
    public void remember(String receiptNumber, UUID paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + receiptNumber, paymentId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache receipt {} in Redis: {}", receiptNumber, e.getMessage());
        }
    }

    /**
     * Drops the mapping of a deleted payment so the receipt number resolves to nothing.
     */
    public void forget(String receiptNumber) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().delete(REDIS_KEY_PREFIX + receiptNumber);
        } catch (Exception e) {
            log.warn("Failed to evict receipt {} from Redis: {}", receiptNumber, e.getMessage());
        }
    }
}
