package com.flagship.pawn_ledger.observability;

import com.flagship.pawn_ledger.ledger.LedgerService;
import com.flagship.pawn_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Health indicators for the ledger service, exposed through {@code /actuator/health}.
 */
public class HealthIndicators {

    /**
     * Backlog of unrelayed ledger events. A dead-lettered event leaves a gap in
     * the downstream audit stream and takes the indicator down regardless of
     * the backlog size.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 500;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 5000;

        private final OutboxEventRepository outboxRepository;
        private final int maxRetries;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                     @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
            this.outboxRepository = outboxRepository;
            this.maxRetries = maxRetries;
        }

        @Override
        public Health health() {
            try {
                long backlog = outboxRepository.countUnpublished();
                long deadLettered = outboxRepository.countDeadLettered(maxRetries);

                Health.Builder builder;
                if (deadLettered > 0 || backlog >= BACKLOG_CRITICAL_THRESHOLD) {
                    builder = Health.down();
                } else if (backlog >= BACKLOG_WARNING_THRESHOLD) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlog", backlog)
                        .withDetail("deadLettered", deadLettered)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Down when any voucher exists without ledger entries. The commit-time
     * balance trigger should make that impossible.
     */
    @Component("ledgerIntegrity")
    public static class LedgerIntegrityHealthIndicator implements HealthIndicator {

        private final LedgerService ledgerService;

        public LedgerIntegrityHealthIndicator(LedgerService ledgerService) {
            this.ledgerService = ledgerService;
        }

        @Override
        public Health health() {
            try {
                long unposted = ledgerService.countUnpostedVouchers();
                Health.Builder builder = unposted == 0 ? Health.up() : Health.down();
                return builder
                        .withDetail("unpostedVouchers", unposted)
                        .build();
            } catch (DataAccessException e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis only backs the receipt-number fast path, so losing it degrades the
     * service rather than taking it down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return degraded("No connection factory configured");
                }

                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    if ("PONG".equals(result)) {
                        return Health.up()
                                .withDetail("response", result)
                                .build();
                    }
                    return degraded("Unexpected ping response: " + result);
                }
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private Health degraded(String error) {
            return Health.status("DEGRADED")
                    .withDetail("error", error)
                    .withDetail("note", "Receipt lookups fall back to the database")
                    .build();
        }
    }
}
