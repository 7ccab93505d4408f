package com.flagship.pawn_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Counters and timers for postings, payments and year-end runs.
 *
 * <ul>
 *   <li>{@code ledger.vouchers.posted{type}}</li>
 *   <li>{@code ledger.vouchers.rejected{reason}}</li>
 *   <li>{@code ledger.posting.duration}</li>
 *   <li>{@code pledge.disbursed}</li>
 *   <li>{@code pledge.payments{action}}</li>
 *   <li>{@code ledger.year_end{operation}}</li>
 *   <li>{@code idempotency.cache{result}}</li>
 *   <li>{@code ledger.api.duration{endpoint}}</li>
 *   <li>{@code ledger.vouchers.unposted}, refreshed by {@link MetricsScheduler}</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer postingTimer;
    private final AtomicLong unpostedVouchers = new AtomicLong(0);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to post one voucher")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("ledger.vouchers.unposted", unpostedVouchers, AtomicLong::get)
                .description("Vouchers that carry no ledger entries")
                .register(registry);
    }

    public void recordVoucherPosted(String voucherType) {
        registry.counter("ledger.vouchers.posted", "type", sanitizeTag(voucherType)).increment();
    }

    public void recordVoucherRejected(String reason) {
        registry.counter("ledger.vouchers.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void updateUnpostedVouchers(long count) {
        unpostedVouchers.set(count);
    }

    public void recordPostingDuration(Duration duration) {
        postingTimer.record(duration);
    }

    /**
     * @param action recorded, updated or deleted
     */
    public void recordPaymentAction(String action) {
        registry.counter("pledge.payments", "action", sanitizeTag(action)).increment();
    }

    public void recordPledgeDisbursed() {
        registry.counter("pledge.disbursed").increment();
    }

    public void recordYearEnd(String operation) {
        registry.counter("ledger.year_end", "operation", sanitizeTag(operation)).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public <T> T timeApi(String endpoint, Supplier<T> operation) {
        return Timer.builder("ledger.api.duration")
                .tag("endpoint", sanitizeTag(endpoint))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(operation);
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
