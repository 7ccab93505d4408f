package com.flagship.pawn_ledger.observability;

import com.flagship.pawn_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox backlog gauges and relay counters.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * Prometheus scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished ledger events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished ledger event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetteredCount, AtomicLong::get)
                .description("Number of ledger events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long unpublished = outboxRepository.countUnpublished();
            backlogSize.set(unpublished);

            outboxRepository.findOldestUnpublishedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0));

            long deadLettered = outboxRepository.countDeadLettered(maxRetries);
            deadLetteredCount.set(deadLettered);

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    unpublished, oldestEventAgeSeconds.get(), deadLettered);
        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "success").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published", "event_type", eventType, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered", "event_type", eventType).increment();
    }
}
