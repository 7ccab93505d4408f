package com.flagship.pawn_ledger.outbox;

import com.flagship.pawn_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Relays outbox events to Kafka on a fixed schedule.
 *
 * Each event is keyed by its aggregate id and sent synchronously, so events of
 * one voucher or pledge keep their order on the partition.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            int delivered = outboxService.relayBatch(batchSize, maxRetries, this::send);
            if (delivered > 0) {
                log.debug("Relayed {} outbox event(s) to {}", delivered, ledgerEventsTopic);
            }
        } catch (Exception e) {
            log.error("Error in outbox relay loop", e);
        }
    }

    private void send(OutboxEvent event) throws Exception {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(ledgerEventsTopic, event.getAggregateId().toString(), event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());
            outboxMetrics.recordEventPublished(event.getEventType());
        } catch (Exception e) {
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached {} attempts and is now dead-lettered. eventType={}, aggregateId={}",
                    event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
            throw e;
        }
    }
}
