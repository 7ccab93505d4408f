package com.flagship.pawn_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A serialized ledger event waiting in the outbox, or already relayed to Kafka.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent pending(String aggregateType, UUID aggregateId, String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType, payload,
            Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
