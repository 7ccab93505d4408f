package com.flagship.pawn_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about the books, written to the outbox in the same transaction as the
 * change it describes.
 */
public interface LedgerEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    UUID getCompanyId();

    Instant getOccurredAt();

    String getEventType();

    /**
     * The aggregate the event is about; used as the Kafka key.
     */
    UUID getAggregateId();

    String getAggregateType();
}
