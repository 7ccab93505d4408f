package com.flagship.pawn_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.pawn_ledger.event.LedgerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Transactional outbox for ledger events.
 *
 * {@link #record(LedgerEvent)} joins the caller's transaction, so an event
 * exists if and only if the ledger change it describes was committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Callback that delivers one event; throwing marks the attempt as failed.
     */
    @FunctionalInterface
    public interface Sender {
        void send(OutboxEvent event) throws Exception;
    }

    /**
     * Writes the event in the current transaction. Fails when called outside one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent record(LedgerEvent event) {
        OutboxEvent pending = OutboxEvent.pending(
            event.getAggregateType(), event.getAggregateId(), event.getEventType(), serialize(event));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(pending));

        log.debug("Recorded outbox event: type={}, aggregateType={}, aggregateId={}",
            event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return saved.toDomain();
    }

    /**
     * Locks the next batch of pending events and hands each to the sender.
     * Rows stay locked until the batch commits, so concurrent relays never send
     * the same event twice.
     *
     * @return number of events delivered
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int relayBatch(int limit, int maxRetries, Sender sender) {
        List<OutboxEventEntity> batch = repository.lockNextBatch(limit, maxRetries);
        int delivered = 0;

        for (OutboxEventEntity entity : batch) {
            try {
                sender.send(entity.toDomain());
                entity.markPublished();
                delivered++;
            } catch (Exception e) {
                entity.markFailed(e.getMessage());
                log.warn("Failed to relay outbox event {} (attempt #{}): {}",
                    entity.getId(), entity.getRetryCount(), e.getMessage());
            }
        }
        return delivered;
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serialize(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
