package com.flagship.pawn_ledger.outbox;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Next batch for the relay, skipping rows another relay instance holds.
     * Dead-lettered rows are left out so they cannot block the head of the queue.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> lockNextBatch(@Param("limit") int limit, @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries")
    long countDeadLettered(@Param("maxRetries") int maxRetries);

    @Query("SELECT MIN(e.createdAt) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
