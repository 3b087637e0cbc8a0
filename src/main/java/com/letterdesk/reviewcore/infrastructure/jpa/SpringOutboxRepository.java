package com.letterdesk.reviewcore.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface SpringOutboxRepository extends JpaRepository<OutboxEventEntity, UUID> {

    // Batch for the dispatcher; events that keep failing are parked after maxAttempts
    @Query("SELECT e FROM OutboxEventEntity e WHERE e.processedAt IS NULL AND e.attempts < :maxAttempts ORDER BY e.occurredAt ASC")
    List<OutboxEventEntity> findPending(@Param("maxAttempts") int maxAttempts, Pageable page);

    long countByProcessedAtIsNull();
    long countByProcessedAtIsNotNull();

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.processedAt IS NULL AND e.attempts >= :maxAttempts")
    long countParked(@Param("maxAttempts") int maxAttempts);

    List<OutboxEventEntity> findByAggregateIdOrderByOccurredAtAsc(UUID aggregateId);
}
