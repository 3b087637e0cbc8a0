package com.letterdesk.reviewcore.infrastructure.jpa;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SpringLetterRepository extends JpaRepository<LetterEntity, UUID> {

    List<LetterEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<LetterEntity> findByStatusOrderByCreatedAtAsc(String status);

    List<LetterEntity> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(String status, OffsetDateTime cutoff);

    long countByUserId(UUID userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM LetterEntity l WHERE l.id = :id")
    Optional<LetterEntity> findByIdForUpdate(@Param("id") UUID id);

    // Conditional update; the row count tells the claim winner from the losers
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE LetterEntity l SET l.status = :underReview, l.assignedReviewer = :reviewer, " +
            "l.reviewStartedAt = :at, l.updatedAt = :at " +
            "WHERE l.id = :id AND l.status = :pendingReview AND l.assignedReviewer IS NULL")
    int claim(@Param("id") UUID id,
              @Param("reviewer") UUID reviewer,
              @Param("at") OffsetDateTime at,
              @Param("pendingReview") String pendingReview,
              @Param("underReview") String underReview);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM LetterEntity l WHERE l.id = :id AND l.status = :status")
    int deleteByIdAndStatus(@Param("id") UUID id, @Param("status") String status);
}
