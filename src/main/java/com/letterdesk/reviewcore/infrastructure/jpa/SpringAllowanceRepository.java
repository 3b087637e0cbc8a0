package com.letterdesk.reviewcore.infrastructure.jpa;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface SpringAllowanceRepository extends JpaRepository<AllowanceAccountEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AllowanceAccountEntity a WHERE a.userId = :userId")
    Optional<AllowanceAccountEntity> findByUserIdForUpdate(@Param("userId") UUID userId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AllowanceAccountEntity a SET a.creditsRemaining = a.creditsRemaining - 1, a.updatedAt = :now " +
            "WHERE a.userId = :userId AND a.creditsRemaining > 0")
    int decrementIfAvailable(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE AllowanceAccountEntity a SET a.freeTrial = false, a.updatedAt = :now " +
            "WHERE a.userId = :userId AND a.freeTrial = true")
    int consumeFreeTrial(@Param("userId") UUID userId, @Param("now") OffsetDateTime now);
}
