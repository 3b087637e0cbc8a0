package com.letterdesk.reviewcore.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface SpringAuditRepository extends JpaRepository<AuditEntryEntity, Long> {

    List<AuditEntryEntity> findByLetterIdOrderByCreatedAtAscIdAsc(UUID letterId);

    long countByLetterId(UUID letterId);
}
