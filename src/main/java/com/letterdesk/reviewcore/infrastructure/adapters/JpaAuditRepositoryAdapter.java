package com.letterdesk.reviewcore.infrastructure.adapters;

import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.AuditEntry;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.AuditRepository;
import com.letterdesk.reviewcore.infrastructure.jpa.AuditEntryEntity;
import com.letterdesk.reviewcore.infrastructure.jpa.SpringAuditRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

@Component
public class JpaAuditRepositoryAdapter implements AuditRepository {

    private final SpringAuditRepository entries;

    public JpaAuditRepositoryAdapter(SpringAuditRepository entries) {
        this.entries = entries;
    }

    // Own transaction: an audit failure must never take the business write down with it
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditEntry append(AuditEntry entry) {
        AuditEntryEntity e = new AuditEntryEntity();
        e.setLetterId(entry.letterId());
        e.setAction(entry.action().wireValue());
        e.setOldStatus(entry.oldStatus() == null ? null : entry.oldStatus().wireValue());
        e.setNewStatus(entry.newStatus() == null ? null : entry.newStatus().wireValue());
        e.setPerformedBy(entry.actorId());
        e.setNotes(entry.notes());
        e.setMetadata(entry.metadata().isEmpty() ? null : new LinkedHashMap<>(entry.metadata()));
        e.setCreatedAt(entry.timestamp());
        AuditEntryEntity saved = entries.saveAndFlush(e);
        return toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> findByLetterId(UUID letterId) {
        return entries.findByLetterIdOrderByCreatedAtAscIdAsc(letterId).stream()
                .map(JpaAuditRepositoryAdapter::toDomain)
                .toList();
    }

    private static AuditEntry toDomain(AuditEntryEntity e) {
        return new AuditEntry(
                e.getId(),
                e.getLetterId(),
                AuditAction.fromWire(e.getAction()),
                e.getOldStatus() == null ? null : LetterStatus.fromWire(e.getOldStatus()),
                e.getNewStatus() == null ? null : LetterStatus.fromWire(e.getNewStatus()),
                e.getPerformedBy(),
                e.getNotes(),
                e.getMetadata(),
                e.getCreatedAt());
    }
}
