package com.letterdesk.reviewcore.api.dto;

import com.letterdesk.reviewcore.domain.AuditEntry;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record AuditEntryResponse(
        Long sequence,
        UUID letterId,
        String action,
        String oldStatus,
        String newStatus,
        UUID performedBy,
        String notes,
        Map<String, Object> metadata,
        OffsetDateTime timestamp
) {

    public static AuditEntryResponse from(AuditEntry e) {
        return new AuditEntryResponse(e.sequence(), e.letterId(), e.action().wireValue(),
                e.oldStatus() == null ? null : e.oldStatus().wireValue(),
                e.newStatus() == null ? null : e.newStatus().wireValue(),
                e.actorId(), e.notes(), e.metadata(), e.timestamp());
    }
}
