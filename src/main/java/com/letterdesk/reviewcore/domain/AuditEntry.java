package com.letterdesk.reviewcore.domain;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only fact about a letter. {@code sequence} is assigned by the store on append and breaks
 * ties between entries written within the same clock tick.
 */
public record AuditEntry(
        Long sequence,
        UUID letterId,
        AuditAction action,
        LetterStatus oldStatus,
        LetterStatus newStatus,
        UUID actorId,
        String notes,
        Map<String, Object> metadata,
        OffsetDateTime timestamp) {

    public AuditEntry {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
