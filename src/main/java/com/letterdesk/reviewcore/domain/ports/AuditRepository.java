package com.letterdesk.reviewcore.domain.ports;

import com.letterdesk.reviewcore.domain.AuditEntry;

import java.util.List;
import java.util.UUID;

public interface AuditRepository {

    AuditEntry append(AuditEntry entry);

    /** Entries for one letter ordered by timestamp, then sequence. */
    List<AuditEntry> findByLetterId(UUID letterId);
}
