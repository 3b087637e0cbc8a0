package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.AuditEntry;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.ports.AuditRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Best-effort writer and reader of the per-letter audit trail.
 */
@Service
public class AuditTrailService {

    private static final Logger log = LoggerFactory.getLogger(AuditTrailService.class);

    private final AuditRepository audits;
    private final Clock clock;
    private final Counter failures;

    public AuditTrailService(AuditRepository audits, Clock clock, MeterRegistry meterRegistry) {
        this.audits = audits;
        this.clock = clock;
        this.failures = Counter.builder("letters.audit.failures")
                .description("Audit entries that could not be written")
                .register(meterRegistry);
    }

    /**
     * Appends one entry. Never throws: a failed write is logged and counted, and the transition it
     * describes stands.
     */
    public Optional<AuditEntry> record(UUID letterId, AuditAction action, LetterStatus oldStatus, LetterStatus newStatus,
                                       UUID actorId, String notes, Map<String, Object> metadata) {
        AuditEntry entry = new AuditEntry(null, letterId, action, oldStatus, newStatus, actorId, notes, metadata,
                OffsetDateTime.now(clock));
        try {
            AuditEntry saved = audits.append(entry);
            log.debug("Audit {} recorded for letter {} ({} -> {})", action.wireValue(), letterId,
                    oldStatus == null ? null : oldStatus.wireValue(), newStatus == null ? null : newStatus.wireValue());
            return Optional.of(saved);
        } catch (Exception e) {
            failures.increment();
            log.error("AUDIT WRITE FAILED - letter: {}, action: {}, actor: {}, error: {}",
                    letterId, action.wireValue(), actorId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<AuditEntry> record(UUID letterId, AuditAction action, LetterStatus oldStatus, LetterStatus newStatus,
                                       UUID actorId, String notes) {
        return record(letterId, action, oldStatus, newStatus, actorId, notes, Map.of());
    }

    public List<AuditEntry> history(UUID letterId) {
        return audits.findByLetterId(letterId);
    }
}
