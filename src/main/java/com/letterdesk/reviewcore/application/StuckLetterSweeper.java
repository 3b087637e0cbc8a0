package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.config.AppProperties;
import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.LetterTransition;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.domain.ports.NotifierPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Finds letters that never left the generating state, alerts operators, and fails the ones that
 * are past all hope. The credit of a swept letter is not refunded automatically.
 */
@Component
public class StuckLetterSweeper {

    private static final Logger log = LoggerFactory.getLogger(StuckLetterSweeper.class);

    static final String TIMEOUT_ERROR = "Letter generation timeout - exceeded maximum wait time";

    private final LetterRepository letters;
    private final AuditTrailService audit;
    private final NotifierPort notifier;
    private final Clock clock;
    private final boolean enabled;
    private final Duration stuckAfter;
    private final Duration failAfter;

    public StuckLetterSweeper(LetterRepository letters, AuditTrailService audit, NotifierPort notifier, Clock clock,
                              AppProperties properties) {
        this.letters = letters;
        this.audit = audit;
        this.notifier = notifier;
        this.clock = clock;
        this.enabled = properties.getSweeper().isEnabled();
        this.stuckAfter = properties.getSweeper().getStuckAfter();
        this.failAfter = properties.getSweeper().getFailAfter();
        log.info("StuckLetterSweeper initialized - enabled: {}, stuckAfter: {}, failAfter: {}", enabled, stuckAfter, failAfter);
    }

    @Scheduled(fixedDelayString = "${app.sweeper.poll-ms:300000}", initialDelayString = "${app.sweeper.initial-delay-ms:60000}")
    public void scheduledSweep() {
        if (!enabled) {
            log.trace("Stuck letter sweep is disabled");
            return;
        }
        try {
            sweep();
        } catch (Exception e) {
            log.error("Stuck letter sweep failed: {}", e.getMessage(), e);
        }
    }

    public SweepReport sweep() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        List<Letter> stuck = letters.findByStatusCreatedBefore(LetterStatus.GENERATING, now.minus(stuckAfter));
        if (stuck.isEmpty()) {
            return new SweepReport(List.of(), List.of());
        }

        OffsetDateTime failCutoff = now.minus(failAfter);
        List<UUID> alerted = new ArrayList<>();
        List<UUID> failed = new ArrayList<>();
        for (Letter letter : stuck) {
            if (letter.getCreatedAt() != null && letter.getCreatedAt().isBefore(failCutoff)) {
                if (markFailed(letter, now)) {
                    failed.add(letter.getId());
                }
            } else {
                alerted.add(letter.getId());
            }
        }

        log.warn("Found {} letter(s) stuck in generating state - {} still waiting, {} marked failed",
                stuck.size(), alerted.size(), failed.size());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("stuckCount", stuck.size());
        details.put("waiting", alerted.stream().map(UUID::toString).toList());
        details.put("markedFailed", failed.stream().map(UUID::toString).toList());
        try {
            notifier.operationalAlert("Letters stuck in generation", details);
        } catch (Exception e) {
            log.error("Failed to queue stuck letter alert: {}", e.getMessage(), e);
        }
        return new SweepReport(alerted, failed);
    }

    private boolean markFailed(Letter letter, OffsetDateTime now) {
        Letter failed = letter.toBuilder()
                .status(LetterTransition.GENERATION_FAILED.apply(letter.getStatus()))
                .generationError(TIMEOUT_ERROR)
                .updatedAt(now)
                .build();
        try {
            if (!letters.updateIfUnchanged(failed, LetterStatus.GENERATING, null)) {
                return false;
            }
        } catch (Exception e) {
            log.error("Failed to time out letter {}: {}", letter.getId(), e.getMessage(), e);
            return false;
        }
        audit.record(letter.getId(), AuditAction.GENERATION_FAILED, LetterStatus.GENERATING, LetterStatus.FAILED,
                null, TIMEOUT_ERROR, Map.of("sweep", true));
        return true;
    }

    public record SweepReport(List<UUID> alerted, List<UUID> failed) {
    }
}
