package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.DeductionResult;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.LetterTransition;
import com.letterdesk.reviewcore.domain.RefundResult;
import com.letterdesk.reviewcore.domain.generation.GenerationRequest;
import com.letterdesk.reviewcore.domain.generation.GenerationResult;
import com.letterdesk.reviewcore.domain.ports.IntakeValidator;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.domain.ports.NotifierPort;
import com.letterdesk.reviewcore.exception.GenerationFailedException;
import com.letterdesk.reviewcore.exception.PersistenceException;
import com.letterdesk.reviewcore.exception.ProviderUnavailableException;
import com.letterdesk.reviewcore.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * End-to-end "generate a letter" flow: validate, charge, create, draft, record.
 * <p>
 * Not transactional as a whole. Each step commits on its own so that a charged credit is visible
 * to concurrent requests at once, and every failure after the charge is compensated by a refund.
 */
@Service
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final IntakeValidator validator;
    private final AllowanceService allowance;
    private final LetterRepository letters;
    private final GenerationProviderAdapter providers;
    private final AuditTrailService audit;
    private final NotifierPort notifier;
    private final Clock clock;

    public GenerationOrchestrator(IntakeValidator validator, AllowanceService allowance, LetterRepository letters,
                                  GenerationProviderAdapter providers, AuditTrailService audit, NotifierPort notifier,
                                  Clock clock) {
        this.validator = validator;
        this.allowance = allowance;
        this.letters = letters;
        this.providers = providers;
        this.audit = audit;
        this.notifier = notifier;
        this.clock = clock;
    }

    /**
     * @throws ValidationException       intake rejected, nothing charged
     * @throws PersistenceException      the letter could not be stored, credit refunded
     * @throws GenerationFailedException both providers failed, letter marked failed
     */
    public GenerationOutcome generate(GenerateLetterCommand cmd) {
        log.info("Letter generation requested - userId: {}, letterType: {}", cmd.userId, cmd.letterType);

        IntakeValidator.Report report = validator.validate(cmd.letterType, cmd.intakeData);
        if (!report.valid()) {
            log.info("Intake rejected for user {}: {}", cmd.userId, report.errors());
            throw new ValidationException(report.errors());
        }

        DeductionResult deduction;
        try {
            deduction = allowance.checkAndDeductAllowance(cmd.userId);
        } catch (RuntimeException e) {
            throw new PersistenceException("Failed to check letter allowance", e);
        }
        if (!deduction.success()) {
            return GenerationOutcome.allowanceExhausted(deduction);
        }

        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter letter = Letter.builder()
                .id(UUID.randomUUID())
                .userId(cmd.userId)
                .letterType(cmd.letterType)
                .title(cmd.letterType + " - " + LocalDate.now(clock))
                .intakeData(cmd.intakeData)
                .status(LetterStatus.GENERATING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            letters.insert(letter);
        } catch (RuntimeException e) {
            log.error("Failed to create letter for user {}: {}", cmd.userId, e.getMessage(), e);
            refundIfCharged(cmd.userId, deduction);
            throw new PersistenceException("Failed to create letter record", e);
        }
        log.info("Letter {} created in generating state for user {}", letter.getId(), cmd.userId);

        GenerationResult result;
        try {
            result = providers.generate(new GenerationRequest(letter.getId(), cmd.userId, cmd.letterType, cmd.intakeData));
        } catch (ProviderUnavailableException e) {
            throw fail(letter, deduction, e.summary(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while generating letter {}: {}", letter.getId(), e.getMessage(), e);
            throw fail(letter, deduction, "UNEXPECTED (" + e.getClass().getSimpleName() + ")", e);
        }

        OffsetDateTime finishedAt = OffsetDateTime.now(clock);
        Letter generated = letter.toBuilder()
                .status(LetterTransition.GENERATION_SUCCEEDED.apply(letter.getStatus()))
                .aiDraftContent(result.content())
                .updatedAt(finishedAt)
                .build();
        boolean written;
        try {
            written = letters.updateIfUnchanged(generated, LetterStatus.GENERATING, null);
        } catch (RuntimeException e) {
            log.error("Failed to store generated content for letter {}: {}", letter.getId(), e.getMessage(), e);
            throw fail(letter, deduction, "PERSISTENCE", e);
        }
        if (!written) {
            // Someone else (the stuck-letter sweeper) already settled this letter
            log.warn("Letter {} left generating state before its draft was stored", letter.getId());
            boolean refunded = refundIfCharged(cmd.userId, deduction);
            throw new GenerationFailedException(letter.getId(), refunded, null);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("letterType", cmd.letterType);
        metadata.put("generationMethod", result.methodUsed().label());
        metadata.put("researchApplied", result.researchApplied());
        metadata.put("jurisdiction", result.jurisdiction());
        metadata.putAll(allowanceMetadata(deduction));
        audit.record(letter.getId(), AuditAction.CREATED, LetterStatus.GENERATING, LetterStatus.PENDING_REVIEW,
                cmd.userId, "Letter generated successfully via " + result.methodUsed().label(), metadata);

        try {
            notifier.letterGenerated(generated, metadata);
        } catch (Exception e) {
            log.error("Failed to queue generation notification for letter {}: {}", letter.getId(), e.getMessage(), e);
        }

        log.info("Letter {} generated via {} and queued for review", letter.getId(), result.methodUsed().label());
        return GenerationOutcome.created(generated, deduction, result.methodUsed());
    }

    private GenerationFailedException fail(Letter letter, DeductionResult deduction, String summary, Throwable cause) {
        Letter failed = letter.toBuilder()
                .status(LetterTransition.GENERATION_FAILED.apply(letter.getStatus()))
                .generationError("Generation failed: " + summary)
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        boolean written;
        try {
            written = letters.updateIfUnchanged(failed, LetterStatus.GENERATING, null);
        } catch (RuntimeException e) {
            log.error("Failed to mark letter {} as failed: {}", letter.getId(), e.getMessage(), e);
            written = false;
        }

        boolean refunded = refundIfCharged(letter.getUserId(), deduction);
        if (!written) {
            // Whoever moved the letter out of generating has already recorded that transition
            log.warn("Letter {} was no longer generating when marking it failed ({}), refunded={}",
                    letter.getId(), summary, refunded);
            return new GenerationFailedException(letter.getId(), refunded, cause);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("failure", summary);
        metadata.put("creditRefunded", refunded);
        audit.record(letter.getId(), AuditAction.GENERATION_FAILED, LetterStatus.GENERATING, LetterStatus.FAILED,
                letter.getUserId(), failed.getGenerationError(), metadata);

        try {
            notifier.generationFailed(failed, summary);
        } catch (Exception e) {
            log.error("Failed to queue failure notification for letter {}: {}", letter.getId(), e.getMessage(), e);
        }

        log.error("Letter {} generation failed: {} (refunded={})", letter.getId(), summary, refunded);
        return new GenerationFailedException(letter.getId(), refunded, cause);
    }

    private boolean refundIfCharged(UUID userId, DeductionResult deduction) {
        if (!deduction.isRefundable()) {
            return false;
        }
        try {
            RefundResult refund = allowance.refundAllowance(userId, 1);
            if (!refund.success()) {
                log.error("Refund for user {} was refused: {}", userId, refund.error());
            }
            return refund.success();
        } catch (RuntimeException e) {
            log.error("Refund for user {} failed: {}", userId, e.getMessage(), e);
            return false;
        }
    }

    private static Map<String, Object> allowanceMetadata(DeductionResult deduction) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("creditCharged", deduction.isRefundable());
        m.put("freeTrial", deduction.freeTrial());
        m.put("creditsRemaining", deduction.remaining());
        return m;
    }
}
