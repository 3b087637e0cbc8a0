package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.Actor;
import com.letterdesk.reviewcore.domain.AuditAction;
import com.letterdesk.reviewcore.domain.AuditEntry;
import com.letterdesk.reviewcore.domain.BulkResult;
import com.letterdesk.reviewcore.domain.Capability;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.LetterTransition;
import com.letterdesk.reviewcore.domain.RejectionReason;
import com.letterdesk.reviewcore.domain.Role;
import com.letterdesk.reviewcore.domain.generation.ImprovementRequest;
import com.letterdesk.reviewcore.domain.ports.LetterRepository;
import com.letterdesk.reviewcore.domain.ports.NotifierPort;
import com.letterdesk.reviewcore.domain.ports.UserDirectory;
import com.letterdesk.reviewcore.exception.ClaimConflictException;
import com.letterdesk.reviewcore.exception.InvalidTransitionException;
import com.letterdesk.reviewcore.exception.LetterNotFoundException;
import com.letterdesk.reviewcore.exception.LetterWorkflowException;
import com.letterdesk.reviewcore.exception.PermissionDeniedException;
import com.letterdesk.reviewcore.exception.PersistenceException;
import com.letterdesk.reviewcore.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Owner and reviewer actions on existing letters. Every write is a guarded compare-and-swap on
 * (status, assigned reviewer) so that two actors can never both win the same transition, and
 * every successful transition is followed by exactly one audit entry.
 */
@Service
public class ReviewStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ReviewStateMachine.class);

    private final LetterRepository letters;
    private final AuditTrailService audit;
    private final NotifierPort notifier;
    private final UserDirectory users;
    private final GenerationProviderAdapter providers;
    private final Clock clock;

    public ReviewStateMachine(LetterRepository letters, AuditTrailService audit, NotifierPort notifier,
                              UserDirectory users, GenerationProviderAdapter providers, Clock clock) {
        this.letters = letters;
        this.audit = audit;
        this.notifier = notifier;
        this.users = users;
        this.providers = providers;
        this.clock = clock;
    }

    // ---- reads

    public Letter getLetter(UUID letterId, Actor actor) {
        Letter letter = load(letterId);
        if (!letter.isOwnedBy(actor.userId()) && !actor.can(Capability.CLAIM)) {
            throw new PermissionDeniedException("You do not have access to this letter");
        }
        return letter;
    }

    public List<Letter> listOwn(Actor actor) {
        return letters.findByOwner(actor.userId());
    }

    public List<Letter> reviewQueue(Actor actor, LetterStatus status) {
        requireCapability(actor, Capability.CLAIM, "view the review queue");
        return letters.findByStatus(status == null ? LetterStatus.PENDING_REVIEW : status);
    }

    /**
     * Audit history. Reviewers can read the history of deleted letters; owners only while the letter exists.
     */
    public List<AuditEntry> history(UUID letterId, Actor actor) {
        Optional<Letter> letter = letters.findById(letterId);
        if (letter.isPresent()) {
            if (!letter.get().isOwnedBy(actor.userId()) && !actor.can(Capability.CLAIM)) {
                throw new PermissionDeniedException("You do not have access to this letter");
            }
        } else if (!actor.can(Capability.CLAIM)) {
            throw new LetterNotFoundException(letterId);
        }
        return audit.history(letterId);
    }

    // ---- owner actions

    public Letter submit(UUID letterId, Actor actor) {
        Letter letter = load(letterId);
        requireOwner(letter, actor);
        LetterStatus next = LetterTransition.SUBMIT.apply(letter.getStatus());
        if (!letter.hasContent()) {
            throw new ValidationException("Letter has no content to submit");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter updated = letter.toBuilder().status(next).submittedAt(now).updatedAt(now).build();
        write(letter, updated, LetterTransition.SUBMIT);

        audit.record(letterId, AuditAction.SUBMITTED, letter.getStatus(), next, actor.userId(), "Submitted for attorney review");
        notifySafely("submitted", letterId, () -> notifier.letterSubmitted(updated));
        log.info("Letter {} submitted for review by {}", letterId, actor.userId());
        return updated;
    }

    /**
     * Replaces the content of a draft, e.g. after a failed letter was returned to draft by {@link #retry}.
     * The status does not change.
     */
    public Letter updateDraft(UUID letterId, Actor actor, String content) {
        Letter letter = load(letterId);
        requireOwner(letter, actor);
        if (letter.getStatus() != LetterStatus.DRAFT) {
            throw new InvalidTransitionException(
                    "Only drafts can be edited, letter is " + letter.getStatus().wireValue(), letter.getStatus());
        }
        if (isBlank(content)) {
            throw new ValidationException("Draft content is required");
        }
        Letter updated = letter.toBuilder()
                .aiDraftContent(content)
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        write(letter, updated, "edit");

        audit.record(letterId, AuditAction.UPDATED, LetterStatus.DRAFT, LetterStatus.DRAFT, actor.userId(), "Draft updated");
        log.info("Draft of letter {} updated by {}", letterId, actor.userId());
        return updated;
    }

    /**
     * Sends a rejected letter back to the queue with the owner's revised text. The letter goes back
     * unassigned, so any reviewer can pick it up.
     */
    public Letter resubmit(UUID letterId, Actor actor, String revisedContent) {
        Letter letter = load(letterId);
        requireOwner(letter, actor);
        LetterStatus next = LetterTransition.RESUBMIT.apply(letter.getStatus());
        if (isBlank(revisedContent)) {
            throw new ValidationException("Revised content is required");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter updated = letter.toBuilder()
                .status(next)
                .aiDraftContent(revisedContent)
                .finalContent(null)
                .rejectionReason(null)
                .assignedReviewer(null)
                .reviewedBy(null)
                .submittedAt(now)
                .updatedAt(now)
                .build();
        write(letter, updated, LetterTransition.RESUBMIT);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousRejectionReason", letter.getRejectionReason());
        audit.record(letterId, AuditAction.RESUBMITTED, letter.getStatus(), next, actor.userId(),
                "Resubmitted with revised content", metadata);
        notifySafely("submitted", letterId, () -> notifier.letterSubmitted(updated));
        log.info("Letter {} resubmitted by {}", letterId, actor.userId());
        return updated;
    }

    /**
     * Moves a failed letter back to draft. Generation is not re-run here and no credit is charged; the
     * owner fills in the draft with {@link #updateDraft} before submitting it.
     */
    public Letter retry(UUID letterId, Actor actor) {
        Letter letter = load(letterId);
        requireOwner(letter, actor);
        LetterStatus next = LetterTransition.RETRY.apply(letter.getStatus());
        Letter updated = letter.toBuilder()
                .status(next)
                .generationError(null)
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        write(letter, updated, LetterTransition.RETRY);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("previousError", letter.getGenerationError());
        audit.record(letterId, AuditAction.RETRIED, letter.getStatus(), next, actor.userId(),
                "Failed letter returned to draft", metadata);
        return updated;
    }

    public void delete(UUID letterId, Actor actor) {
        Letter letter = load(letterId);
        requireOwner(letter, actor);
        if (!letter.getStatus().isDeletable()) {
            throw new InvalidTransitionException(
                    "Cannot delete a letter in status " + letter.getStatus().wireValue(), letter.getStatus());
        }
        boolean deleted;
        try {
            deleted = letters.deleteIfStatus(letterId, letter.getStatus());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to delete letter " + letterId, e);
        }
        if (!deleted) {
            throw new ClaimConflictException(letterId, "Letter changed while it was being deleted, reload and retry");
        }
        audit.record(letterId, AuditAction.DELETED, letter.getStatus(), null, actor.userId(), "Letter deleted by owner");
        log.info("Letter {} deleted by {}", letterId, actor.userId());
    }

    // ---- reviewer actions

    public Letter claim(UUID letterId, Actor actor) {
        requireCapability(actor, Capability.CLAIM, "claim letters");
        Letter letter = load(letterId);
        if (letter.getStatus() == LetterStatus.UNDER_REVIEW) {
            if (letter.isAssignedTo(actor.userId())) {
                return letter;
            }
            throw new ClaimConflictException(letterId, "Letter is already under review by another reviewer");
        }
        LetterTransition.CLAIM.apply(letter.getStatus());

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (claimRow(letterId, actor.userId(), now) == 0) {
            log.info("Reviewer {} lost the claim race on letter {}", actor.userId(), letterId);
            throw new ClaimConflictException(letterId, "Letter was claimed by another reviewer");
        }
        Letter claimed = load(letterId);

        audit.record(letterId, AuditAction.REVIEW_STARTED, LetterStatus.PENDING_REVIEW, LetterStatus.UNDER_REVIEW,
                actor.userId(), "Review started");
        notifySafely("review started", letterId, () -> notifier.reviewStarted(claimed));
        log.info("Letter {} claimed by reviewer {}", letterId, actor.userId());
        return claimed;
    }

    public Letter approve(UUID letterId, Actor actor, String finalContent, String reviewNotes) {
        requireCapability(actor, Capability.APPROVE, "approve letters");
        Letter letter = load(letterId);
        LetterTransition.APPROVE.apply(letter.getStatus());
        requireAssignee(letter, actor);
        if (isBlank(finalContent)) {
            throw new ValidationException("Final content is required");
        }
        return recordApproval(letter, actor, finalContent, reviewNotes, false);
    }

    /**
     * Rejects with a reason from the taxonomy. {@code detail} is mandatory for {@link RejectionReason#OTHER}.
     * Super admins may pass a null reason with free text in {@code detail}.
     */
    public Letter reject(UUID letterId, Actor actor, RejectionReason reason, String detail, String reviewNotes) {
        requireCapability(actor, Capability.REJECT, "reject letters");
        Letter letter = load(letterId);
        LetterTransition.REJECT.apply(letter.getStatus());
        requireAssignee(letter, actor);
        String reasonText = resolveRejection(actor, reason, detail);
        String reasonCode = reason == null ? "free_text" : reason.name().toLowerCase();
        return recordRejection(letter, actor, reasonText, reasonCode, reviewNotes, false);
    }

    /**
     * Has the completion provider rework the draft of a letter under review, following the reviewer's
     * notes. The revised text replaces the draft; approving or rejecting it is still a separate step.
     */
    public Letter improve(UUID letterId, Actor actor, String notes) {
        requireCapability(actor, Capability.APPROVE, "improve letters");
        Letter letter = load(letterId);
        if (letter.getStatus() != LetterStatus.UNDER_REVIEW) {
            throw new InvalidTransitionException(
                    "Only letters under review can be improved, letter is " + letter.getStatus().wireValue(),
                    letter.getStatus());
        }
        requireAssignee(letter, actor);
        if (!letter.hasContent()) {
            throw new ValidationException("Letter has no content to improve");
        }

        String original = letter.currentContent();
        String improved = providers.improve(new ImprovementRequest(letterId, letter.getLetterType(), original, notes));
        Letter updated = letter.toBuilder()
                .aiDraftContent(improved)
                .finalContent(null)
                .updatedAt(OffsetDateTime.now(clock))
                .build();
        write(letter, updated, "improve");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("originalLength", original.length());
        metadata.put("improvedLength", improved.length());
        audit.record(letterId, AuditAction.IMPROVED, LetterStatus.UNDER_REVIEW, LetterStatus.UNDER_REVIEW,
                actor.userId(), notes, metadata);
        log.info("Letter {} improved for reviewer {} ({} -> {} chars)", letterId, actor.userId(),
                original.length(), improved.length());
        return updated;
    }

    /**
     * Marks an approved letter as delivered. A null actor means the system is completing it.
     */
    public Letter complete(UUID letterId, Actor actor) {
        if (actor != null && !actor.isSuperAdmin()) {
            throw new PermissionDeniedException("Only super admins can complete letters");
        }
        Letter letter = load(letterId);
        LetterStatus next = LetterTransition.COMPLETE.apply(letter.getStatus());
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter updated = letter.toBuilder().status(next).completedAt(now).updatedAt(now).build();
        write(letter, updated, LetterTransition.COMPLETE);

        audit.record(letterId, AuditAction.COMPLETED, letter.getStatus(), next,
                actor == null ? null : actor.userId(), "Letter completed");
        notifySafely("completed", letterId, () -> notifier.letterCompleted(updated));
        return updated;
    }

    /**
     * Hands a letter to another reviewer. A pending letter is claimed on their behalf; a letter under
     * review has its claim overridden.
     */
    public Letter reassign(UUID letterId, Actor actor, UUID newReviewerId) {
        requireCapability(actor, Capability.REASSIGN, "reassign letters");
        Role reviewerRole = users.findRole(newReviewerId)
                .orElseThrow(() -> new ValidationException("Unknown reviewer: " + newReviewerId));
        if (!reviewerRole.isReviewer()) {
            throw new ValidationException("User " + newReviewerId + " cannot review letters");
        }

        Letter letter = load(letterId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter updated;
        if (letter.getStatus() == LetterStatus.PENDING_REVIEW) {
            if (claimRow(letterId, newReviewerId, now) == 0) {
                throw new ClaimConflictException(letterId, "Letter was claimed by another reviewer");
            }
            updated = load(letterId);
        } else if (letter.getStatus() == LetterStatus.UNDER_REVIEW) {
            updated = letter.toBuilder().assignedReviewer(newReviewerId).updatedAt(now).build();
            write(letter, updated, LetterTransition.CLAIM);
        } else {
            throw new InvalidTransitionException(LetterTransition.CLAIM, letter.getStatus());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("assignedTo", newReviewerId.toString());
        metadata.put("previousReviewer", letter.getAssignedReviewer() == null ? null : letter.getAssignedReviewer().toString());
        audit.record(letterId, AuditAction.ASSIGNED, letter.getStatus(), LetterStatus.UNDER_REVIEW, actor.userId(),
                "Assigned to reviewer " + newReviewerId, metadata);
        log.info("Letter {} assigned to {} by {}", letterId, newReviewerId, actor.userId());
        return updated;
    }

    public BulkResult bulkApprove(List<UUID> letterIds, Actor actor, String reviewNotes) {
        requireCapability(actor, Capability.BULK_OPERATIONS, "run bulk operations");
        return forEach(letterIds, id -> {
            Letter letter = decidableInBulk(id, actor, LetterTransition.APPROVE);
            if (!letter.hasContent()) {
                throw new ValidationException("Letter has no content to approve");
            }
            recordApproval(letter, actor, letter.currentContent(), reviewNotes, true);
        });
    }

    public BulkResult bulkReject(List<UUID> letterIds, Actor actor, String reason, String reviewNotes) {
        requireCapability(actor, Capability.BULK_OPERATIONS, "run bulk operations");
        if (isBlank(reason)) {
            throw new ValidationException("A rejection reason is required");
        }
        String reasonText = reason.trim();
        return forEach(letterIds, id -> {
            Letter letter = decidableInBulk(id, actor, LetterTransition.REJECT);
            recordRejection(letter, actor, reasonText, "free_text", reviewNotes, true);
        });
    }

    // ---- helpers

    private interface BulkStep {
        void apply(UUID letterId);
    }

    private BulkResult forEach(List<UUID> letterIds, BulkStep step) {
        if (letterIds == null || letterIds.isEmpty()) {
            throw new ValidationException("At least one letter id is required");
        }
        List<UUID> succeeded = new ArrayList<>();
        Map<UUID, String> failed = new LinkedHashMap<>();
        for (UUID id : new LinkedHashSet<>(letterIds)) {
            try {
                step.apply(id);
                succeeded.add(id);
            } catch (LetterWorkflowException e) {
                log.info("Bulk step skipped letter {}: {}", id, e.getMessage());
                failed.put(id, e.getMessage());
            }
        }
        log.info("Bulk operation finished - {} succeeded, {} failed", succeeded.size(), failed.size());
        return new BulkResult(succeeded, failed);
    }

    /**
     * Loads a letter a bulk decision can settle: either unassigned in pending_review, taken over by the
     * decision's own guarded write, or under review by the caller.
     */
    private Letter decidableInBulk(UUID letterId, Actor actor, LetterTransition decision) {
        Letter letter = load(letterId);
        if (letter.getStatus() == LetterStatus.PENDING_REVIEW && letter.getAssignedReviewer() == null) {
            return letter;
        }
        decision.apply(letter.getStatus());
        requireAssignee(letter, actor);
        return letter;
    }

    private Letter recordApproval(Letter letter, Actor actor, String finalContent, String reviewNotes, boolean bulk) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter.Builder builder = letter.toBuilder()
                .status(LetterStatus.APPROVED)
                .finalContent(finalContent)
                .reviewNotes(reviewNotes)
                .reviewedBy(actor.userId())
                .assignedReviewer(null)
                .approvedAt(now)
                .updatedAt(now);
        if (letter.getStatus() == LetterStatus.PENDING_REVIEW) {
            builder.reviewStartedAt(now);
        }
        Letter updated = builder.build();
        write(letter, updated, LetterTransition.APPROVE);

        Map<String, Object> metadata = new LinkedHashMap<>();
        if (bulk) {
            metadata.put("bulk", true);
        }
        audit.record(letter.getId(), AuditAction.APPROVED, letter.getStatus(), LetterStatus.APPROVED,
                actor.userId(), reviewNotes, metadata);
        notifySafely("approved", letter.getId(), () -> notifier.letterApproved(updated));
        log.info("Letter {} approved by {}", letter.getId(), actor.userId());
        return updated;
    }

    private Letter recordRejection(Letter letter, Actor actor, String reasonText, String reasonCode,
                                   String reviewNotes, boolean bulk) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        Letter.Builder builder = letter.toBuilder()
                .status(LetterStatus.REJECTED)
                .rejectionReason(reasonText)
                .reviewNotes(reviewNotes)
                .reviewedBy(actor.userId())
                .assignedReviewer(null)
                .rejectedAt(now)
                .updatedAt(now);
        if (letter.getStatus() == LetterStatus.PENDING_REVIEW) {
            builder.reviewStartedAt(now);
        }
        Letter updated = builder.build();
        write(letter, updated, LetterTransition.REJECT);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reasonCode", reasonCode);
        metadata.put("rejectionReason", reasonText);
        if (bulk) {
            metadata.put("bulk", true);
        }
        audit.record(letter.getId(), AuditAction.REJECTED, letter.getStatus(), LetterStatus.REJECTED,
                actor.userId(), reviewNotes, metadata);
        notifySafely("rejected", letter.getId(), () -> notifier.letterRejected(updated));
        log.info("Letter {} rejected by {}: {}", letter.getId(), actor.userId(), reasonText);
        return updated;
    }

    private String resolveRejection(Actor actor, RejectionReason reason, String detail) {
        if (reason == null) {
            if (actor.can(Capability.FREE_TEXT_REJECTION) && !isBlank(detail)) {
                return detail.trim();
            }
            throw new ValidationException("A rejection reason from the list is required");
        }
        if (reason.requiresDetail()) {
            if (isBlank(detail)) {
                throw new ValidationException("Please specify the rejection reason");
            }
            return detail.trim();
        }
        return isBlank(detail) ? reason.label() : reason.label() + ": " + detail.trim();
    }

    private int claimRow(UUID letterId, UUID reviewerId, OffsetDateTime at) {
        try {
            return letters.claim(letterId, reviewerId, at);
        } catch (ConcurrencyFailureException e) {
            log.info("Claim on letter {} lost on lock contention: {}", letterId, e.getMessage());
            return 0;
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to claim letter " + letterId, e);
        }
    }

    private void write(Letter current, Letter updated, LetterTransition transition) {
        if (!tryWrite(current, updated)) {
            Letter latest = load(current.getId());
            if (latest.getStatus() == current.getStatus()) {
                throw new ClaimConflictException(current.getId(), "Letter was reassigned while you were working on it");
            }
            throw new InvalidTransitionException(transition, latest.getStatus());
        }
    }

    /** Guarded write for edits that keep the status. */
    private void write(Letter current, Letter updated, String action) {
        if (!tryWrite(current, updated)) {
            Letter latest = load(current.getId());
            if (latest.getStatus() == current.getStatus()) {
                throw new ClaimConflictException(current.getId(), "Letter was reassigned while you were working on it");
            }
            throw new InvalidTransitionException("Cannot " + action + " letter: status changed to "
                    + latest.getStatus().wireValue(), latest.getStatus());
        }
    }

    private boolean tryWrite(Letter current, Letter updated) {
        boolean written;
        try {
            written = letters.updateIfUnchanged(updated, current.getStatus(), current.getAssignedReviewer());
        } catch (ConcurrencyFailureException e) {
            throw new ClaimConflictException(current.getId(), "Letter was modified concurrently, reload and retry");
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to update letter " + current.getId(), e);
        }
        return written;
    }

    private Letter load(UUID letterId) {
        try {
            return letters.findById(letterId).orElseThrow(() -> new LetterNotFoundException(letterId));
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to load letter " + letterId, e);
        }
    }

    private static void requireOwner(Letter letter, Actor actor) {
        if (!letter.isOwnedBy(actor.userId())) {
            throw new PermissionDeniedException("You can only modify your own letters");
        }
    }

    private static void requireAssignee(Letter letter, Actor actor) {
        if (!letter.isAssignedTo(actor.userId())) {
            throw new ClaimConflictException(letter.getId(), "Letter is assigned to another reviewer");
        }
    }

    private static void requireCapability(Actor actor, Capability capability, String what) {
        if (!actor.can(capability)) {
            throw new PermissionDeniedException("Your role cannot " + what);
        }
    }

    private void notifySafely(String event, UUID letterId, Runnable action) {
        try {
            action.run();
        } catch (Exception e) {
            log.error("Failed to queue {} notification for letter {}: {}", event, letterId, e.getMessage(), e);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
