package com.letterdesk.reviewcore.domain;

import com.letterdesk.reviewcore.exception.InvalidTransitionException;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every status change a letter can go through. Anything not listed here is illegal.
 */
public enum LetterTransition {
    SUBMIT(LetterStatus.DRAFT, LetterStatus.PENDING_REVIEW, AuditAction.SUBMITTED),
    GENERATION_SUCCEEDED(LetterStatus.GENERATING, LetterStatus.PENDING_REVIEW, AuditAction.CREATED),
    GENERATION_FAILED(LetterStatus.GENERATING, LetterStatus.FAILED, AuditAction.GENERATION_FAILED),
    CLAIM(LetterStatus.PENDING_REVIEW, LetterStatus.UNDER_REVIEW, AuditAction.REVIEW_STARTED),
    APPROVE(LetterStatus.UNDER_REVIEW, LetterStatus.APPROVED, AuditAction.APPROVED),
    REJECT(LetterStatus.UNDER_REVIEW, LetterStatus.REJECTED, AuditAction.REJECTED),
    RESUBMIT(LetterStatus.REJECTED, LetterStatus.PENDING_REVIEW, AuditAction.RESUBMITTED),
    COMPLETE(LetterStatus.APPROVED, LetterStatus.COMPLETED, AuditAction.COMPLETED),
    RETRY(LetterStatus.FAILED, LetterStatus.DRAFT, AuditAction.RETRIED);

    private final LetterStatus from;
    private final LetterStatus to;
    private final AuditAction auditAction;

    LetterTransition(LetterStatus from, LetterStatus to, AuditAction auditAction) {
        this.from = from;
        this.to = to;
        this.auditAction = auditAction;
    }

    public LetterStatus from() {
        return from;
    }

    public LetterStatus to() {
        return to;
    }

    public AuditAction auditAction() {
        return auditAction;
    }

    public boolean isAllowedFrom(LetterStatus current) {
        return from == current;
    }

    /**
     * Returns the target status, or throws if the letter is not in this transition's source status.
     */
    public LetterStatus apply(LetterStatus current) {
        if (!isAllowedFrom(current)) {
            throw new InvalidTransitionException(this, current);
        }
        return to;
    }

    public static Optional<LetterTransition> between(LetterStatus from, LetterStatus to) {
        return Arrays.stream(values())
                .filter(t -> t.from == from && t.to == to)
                .findFirst();
    }
}
