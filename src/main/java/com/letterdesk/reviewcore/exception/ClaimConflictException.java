package com.letterdesk.reviewcore.exception;

import java.util.UUID;

/**
 * Another reviewer holds the claim on the letter, or won the race for it.
 * Callers should re-fetch the letter before retrying.
 */
public class ClaimConflictException extends LetterWorkflowException {

    private final UUID letterId;

    public ClaimConflictException(UUID letterId, String message) {
        super(message);
        this.letterId = letterId;
    }

    public UUID getLetterId() {
        return letterId;
    }
}
