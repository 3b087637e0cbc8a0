package com.letterdesk.reviewcore.exception;

/**
 * The caller's role lacks the capability the operation requires, or the caller does not own the letter.
 */
public class PermissionDeniedException extends LetterWorkflowException {

    public PermissionDeniedException(String message) {
        super(message);
    }
}
