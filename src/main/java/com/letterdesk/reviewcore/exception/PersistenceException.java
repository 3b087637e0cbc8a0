package com.letterdesk.reviewcore.exception;

/**
 * A store write failed; the transition it belonged to did not happen.
 */
public class PersistenceException extends LetterWorkflowException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
