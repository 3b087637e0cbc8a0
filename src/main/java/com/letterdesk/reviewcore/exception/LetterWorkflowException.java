package com.letterdesk.reviewcore.exception;

/**
 * Base class for every error raised by the letter generation and review workflow.
 */
public class LetterWorkflowException extends RuntimeException {

    /**
     * Constructs a new workflow exception with the specified detail message.
     *
     * @param message the detail message
     */
    public LetterWorkflowException(String message) {
        super(message);
    }

    /**
     * Constructs a new workflow exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval)
     */
    public LetterWorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
