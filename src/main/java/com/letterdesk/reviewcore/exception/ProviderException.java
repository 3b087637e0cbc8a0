package com.letterdesk.reviewcore.exception;

import com.letterdesk.reviewcore.domain.generation.FailureClass;

/**
 * A single content provider could not produce a usable letter.
 */
public class ProviderException extends LetterWorkflowException {

    private final String providerId;
    private final FailureClass failureClass;

    public ProviderException(String providerId, FailureClass failureClass, String message) {
        super(message);
        this.providerId = providerId;
        this.failureClass = failureClass;
    }

    public ProviderException(String providerId, FailureClass failureClass, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
        this.failureClass = failureClass;
    }

    public String getProviderId() {
        return providerId;
    }

    public FailureClass getFailureClass() {
        return failureClass;
    }
}
