package com.letterdesk.reviewcore.exception;

import com.letterdesk.reviewcore.domain.LetterStatus;
import com.letterdesk.reviewcore.domain.LetterTransition;

public class InvalidTransitionException extends LetterWorkflowException {

    private final LetterTransition transition;
    private final LetterStatus actualStatus;

    public InvalidTransitionException(LetterTransition transition, LetterStatus actualStatus) {
        super("Cannot " + transition.name().toLowerCase().replace('_', ' ')
                + ": expected status " + transition.from().wireValue()
                + " but found " + (actualStatus == null ? "none" : actualStatus.wireValue()));
        this.transition = transition;
        this.actualStatus = actualStatus;
    }

    public InvalidTransitionException(String message, LetterStatus actualStatus) {
        super(message);
        this.transition = null;
        this.actualStatus = actualStatus;
    }

    /** Null when the rejected operation is not a status transition, e.g. deletion. */
    public LetterTransition getTransition() {
        return transition;
    }

    public LetterStatus getActualStatus() {
        return actualStatus;
    }
}
