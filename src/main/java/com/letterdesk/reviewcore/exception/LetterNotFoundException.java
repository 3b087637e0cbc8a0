package com.letterdesk.reviewcore.exception;

import java.util.UUID;

public class LetterNotFoundException extends LetterWorkflowException {

    private final UUID letterId;

    public LetterNotFoundException(UUID letterId) {
        super("Letter not found: " + letterId);
        this.letterId = letterId;
    }

    public UUID getLetterId() {
        return letterId;
    }
}
