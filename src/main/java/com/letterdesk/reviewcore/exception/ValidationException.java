package com.letterdesk.reviewcore.exception;

import java.util.List;

/**
 * Input rejected before any side effect took place.
 */
public class ValidationException extends LetterWorkflowException {

    private final List<String> errors;

    public ValidationException(String message) {
        this(List.of(message));
    }

    public ValidationException(List<String> errors) {
        super(errors.isEmpty() ? "Validation failed" : String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
