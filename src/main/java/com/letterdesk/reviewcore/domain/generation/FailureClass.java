package com.letterdesk.reviewcore.domain.generation;

public enum FailureClass {
    TIMEOUT,
    AUTH_FAILURE,
    NOT_CONFIGURED,
    CLIENT_ERROR,
    SERVER_ERROR,
    /** Transport succeeded but the text was missing or below the minimum length. */
    EMPTY_CONTENT,
    /** The provider answered with an explicit failure flag. */
    REJECTED,
    TRANSPORT_ERROR;

    /** Only server-side faults are worth another attempt against the same provider. */
    public boolean isRetryable() {
        return this == SERVER_ERROR;
    }
}
