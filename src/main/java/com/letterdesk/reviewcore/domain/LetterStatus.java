package com.letterdesk.reviewcore.domain;

import java.util.Arrays;

public enum LetterStatus {
    DRAFT("draft"),
    GENERATING("generating"),
    PENDING_REVIEW("pending_review"),
    UNDER_REVIEW("under_review"),
    APPROVED("approved"),
    REJECTED("rejected"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireValue;

    LetterStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    /** Lower-case value used in the database and on the API. */
    public String wireValue() {
        return wireValue;
    }

    /** Owners may only delete letters that never reached a reviewer decision. */
    public boolean isDeletable() {
        return this == DRAFT || this == REJECTED || this == FAILED;
    }

    public static LetterStatus fromWire(String value) {
        return Arrays.stream(values())
                .filter(s -> s.wireValue.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown letter status: " + value));
    }
}
