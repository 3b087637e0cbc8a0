package com.letterdesk.reviewcore.domain;

/**
 * Fixed rejection taxonomy offered to attorney reviewers.
 */
public enum RejectionReason {
    INSUFFICIENT_LEGAL_BASIS("Insufficient legal basis for the claims"),
    NEEDS_MORE_FACTS("Need more specific facts or details"),
    TONE_TOO_AGGRESSIVE("Tone is too aggressive/combative"),
    TONE_NOT_STRONG_ENOUGH("Tone is not strong enough"),
    MISSING_LEGAL_ELEMENTS("Missing important legal elements"),
    FORMATTING_ISSUES("Formatting or structure issues"),
    OTHER("Other (please specify)");

    private final String label;

    RejectionReason(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean requiresDetail() {
        return this == OTHER;
    }
}
