package com.letterdesk.reviewcore.domain;

public enum AuditAction {
    CREATED("created"),
    UPDATED("updated"),
    SUBMITTED("submitted"),
    REVIEW_STARTED("review_started"),
    APPROVED("approved"),
    REJECTED("rejected"),
    RESUBMITTED("resubmitted"),
    COMPLETED("completed"),
    DELETED("deleted"),
    IMPROVED("improved"),
    GENERATION_FAILED("generation_failed"),
    PDF_GENERATED("pdf_generated"),
    EMAIL_SENT("email_sent"),
    ASSIGNED("assigned"),
    RETRIED("retried");

    private final String wireValue;

    AuditAction(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static AuditAction fromWire(String value) {
        for (AuditAction action : values()) {
            if (action.wireValue.equals(value)) {
                return action;
            }
        }
        throw new IllegalArgumentException("Unknown audit action: " + value);
    }
}
