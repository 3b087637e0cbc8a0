package com.letterdesk.reviewcore.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One user's request for a drafted letter. Instances are immutable; status changes produce a
 * modified copy through {@link #toBuilder()}.
 */
public class Letter {

    private final UUID id;
    private final UUID userId;
    private final String letterType;
    private final String title;
    private final IntakeData intakeData;
    private final LetterStatus status;
    private final String aiDraftContent;
    private final String finalContent;
    private final UUID assignedReviewer;
    private final UUID reviewedBy;
    private final String rejectionReason;
    private final String reviewNotes;
    private final String generationError;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime updatedAt;
    private final OffsetDateTime submittedAt;
    private final OffsetDateTime reviewStartedAt;
    private final OffsetDateTime approvedAt;
    private final OffsetDateTime rejectedAt;
    private final OffsetDateTime completedAt;

    private Letter(Builder b) {
        this.id = b.id;
        this.userId = b.userId;
        this.letterType = b.letterType;
        this.title = b.title;
        this.intakeData = b.intakeData;
        this.status = b.status;
        this.aiDraftContent = b.aiDraftContent;
        this.finalContent = b.finalContent;
        this.assignedReviewer = b.assignedReviewer;
        this.reviewedBy = b.reviewedBy;
        this.rejectionReason = b.rejectionReason;
        this.reviewNotes = b.reviewNotes;
        this.generationError = b.generationError;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
        this.submittedAt = b.submittedAt;
        this.reviewStartedAt = b.reviewStartedAt;
        this.approvedAt = b.approvedAt;
        this.rejectedAt = b.rejectedAt;
        this.completedAt = b.completedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.userId = userId;
        b.letterType = letterType;
        b.title = title;
        b.intakeData = intakeData;
        b.status = status;
        b.aiDraftContent = aiDraftContent;
        b.finalContent = finalContent;
        b.assignedReviewer = assignedReviewer;
        b.reviewedBy = reviewedBy;
        b.rejectionReason = rejectionReason;
        b.reviewNotes = reviewNotes;
        b.generationError = generationError;
        b.createdAt = createdAt;
        b.updatedAt = updatedAt;
        b.submittedAt = submittedAt;
        b.reviewStartedAt = reviewStartedAt;
        b.approvedAt = approvedAt;
        b.rejectedAt = rejectedAt;
        b.completedAt = completedAt;
        return b;
    }

    public boolean isOwnedBy(UUID candidate) {
        return userId.equals(candidate);
    }

    public boolean isAssignedTo(UUID reviewer) {
        return assignedReviewer != null && assignedReviewer.equals(reviewer);
    }

    /** Reviewer-edited text if present, otherwise the generated draft. */
    public String currentContent() {
        return finalContent != null && !finalContent.isBlank() ? finalContent : aiDraftContent;
    }

    public boolean hasContent() {
        String content = currentContent();
        return content != null && !content.isBlank();
    }

    public UUID getId() { return id; }
    public UUID getUserId() { return userId; }
    public String getLetterType() { return letterType; }
    public String getTitle() { return title; }
    public IntakeData getIntakeData() { return intakeData; }
    public LetterStatus getStatus() { return status; }
    public String getAiDraftContent() { return aiDraftContent; }
    public String getFinalContent() { return finalContent; }
    public UUID getAssignedReviewer() { return assignedReviewer; }
    public UUID getReviewedBy() { return reviewedBy; }
    public String getRejectionReason() { return rejectionReason; }
    public String getReviewNotes() { return reviewNotes; }
    public String getGenerationError() { return generationError; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public OffsetDateTime getSubmittedAt() { return submittedAt; }
    public OffsetDateTime getReviewStartedAt() { return reviewStartedAt; }
    public OffsetDateTime getApprovedAt() { return approvedAt; }
    public OffsetDateTime getRejectedAt() { return rejectedAt; }
    public OffsetDateTime getCompletedAt() { return completedAt; }

    public static class Builder {
        private UUID id;
        private UUID userId;
        private String letterType;
        private String title;
        private IntakeData intakeData;
        private LetterStatus status;
        private String aiDraftContent;
        private String finalContent;
        private UUID assignedReviewer;
        private UUID reviewedBy;
        private String rejectionReason;
        private String reviewNotes;
        private String generationError;
        private OffsetDateTime createdAt;
        private OffsetDateTime updatedAt;
        private OffsetDateTime submittedAt;
        private OffsetDateTime reviewStartedAt;
        private OffsetDateTime approvedAt;
        private OffsetDateTime rejectedAt;
        private OffsetDateTime completedAt;

        private Builder() {
        }

        public Builder id(UUID id) { this.id = id; return this; }
        public Builder userId(UUID userId) { this.userId = userId; return this; }
        public Builder letterType(String letterType) { this.letterType = letterType; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder intakeData(IntakeData intakeData) { this.intakeData = intakeData; return this; }
        public Builder status(LetterStatus status) { this.status = status; return this; }
        public Builder aiDraftContent(String aiDraftContent) { this.aiDraftContent = aiDraftContent; return this; }
        public Builder finalContent(String finalContent) { this.finalContent = finalContent; return this; }
        public Builder assignedReviewer(UUID assignedReviewer) { this.assignedReviewer = assignedReviewer; return this; }
        public Builder reviewedBy(UUID reviewedBy) { this.reviewedBy = reviewedBy; return this; }
        public Builder rejectionReason(String rejectionReason) { this.rejectionReason = rejectionReason; return this; }
        public Builder reviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; return this; }
        public Builder generationError(String generationError) { this.generationError = generationError; return this; }
        public Builder createdAt(OffsetDateTime createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder submittedAt(OffsetDateTime submittedAt) { this.submittedAt = submittedAt; return this; }
        public Builder reviewStartedAt(OffsetDateTime reviewStartedAt) { this.reviewStartedAt = reviewStartedAt; return this; }
        public Builder approvedAt(OffsetDateTime approvedAt) { this.approvedAt = approvedAt; return this; }
        public Builder rejectedAt(OffsetDateTime rejectedAt) { this.rejectedAt = rejectedAt; return this; }
        public Builder completedAt(OffsetDateTime completedAt) { this.completedAt = completedAt; return this; }

        public Letter build() {
            if (id == null || userId == null || status == null) {
                throw new IllegalStateException("Letter requires id, userId and status");
            }
            return new Letter(this);
        }
    }
}
