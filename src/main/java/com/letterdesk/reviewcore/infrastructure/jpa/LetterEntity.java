package com.letterdesk.reviewcore.infrastructure.jpa;

import com.letterdesk.reviewcore.domain.IntakeData;
import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "letters", indexes = {
        @Index(name = "idx_letters_user", columnList = "user_id"),
        @Index(name = "idx_letters_status_created", columnList = "status, created_at")
})
public class LetterEntity {
    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "letter_type", nullable = false, length = 64)
    private String letterType;

    @Column(length = 255)
    private String title;

    @Column(name = "intake_data", columnDefinition = "text")
    @Convert(converter = IntakeDataConverter.class)
    private IntakeData intakeData;

    @Column(nullable = false, length = 32)
    private String status;

    @Column(name = "ai_draft_content", columnDefinition = "text")
    private String aiDraftContent;

    @Column(name = "final_content", columnDefinition = "text")
    private String finalContent;

    @Column(name = "assigned_reviewer")
    private UUID assignedReviewer;

    @Column(name = "reviewed_by")
    private UUID reviewedBy;

    @Column(name = "rejection_reason", columnDefinition = "text")
    private String rejectionReason;

    @Column(name = "review_notes", columnDefinition = "text")
    private String reviewNotes;

    @Column(name = "generation_error", columnDefinition = "text")
    private String generationError;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "review_started_at")
    private OffsetDateTime reviewStartedAt;

    @Column(name = "approved_at")
    private OffsetDateTime approvedAt;

    @Column(name = "rejected_at")
    private OffsetDateTime rejectedAt;

    @Column(name = "completed_at")
    private OffsetDateTime completedAt;

    public UUID getId() { return id; }
    public void setId(UUID id) { this.id = id; }

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public String getLetterType() { return letterType; }
    public void setLetterType(String letterType) { this.letterType = letterType; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public IntakeData getIntakeData() { return intakeData; }
    public void setIntakeData(IntakeData intakeData) { this.intakeData = intakeData; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getAiDraftContent() { return aiDraftContent; }
    public void setAiDraftContent(String aiDraftContent) { this.aiDraftContent = aiDraftContent; }

    public String getFinalContent() { return finalContent; }
    public void setFinalContent(String finalContent) { this.finalContent = finalContent; }

    public UUID getAssignedReviewer() { return assignedReviewer; }
    public void setAssignedReviewer(UUID assignedReviewer) { this.assignedReviewer = assignedReviewer; }

    public UUID getReviewedBy() { return reviewedBy; }
    public void setReviewedBy(UUID reviewedBy) { this.reviewedBy = reviewedBy; }

    public String getRejectionReason() { return rejectionReason; }
    public void setRejectionReason(String rejectionReason) { this.rejectionReason = rejectionReason; }

    public String getReviewNotes() { return reviewNotes; }
    public void setReviewNotes(String reviewNotes) { this.reviewNotes = reviewNotes; }

    public String getGenerationError() { return generationError; }
    public void setGenerationError(String generationError) { this.generationError = generationError; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }

    public OffsetDateTime getSubmittedAt() { return submittedAt; }
    public void setSubmittedAt(OffsetDateTime submittedAt) { this.submittedAt = submittedAt; }

    public OffsetDateTime getReviewStartedAt() { return reviewStartedAt; }
    public void setReviewStartedAt(OffsetDateTime reviewStartedAt) { this.reviewStartedAt = reviewStartedAt; }

    public OffsetDateTime getApprovedAt() { return approvedAt; }
    public void setApprovedAt(OffsetDateTime approvedAt) { this.approvedAt = approvedAt; }

    public OffsetDateTime getRejectedAt() { return rejectedAt; }
    public void setRejectedAt(OffsetDateTime rejectedAt) { this.rejectedAt = rejectedAt; }

    public OffsetDateTime getCompletedAt() { return completedAt; }
    public void setCompletedAt(OffsetDateTime completedAt) { this.completedAt = completedAt; }
}
