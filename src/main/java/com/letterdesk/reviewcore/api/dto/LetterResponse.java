package com.letterdesk.reviewcore.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.Letter;

import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record LetterResponse(
        UUID id,
        UUID userId,
        String letterType,
        String title,
        String status,
        IntakeData intakeData,
        String aiDraftContent,
        String finalContent,
        UUID assignedReviewer,
        UUID reviewedBy,
        String rejectionReason,
        String reviewNotes,
        String generationError,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime submittedAt,
        OffsetDateTime reviewStartedAt,
        OffsetDateTime approvedAt,
        OffsetDateTime rejectedAt,
        OffsetDateTime completedAt
) {

    public static LetterResponse from(Letter l) {
        return new LetterResponse(l.getId(), l.getUserId(), l.getLetterType(), l.getTitle(), l.getStatus().wireValue(),
                l.getIntakeData(), l.getAiDraftContent(), l.getFinalContent(), l.getAssignedReviewer(), l.getReviewedBy(),
                l.getRejectionReason(), l.getReviewNotes(), l.getGenerationError(), l.getCreatedAt(), l.getUpdatedAt(),
                l.getSubmittedAt(), l.getReviewStartedAt(), l.getApprovedAt(), l.getRejectedAt(), l.getCompletedAt());
    }
}
