package com.letterdesk.reviewcore.domain.generation;

import com.letterdesk.reviewcore.domain.IntakeData;

import java.util.UUID;

public record GenerationRequest(UUID letterId, UUID userId, String letterType, IntakeData intakeData) {
}
