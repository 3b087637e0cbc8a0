package com.letterdesk.reviewcore.api.dto;

import com.letterdesk.reviewcore.domain.IntakeData;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Intake constraints are checked by the orchestrator so that every violation is reported at once.
 */
@Schema(description = "Letter generation request")
public record GenerateLetterRequest(
        @Schema(description = "Letter type tag", example = "demand_letter")
        String letterType,

        @Schema(description = "Case facts used to draft the letter")
        IntakeData intakeData
) {}
