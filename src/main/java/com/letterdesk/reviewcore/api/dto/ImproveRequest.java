package com.letterdesk.reviewcore.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

public record ImproveRequest(
        @Schema(description = "What the revision should change", example = "Firmer deadline, cite the contract clause")
        String notes
) {}
