package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ApproveRequest(@NotBlank(message = "Final content is required") String finalContent, String reviewNotes) {}
