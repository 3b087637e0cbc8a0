package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotBlank;

public record DraftUpdateRequest(@NotBlank(message = "Draft content is required") String content) {}
