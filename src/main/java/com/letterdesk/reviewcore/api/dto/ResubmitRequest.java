package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ResubmitRequest(@NotBlank(message = "Revised content is required") String content) {}
