package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

public record BulkRejectRequest(@NotEmpty List<UUID> letterIds,
                                @NotBlank(message = "A rejection reason is required") String reason,
                                String reviewNotes) {}
