package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.UUID;

public record BulkApproveRequest(@NotEmpty List<UUID> letterIds, String reviewNotes) {}
