package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record AssignRequest(@NotNull UUID reviewerId) {}
