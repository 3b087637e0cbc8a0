package com.letterdesk.reviewcore.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.OffsetDateTime;

public record OpenAccountRequest(
        @NotNull @Min(0) Integer monthlyAllowance,
        OffsetDateTime periodStart,
        OffsetDateTime periodEnd
) {}
