package com.letterdesk.reviewcore.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

public class AllowanceAccount {

    private final UUID userId;
    private final int monthlyAllowance;
    private final Integer creditsRemaining;
    private final boolean freeTrial;
    private final OffsetDateTime periodStart;
    private final OffsetDateTime periodEnd;

    public AllowanceAccount(UUID userId, int monthlyAllowance, Integer creditsRemaining, boolean freeTrial,
                            OffsetDateTime periodStart, OffsetDateTime periodEnd) {
        this.userId = userId;
        this.monthlyAllowance = monthlyAllowance;
        this.creditsRemaining = creditsRemaining;
        this.freeTrial = freeTrial;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
    }

    /** A null balance marks a privileged account that is never charged. */
    public boolean isUnlimited() {
        return creditsRemaining == null;
    }

    public boolean hasCredit() {
        return isUnlimited() || creditsRemaining > 0;
    }

    public UUID getUserId() {
        return userId;
    }

    public int getMonthlyAllowance() {
        return monthlyAllowance;
    }

    public Integer getCreditsRemaining() {
        return creditsRemaining;
    }

    public boolean isFreeTrial() {
        return freeTrial;
    }

    public OffsetDateTime getPeriodStart() {
        return periodStart;
    }

    public OffsetDateTime getPeriodEnd() {
        return periodEnd;
    }
}
