package com.letterdesk.reviewcore.infrastructure.jpa;

import jakarta.persistence.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "allowance_account")
public class AllowanceAccountEntity {
    @Id
    @Column(name = "user_id")
    private UUID userId;

    @Column(name = "monthly_allowance", nullable = false)
    private int monthlyAllowance;

    // null = unlimited
    @Column(name = "credits_remaining")
    private Integer creditsRemaining;

    @Column(name = "free_trial", nullable = false)
    private boolean freeTrial;

    @Column(name = "period_start")
    private OffsetDateTime periodStart;

    @Column(name = "period_end")
    private OffsetDateTime periodEnd;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public UUID getUserId() { return userId; }
    public void setUserId(UUID userId) { this.userId = userId; }

    public int getMonthlyAllowance() { return monthlyAllowance; }
    public void setMonthlyAllowance(int monthlyAllowance) { this.monthlyAllowance = monthlyAllowance; }

    public Integer getCreditsRemaining() { return creditsRemaining; }
    public void setCreditsRemaining(Integer creditsRemaining) { this.creditsRemaining = creditsRemaining; }

    public boolean isFreeTrial() { return freeTrial; }
    public void setFreeTrial(boolean freeTrial) { this.freeTrial = freeTrial; }

    public OffsetDateTime getPeriodStart() { return periodStart; }
    public void setPeriodStart(OffsetDateTime periodStart) { this.periodStart = periodStart; }

    public OffsetDateTime getPeriodEnd() { return periodEnd; }
    public void setPeriodEnd(OffsetDateTime periodEnd) { this.periodEnd = periodEnd; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
