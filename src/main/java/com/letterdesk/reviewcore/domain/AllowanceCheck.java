package com.letterdesk.reviewcore.domain;

/**
 * Read-only balance view. {@code remaining} is null for unlimited accounts.
 */
public record AllowanceCheck(boolean hasAllowance, Integer remaining) {

    public boolean isUnlimited() {
        return hasAllowance && remaining == null;
    }
}
