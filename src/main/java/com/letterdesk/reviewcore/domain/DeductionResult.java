package com.letterdesk.reviewcore.domain;

/**
 * Outcome of spending one letter credit. A failed deduction is a normal business outcome that
 * asks the caller to send the user to the purchase flow.
 */
public record DeductionResult(
        boolean success,
        Integer remaining,
        boolean freeTrial,
        boolean superAdmin,
        String errorMessage,
        boolean needsSubscription) {

    public static final String NO_CREDITS_MESSAGE = "No letter credits remaining. Please purchase a subscription.";

    public static DeductionResult charged(int remaining) {
        return new DeductionResult(true, remaining, false, false, null, false);
    }

    public static DeductionResult unlimited() {
        return new DeductionResult(true, null, false, true, null, false);
    }

    public static DeductionResult trial() {
        return new DeductionResult(true, 0, true, false, null, false);
    }

    public static DeductionResult exhausted() {
        return new DeductionResult(false, 0, false, false, NO_CREDITS_MESSAGE, true);
    }

    /** True when a credit was actually taken and must be given back on failure. */
    public boolean isRefundable() {
        return success && !freeTrial && !superAdmin;
    }
}
