package com.letterdesk.reviewcore.exception;

/**
 * Primary and fallback providers both failed.
 */
public class ProviderUnavailableException extends LetterWorkflowException {

    private final ProviderException primaryFailure;
    private final ProviderException fallbackFailure;

    public ProviderUnavailableException(ProviderException primaryFailure, ProviderException fallbackFailure) {
        super("All generation providers failed: "
                + describe(primaryFailure) + ", " + describe(fallbackFailure), fallbackFailure);
        this.primaryFailure = primaryFailure;
        this.fallbackFailure = fallbackFailure;
        if (primaryFailure != null && primaryFailure != fallbackFailure) {
            addSuppressed(primaryFailure);
        }
    }

    public ProviderException getPrimaryFailure() {
        return primaryFailure;
    }

    public ProviderException getFallbackFailure() {
        return fallbackFailure;
    }

    /** Short operator-facing summary, e.g. {@code TIMEOUT (primary), EMPTY_CONTENT (fallback)}. */
    public String summary() {
        return describe(primaryFailure) + ", " + describe(fallbackFailure);
    }

    private static String describe(ProviderException e) {
        return e == null ? "n/a" : e.getFailureClass() + " (" + e.getProviderId() + ")";
    }
}
