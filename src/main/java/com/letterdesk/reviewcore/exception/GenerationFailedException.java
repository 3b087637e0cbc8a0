package com.letterdesk.reviewcore.exception;

import java.util.UUID;

/**
 * Both providers failed. The message is safe to show to the letter owner; provider details
 * stay on the letter and in the audit trail.
 */
public class GenerationFailedException extends LetterWorkflowException {

    private final UUID letterId;
    private final boolean creditRefunded;

    public GenerationFailedException(UUID letterId, boolean creditRefunded, Throwable cause) {
        super(creditRefunded
                ? "Letter generation failed. Your letter credit has been refunded."
                : "Letter generation failed. Please try again later.", cause);
        this.letterId = letterId;
        this.creditRefunded = creditRefunded;
    }

    public UUID getLetterId() {
        return letterId;
    }

    public boolean isCreditRefunded() {
        return creditRefunded;
    }
}
