package com.letterdesk.reviewcore.application;

import com.letterdesk.reviewcore.domain.DeductionResult;
import com.letterdesk.reviewcore.domain.Letter;
import com.letterdesk.reviewcore.domain.generation.GenerationMethod;

/**
 * Result of a generation request that did not fail. Either a letter waiting for review, or a
 * refusal because the user has no credit left.
 */
public record GenerationOutcome(Letter letter, DeductionResult deduction, GenerationMethod methodUsed) {

    public static GenerationOutcome created(Letter letter, DeductionResult deduction, GenerationMethod methodUsed) {
        return new GenerationOutcome(letter, deduction, methodUsed);
    }

    public static GenerationOutcome allowanceExhausted(DeductionResult deduction) {
        return new GenerationOutcome(null, deduction, null);
    }

    public boolean isCreated() {
        return letter != null;
    }

    public boolean isFreeTrial() {
        return deduction.freeTrial();
    }
}
