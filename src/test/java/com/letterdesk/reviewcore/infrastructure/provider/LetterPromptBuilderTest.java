package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.IntakeData;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class LetterPromptBuilderTest {

    @Test
    void includesPresentFactsAndSkipsAbsentOnes() {
        IntakeData intake = new IntakeData("Alice", null, "ca", null, "Bob", null, null, null,
                "Unpaid invoice", "Pay in full", new BigDecimal("1250.50"), "2024-04-01", null, null);

        String prompt = LetterPromptBuilder.userPrompt("demand_letter", intake);

        assertThat(prompt).startsWith("Draft a professional Demand Letter letter");
        assertThat(prompt).contains("Sender Name: Alice", "Sender State: CA", "Recipient Name: Bob");
        assertThat(prompt).contains("Amount Demanded: $1,250.50", "Deadline: 2024-04-01");
        assertThat(prompt).doesNotContain("Sender Address", "Incident Date", "Additional Details");
        assertThat(prompt).contains("Requirements:");
    }

    @Test
    void unknownTypeFallsBackToTag() {
        String prompt = LetterPromptBuilder.userPrompt("custom_notice",
                IntakeData.minimal("Alice", "Bob", "Issue", "Outcome"));

        assertThat(prompt).startsWith("Draft a professional custom_notice letter");
    }
}
