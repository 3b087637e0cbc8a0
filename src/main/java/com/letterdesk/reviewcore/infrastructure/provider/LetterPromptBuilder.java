package com.letterdesk.reviewcore.infrastructure.provider;

import com.letterdesk.reviewcore.domain.IntakeData;
import com.letterdesk.reviewcore.domain.LetterTypes;

import java.math.BigDecimal;
import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds the prompts for direct-completion drafting.
 */
public final class LetterPromptBuilder {

    public static final String SYSTEM_PROMPT = "You are a professional legal attorney drafting formal legal letters. "
            + "Always produce professional, legally sound content with proper formatting.";

    private static final List<String> REQUIREMENTS = List.of(
            "- Write a professional, legally sound letter (300-500 words)",
            "- Include proper date and formal letter format",
            "- Present facts clearly and objectively",
            "- State clear demands with specific deadlines (if applicable)",
            "- Maintain professional legal tone throughout",
            "- Include proper salutations and closing",
            "- Format as a complete letter with all standard elements",
            "- Avoid any legal advice beyond standard letter writing");

    public static final String IMPROVEMENT_SYSTEM_PROMPT = SYSTEM_PROMPT + "\n\n"
            + "You are now improving an existing letter. Address the specific improvement requests, "
            + "keep every key fact and demand, and keep the letter concise.";

    private static final List<String> IMPROVEMENT_REQUIREMENTS = List.of(
            "- Maintain professional legal tone",
            "- Preserve all key facts and demands",
            "- Improve clarity and persuasiveness",
            "- Ensure proper legal letter format",
            "- Keep the letter concise and focused",
            "- Strengthen the legal argument where possible");

    private LetterPromptBuilder() {
    }

    public static String userPrompt(String letterType, IntakeData intake) {
        String typeName = LetterTypes.displayName(letterType).orElse(letterType);
        List<String> lines = new ArrayList<>();
        lines.add("Draft a professional " + typeName + " letter with the following details:");
        lines.add("");
        lines.add("Sender Information:");
        add(lines, "Sender Name", intake.senderName());
        add(lines, "Sender Address", intake.senderAddress());
        add(lines, "Sender State", upper(intake.senderState()));
        add(lines, "Sender Email", intake.senderEmail());
        lines.add("");
        lines.add("Recipient Information:");
        add(lines, "Recipient Name", intake.recipientName());
        add(lines, "Recipient Address", intake.recipientAddress());
        add(lines, "Recipient State", upper(intake.recipientState()));
        add(lines, "Recipient Email", intake.recipientEmail());
        lines.add("");
        lines.add("Case Details:");
        add(lines, "Issue Description", intake.issueDescription());
        add(lines, "Desired Outcome", intake.desiredOutcome());
        add(lines, "Amount Demanded", money(intake.amountDemanded()));
        add(lines, "Deadline", intake.deadlineDate());
        add(lines, "Incident Date", intake.incidentDate());
        add(lines, "Additional Details", intake.additionalDetails());
        lines.add("");
        lines.add("Requirements:");
        lines.addAll(REQUIREMENTS);
        lines.add("");
        lines.add("Important: Only return the letter content itself, no explanations or commentary.");
        return String.join("\n", lines);
    }

    public static String improvementPrompt(String letterType, String originalContent, String notes) {
        List<String> lines = new ArrayList<>();
        lines.add("Improve the following legal letter while maintaining its core message and professionalism:");
        lines.add("");
        add(lines, "Letter Type", letterType == null ? null : LetterTypes.displayName(letterType).orElse(letterType));
        lines.add("Original Letter:");
        lines.add("-------------------");
        lines.add(originalContent);
        lines.add("-------------------");
        lines.add("");
        if (notes != null && !notes.isBlank()) {
            lines.add("Specific Improvements Requested:");
            lines.add(notes.trim());
            lines.add("");
        }
        lines.add("Requirements:");
        lines.addAll(IMPROVEMENT_REQUIREMENTS);
        lines.add("");
        lines.add("Important: Only return the improved letter content itself, no explanations or commentary.");
        return String.join("\n", lines);
    }

    private static void add(List<String> lines, String label, String value) {
        if (value != null && !value.isBlank()) {
            lines.add(label + ": " + value);
        }
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String money(BigDecimal amount) {
        return amount == null ? null : NumberFormat.getCurrencyInstance(Locale.US).format(amount);
    }
}
