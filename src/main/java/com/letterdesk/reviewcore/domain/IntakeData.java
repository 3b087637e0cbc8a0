package com.letterdesk.reviewcore.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Facts supplied by the letter owner. Only the parties, the issue and the desired outcome are
 * mandatory; everything else is optional context for the drafting providers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntakeData(
        @NotBlank(message = "Sender name is required")
        @Size(max = 200, message = "Sender name must be at most 200 characters")
        String senderName,

        @Size(max = 500, message = "Sender address must be at most 500 characters")
        String senderAddress,

        @Pattern(regexp = "^[A-Za-z]{2}$", message = "Sender state must be a two-letter code")
        String senderState,

        @Email(message = "Sender email must be a valid email address")
        String senderEmail,

        @NotBlank(message = "Recipient name is required")
        @Size(max = 200, message = "Recipient name must be at most 200 characters")
        String recipientName,

        @Size(max = 500, message = "Recipient address must be at most 500 characters")
        String recipientAddress,

        @Pattern(regexp = "^[A-Za-z]{2}$", message = "Recipient state must be a two-letter code")
        String recipientState,

        @Email(message = "Recipient email must be a valid email address")
        String recipientEmail,

        @NotBlank(message = "Issue description is required")
        @Size(max = 10000, message = "Issue description must be at most 10000 characters")
        String issueDescription,

        @NotBlank(message = "Desired outcome is required")
        @Size(max = 2000, message = "Desired outcome must be at most 2000 characters")
        String desiredOutcome,

        @DecimalMin(value = "0", message = "Amount demanded cannot be negative")
        BigDecimal amountDemanded,

        @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "Deadline date must be YYYY-MM-DD")
        String deadlineDate,

        @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "Incident date must be YYYY-MM-DD")
        String incidentDate,

        @Size(max = 10000, message = "Additional details must be at most 10000 characters")
        String additionalDetails) {

    public static IntakeData minimal(String senderName, String recipientName, String issueDescription, String desiredOutcome) {
        return new IntakeData(senderName, null, null, null, recipientName, null, null, null,
                issueDescription, desiredOutcome, null, null, null, null);
    }

    /** Jurisdiction the letter is written under: the sender's state, else the recipient's. */
    public String jurisdiction() {
        if (senderState != null && !senderState.isBlank()) {
            return senderState.toUpperCase();
        }
        return recipientState != null && !recipientState.isBlank() ? recipientState.toUpperCase() : null;
    }

    /** Flat view with absent fields omitted, in declaration order. */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "senderName", senderName);
        putIfPresent(map, "senderAddress", senderAddress);
        putIfPresent(map, "senderState", senderState);
        putIfPresent(map, "senderEmail", senderEmail);
        putIfPresent(map, "recipientName", recipientName);
        putIfPresent(map, "recipientAddress", recipientAddress);
        putIfPresent(map, "recipientState", recipientState);
        putIfPresent(map, "recipientEmail", recipientEmail);
        putIfPresent(map, "issueDescription", issueDescription);
        putIfPresent(map, "desiredOutcome", desiredOutcome);
        putIfPresent(map, "amountDemanded", amountDemanded);
        putIfPresent(map, "deadlineDate", deadlineDate);
        putIfPresent(map, "incidentDate", incidentDate);
        putIfPresent(map, "additionalDetails", additionalDetails);
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null && !(value instanceof String s && s.isBlank())) {
            map.put(key, value);
        }
    }
}
