package com.letterdesk.reviewcore.infrastructure.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body returned by the research workflow. Older workflow versions put the text in {@code content}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrimaryWebhookResponse(
        Boolean success,
        String letter,
        String content,
        String error,
        Boolean researchApplied,
        String jurisdiction) {

    String text() {
        return letter != null && !letter.isBlank() ? letter : content;
    }
}
