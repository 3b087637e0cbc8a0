package com.letterdesk.reviewcore.domain.generation;

/**
 * Text produced by one provider. {@code jurisdiction} is only reported by providers that research.
 */
public record ProviderResponse(String content, boolean researchApplied, String jurisdiction) {
}
