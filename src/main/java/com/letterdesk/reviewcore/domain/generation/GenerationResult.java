package com.letterdesk.reviewcore.domain.generation;

public record GenerationResult(String content, GenerationMethod methodUsed, boolean researchApplied, String jurisdiction) {

    public static GenerationResult of(ProviderResponse response, GenerationMethod method) {
        return new GenerationResult(response.content(), method, response.researchApplied(), response.jurisdiction());
    }
}
