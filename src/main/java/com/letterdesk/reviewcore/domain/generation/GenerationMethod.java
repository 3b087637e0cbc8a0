package com.letterdesk.reviewcore.domain.generation;

public enum GenerationMethod {
    PRIMARY("primary"),
    FALLBACK("fallback");

    private final String label;

    GenerationMethod(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
