package com.letterdesk.reviewcore.domain;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public final class LetterTypes {

    private static final Map<String, String> DISPLAY_NAMES = new LinkedHashMap<>();

    static {
        DISPLAY_NAMES.put("demand_letter", "Demand Letter");
        DISPLAY_NAMES.put("cease_desist", "Cease & Desist");
        DISPLAY_NAMES.put("contract_breach", "Contract Breach Notice");
        DISPLAY_NAMES.put("eviction_notice", "Eviction Notice");
        DISPLAY_NAMES.put("employment_dispute", "Employment Dispute Letter");
        DISPLAY_NAMES.put("consumer_complaint", "Consumer Complaint");
    }

    private LetterTypes() {
    }

    public static boolean isSupported(String letterType) {
        return letterType != null && DISPLAY_NAMES.containsKey(letterType);
    }

    public static Optional<String> displayName(String letterType) {
        return Optional.ofNullable(DISPLAY_NAMES.get(letterType));
    }

    public static Map<String, String> all() {
        return Map.copyOf(DISPLAY_NAMES);
    }
}
