package com.letterdesk.reviewcore.domain;

public record RefundResult(boolean success, Integer remaining, String error) {

    public static RefundResult refunded(Integer remaining) {
        return new RefundResult(true, remaining, null);
    }

    public static RefundResult failed(String error) {
        return new RefundResult(false, null, error);
    }
}
