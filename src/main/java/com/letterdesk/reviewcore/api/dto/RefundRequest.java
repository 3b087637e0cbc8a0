package com.letterdesk.reviewcore.api.dto;

public record RefundRequest(Integer amount) {

    public int amountOrDefault() {
        return amount == null ? 1 : amount;
    }
}
