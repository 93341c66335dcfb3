package com.ledgerpilot.budget.controller.dto;

public record CollectionRefreshResponseDto(String collection, String budgetId, int itemCount, String traceId) {
}
