package com.ledgerpilot.budget.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record CategorizationRequestDto(
        String budgetId,
        @NotBlank String transactionId,
        String categoryId,
        String categoryName,
        String memo,
        String description
) {
}
