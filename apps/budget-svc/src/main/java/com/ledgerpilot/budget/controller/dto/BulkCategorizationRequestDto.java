package com.ledgerpilot.budget.controller.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record BulkCategorizationRequestDto(
        String budgetId,
        @NotEmpty List<String> transactionIds,
        String categoryId,
        String categoryName,
        String memo,
        String description
) {
}
