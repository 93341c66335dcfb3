package com.ledgerpilot.budget.controller.dto;

import com.ledgerpilot.budget.model.TransactionFields;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record UpdateRequestDto(
        String budgetId,
        @NotBlank String transactionId,
        @NotNull TransactionFields fields,
        String description
) {
}
