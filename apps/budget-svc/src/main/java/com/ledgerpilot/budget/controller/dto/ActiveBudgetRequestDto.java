package com.ledgerpilot.budget.controller.dto;

import jakarta.validation.constraints.NotBlank;

public record ActiveBudgetRequestDto(@NotBlank String budgetId) {
}
