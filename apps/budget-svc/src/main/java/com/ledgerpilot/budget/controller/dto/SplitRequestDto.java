package com.ledgerpilot.budget.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Amounts are milliunits and must add up to the transaction amount.
 */
public record SplitRequestDto(
        String budgetId,
        @NotBlank String transactionId,
        @NotNull @Size(min = 2) List<@Valid PartDto> subtransactions,
        String description
) {

    public record PartDto(
            @NotNull Long amount,
            String payeeId,
            String payeeName,
            String categoryId,
            String categoryName,
            String memo
    ) {
    }
}
