package com.ledgerpilot.budget.controller.dto;

import com.ledgerpilot.budget.model.TransactionDetail;
import java.util.List;

public record SaveTransactionsResponseDto(
        List<String> transactionIds,
        List<String> duplicateImportIds,
        List<TransactionDetail> transactions,
        String traceId
) {
}
