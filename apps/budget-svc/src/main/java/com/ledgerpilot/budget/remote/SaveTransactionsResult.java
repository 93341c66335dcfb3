package com.ledgerpilot.budget.remote;

import com.ledgerpilot.budget.model.TransactionDetail;
import java.util.List;

/**
 * Outcome of a create or batch update: the ids the remote actually saved.
 */
public record SaveTransactionsResult(
        List<String> transactionIds,
        List<String> duplicateImportIds,
        List<TransactionDetail> transactions,
        Long syncToken
) {

    public SaveTransactionsResult {
        transactionIds = transactionIds == null ? List.of() : List.copyOf(transactionIds);
        duplicateImportIds = duplicateImportIds == null ? List.of() : List.copyOf(duplicateImportIds);
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
