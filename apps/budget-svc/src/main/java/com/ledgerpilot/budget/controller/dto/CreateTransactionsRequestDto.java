package com.ledgerpilot.budget.controller.dto;

import com.ledgerpilot.budget.model.NewTransaction;
import com.ledgerpilot.budget.model.NewTransactions;
import java.util.List;

public record CreateTransactionsRequestDto(NewTransaction transaction, List<NewTransaction> transactions) {

    public NewTransactions toNewTransactions() {
        return NewTransactions.of(transaction, transactions);
    }
}
