package com.ledgerpilot.budget.model;

import java.util.List;
import java.util.Map;

/**
 * Body of a create request: exactly one transaction or a non-empty batch. The variant decides the
 * wire shape ({@code transaction} vs {@code transactions}).
 */
public sealed interface NewTransactions permits NewTransactions.Single, NewTransactions.Batch {

    /** Wire body for the create endpoint. */
    Object toRequestBody();

    int size();

    /**
     * Builds the variant from a request carrying one or the other field.
     *
     * @throws IllegalArgumentException when both or neither are present
     */
    static NewTransactions of(NewTransaction single, List<NewTransaction> batch) {
        boolean hasBatch = batch != null && !batch.isEmpty();
        if (single != null && hasBatch) {
            throw new IllegalArgumentException("Provide either transaction or transactions, not both");
        }
        if (single != null) {
            return new Single(single);
        }
        if (hasBatch) {
            return new Batch(batch);
        }
        throw new IllegalArgumentException("Either transaction or transactions must be provided");
    }

    record Single(NewTransaction transaction) implements NewTransactions {
        public Single {
            if (transaction == null) {
                throw new IllegalArgumentException("transaction must be provided");
            }
        }

        @Override
        public Object toRequestBody() {
            return Map.of("transaction", transaction);
        }

        @Override
        public int size() {
            return 1;
        }
    }

    record Batch(List<NewTransaction> transactions) implements NewTransactions {
        public Batch {
            if (transactions == null || transactions.isEmpty()) {
                throw new IllegalArgumentException("transactions must not be empty");
            }
            transactions = List.copyOf(transactions);
        }

        @Override
        public Object toRequestBody() {
            return Map.of("transactions", transactions);
        }

        @Override
        public int size() {
            return transactions.size();
        }
    }
}
