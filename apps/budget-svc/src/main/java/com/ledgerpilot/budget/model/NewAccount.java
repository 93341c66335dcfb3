package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Set;

/**
 * Account to open. {@code balance} is the starting balance in milliunits.
 */
public record NewAccount(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("balance") long balance
) {

    public static final Set<String> ACCOUNT_TYPES = Set.of(
            "checking", "savings", "cash", "creditCard", "lineOfCredit", "otherAsset", "otherLiability",
            "mortgage", "autoLoan", "studentLoan", "personalLoan", "medicalDebt", "otherDebt");

    public NewAccount {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("account name must be provided");
        }
        if (type == null || !ACCOUNT_TYPES.contains(type)) {
            throw new IllegalArgumentException("Unsupported account type '" + type + "'; expected one of "
                    + ACCOUNT_TYPES.stream().sorted().toList());
        }
    }
}
