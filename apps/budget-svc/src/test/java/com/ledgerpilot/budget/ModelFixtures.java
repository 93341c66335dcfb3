package com.ledgerpilot.budget;

import com.ledgerpilot.budget.model.Account;
import com.ledgerpilot.budget.model.BudgetSummary;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.CategoryGroup;
import com.ledgerpilot.budget.model.CurrencyFormat;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.model.TransactionDetail;
import java.util.List;

public final class ModelFixtures {

    public static final CurrencyFormat USD = new CurrencyFormat("USD", "$123.45", 2, ".", true, ",", "$", true);

    private ModelFixtures() {
    }

    public static Payee payee(String id, String name) {
        return new Payee(id, name, null, false);
    }

    public static Payee deletedPayee(String id) {
        return new Payee(id, "deleted", null, true);
    }

    public static Account account(String id, String name, long balance) {
        return new Account(id, name, "checking", true, false, null, balance, balance, 0L, null, false);
    }

    public static Category category(String id, String groupId, String name) {
        return new Category(id, groupId, null, name, false, null, 0L, 0L, 0L, false);
    }

    public static Category deletedCategory(String id, String groupId) {
        return new Category(id, groupId, null, "deleted", false, null, 0L, 0L, 0L, true);
    }

    public static CategoryGroup group(String id, String name, Category... categories) {
        return new CategoryGroup(id, name, false, false, List.of(categories));
    }

    public static CategoryGroup deletedGroup(String id) {
        return new CategoryGroup(id, "deleted", false, true, List.of());
    }

    public static BudgetSummary budget(String id, String name) {
        return new BudgetSummary(id, name, "2024-06-01T00:00:00Z", "2024-01-01", "2024-12-01", null, USD);
    }

    public static TransactionDetail transaction(String id, long amount, String categoryId, String memo) {
        return new TransactionDetail(id, "2024-06-01", amount, memo, "cleared", true, null, null,
                "acc-1", "Checking", "payee-1", "Grocer", categoryId, null, null, false, List.of());
    }
}
