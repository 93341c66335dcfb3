package com.ledgerpilot.budget.model;

import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Which transactions to list: the whole budget or one account, category, payee or month, optionally
 * narrowed to those on or after {@code sinceDate} and to uncategorized or unapproved ones.
 */
public record TransactionQuery(Scope scope, String scopeId, LocalDate sinceDate, Type type) {

    private static final Pattern MONTH = Pattern.compile("\\d{4}-\\d{2}-\\d{2}|current");

    public enum Scope {
        BUDGET(null),
        ACCOUNT("accounts"),
        CATEGORY("categories"),
        PAYEE("payees"),
        MONTH("months");

        private final String pathSegment;

        Scope(String pathSegment) {
            this.pathSegment = pathSegment;
        }

        public String pathSegment() {
            return pathSegment;
        }
    }

    public enum Type {
        UNCATEGORIZED,
        UNAPPROVED;

        public String wireValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Type parse(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            for (Type candidate : values()) {
                if (candidate.wireValue().equalsIgnoreCase(value.trim())) {
                    return candidate;
                }
            }
            throw new IllegalArgumentException("Unknown transaction type '" + value + "'; expected uncategorized or unapproved");
        }
    }

    public TransactionQuery {
        if (scope == null) {
            throw new IllegalArgumentException("scope must be provided");
        }
        if (scope == Scope.BUDGET && scopeId != null) {
            throw new IllegalArgumentException("A budget-wide query takes no scope id");
        }
        if (scope != Scope.BUDGET && (scopeId == null || scopeId.isBlank())) {
            throw new IllegalArgumentException(scope.name().toLowerCase(Locale.ROOT) + " id must be provided");
        }
        if (scope == Scope.MONTH && !MONTH.matcher(scopeId).matches()) {
            throw new IllegalArgumentException("month must be YYYY-MM-DD or 'current'");
        }
    }

    /**
     * Builds a query from optional filters, of which at most one of account, category, payee and
     * month may be set.
     */
    public static TransactionQuery of(
            String accountId, String categoryId, String payeeId, String month, LocalDate sinceDate, Type type) {
        Scope scope = Scope.BUDGET;
        String scopeId = null;
        int scoped = 0;
        if (hasText(accountId)) {
            scope = Scope.ACCOUNT;
            scopeId = accountId;
            scoped++;
        }
        if (hasText(categoryId)) {
            scope = Scope.CATEGORY;
            scopeId = categoryId;
            scoped++;
        }
        if (hasText(payeeId)) {
            scope = Scope.PAYEE;
            scopeId = payeeId;
            scoped++;
        }
        if (hasText(month)) {
            scope = Scope.MONTH;
            scopeId = month;
            scoped++;
        }
        if (scoped > 1) {
            throw new IllegalArgumentException("Filter by at most one of accountId, categoryId, payeeId and month");
        }
        return new TransactionQuery(scope, scopeId, sinceDate, type);
    }

    public static TransactionQuery allTransactions() {
        return new TransactionQuery(Scope.BUDGET, null, null, null);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
