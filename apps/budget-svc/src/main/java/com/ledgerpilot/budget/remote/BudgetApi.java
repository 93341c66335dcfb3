package com.ledgerpilot.budget.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledgerpilot.budget.model.Account;
import com.ledgerpilot.budget.model.BudgetSettings;
import com.ledgerpilot.budget.model.BudgetSummary;
import com.ledgerpilot.budget.model.Category;
import com.ledgerpilot.budget.model.CategoryEdit;
import com.ledgerpilot.budget.model.CategoryGroup;
import com.ledgerpilot.budget.model.NewAccount;
import com.ledgerpilot.budget.model.NewTransactions;
import com.ledgerpilot.budget.model.Payee;
import com.ledgerpilot.budget.model.PayeeEdit;
import com.ledgerpilot.budget.model.TransactionDetail;
import com.ledgerpilot.budget.model.TransactionFields;
import com.ledgerpilot.budget.model.TransactionPatch;
import com.ledgerpilot.budget.model.TransactionQuery;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * Typed endpoints of the remote budget API. Every response is wrapped in a {@code data} envelope.
 */
@Component
public class BudgetApi {

    private static final TypeReference<List<BudgetSummary>> BUDGETS = new TypeReference<>() {};
    private static final TypeReference<List<Account>> ACCOUNTS = new TypeReference<>() {};
    private static final TypeReference<List<Payee>> PAYEES = new TypeReference<>() {};
    private static final TypeReference<List<CategoryGroup>> CATEGORY_GROUPS = new TypeReference<>() {};
    private static final TypeReference<List<String>> STRINGS = new TypeReference<>() {};
    private static final TypeReference<List<TransactionDetail>> TRANSACTIONS = new TypeReference<>() {};

    private final BudgetApiClient client;
    private final ObjectMapper objectMapper;

    public BudgetApi(BudgetApiClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    public List<BudgetSummary> listBudgets() {
        JsonNode data = data(client.request(HttpMethod.GET, "/budgets?include_accounts=false"));
        return read(data.path("budgets"), BUDGETS);
    }

    public BudgetSettings getBudgetSettings(String budgetId) {
        JsonNode data = data(client.request(HttpMethod.GET, budgetPath(budgetId) + "/settings"));
        return read(data.path("settings"), BudgetSettings.class);
    }

    public DeltaPage<Account> getAccounts(String budgetId, OptionalLong sinceToken) {
        JsonNode data = data(client.request(HttpMethod.GET, collectionPath(budgetId, "accounts", sinceToken)));
        return new DeltaPage<>(read(data.path("accounts"), ACCOUNTS), syncToken(data));
    }

    public DeltaPage<Payee> getPayees(String budgetId, OptionalLong sinceToken) {
        JsonNode data = data(client.request(HttpMethod.GET, collectionPath(budgetId, "payees", sinceToken)));
        return new DeltaPage<>(read(data.path("payees"), PAYEES), syncToken(data));
    }

    public DeltaPage<CategoryGroup> getCategories(String budgetId, OptionalLong sinceToken) {
        JsonNode data = data(client.request(HttpMethod.GET, collectionPath(budgetId, "categories", sinceToken)));
        return new DeltaPage<>(read(data.path("category_groups"), CATEGORY_GROUPS), syncToken(data));
    }

    public TransactionDetail getTransaction(String budgetId, String transactionId) {
        JsonNode data = data(client.request(HttpMethod.GET, transactionPath(budgetId, transactionId)));
        return read(data.path("transaction"), TransactionDetail.class);
    }

    public Category updateCategory(String budgetId, String categoryId, CategoryEdit edit) {
        JsonNode data = data(client.request(HttpMethod.PATCH, budgetPath(budgetId) + "/categories/" + segment(categoryId),
                Map.of("category", edit)));
        return read(data.path("category"), Category.class);
    }

    public Payee updatePayee(String budgetId, String payeeId, PayeeEdit edit) {
        JsonNode data = data(client.request(HttpMethod.PATCH, budgetPath(budgetId) + "/payees/" + segment(payeeId),
                Map.of("payee", edit)));
        return read(data.path("payee"), Payee.class);
    }

    public Account createAccount(String budgetId, NewAccount account) {
        JsonNode data = data(client.request(HttpMethod.POST, budgetPath(budgetId) + "/accounts",
                Map.of("account", account)));
        return read(data.path("account"), Account.class);
    }

    /**
     * Lists transactions for the query's scope. Pending transactions are never included.
     */
    public List<TransactionDetail> getTransactions(String budgetId, TransactionQuery query) {
        JsonNode data = data(client.request(HttpMethod.GET, transactionsPath(budgetId, query)));
        return read(data.path("transactions"), TRANSACTIONS);
    }

    public TransactionDetail deleteTransaction(String budgetId, String transactionId) {
        JsonNode data = data(client.request(HttpMethod.DELETE, transactionPath(budgetId, transactionId)));
        return read(data.path("transaction"), TransactionDetail.class);
    }

    public TransactionDetail updateTransaction(String budgetId, String transactionId, TransactionFields fields) {
        JsonNode data = data(client.request(HttpMethod.PUT, transactionPath(budgetId, transactionId),
                Map.of("transaction", fields)));
        return read(data.path("transaction"), TransactionDetail.class);
    }

    public SaveTransactionsResult updateTransactions(String budgetId, List<TransactionPatch> patches) {
        JsonNode data = data(client.request(HttpMethod.PATCH, budgetPath(budgetId) + "/transactions",
                Map.of("transactions", patches)));
        return saveResult(data);
    }

    public SaveTransactionsResult createTransactions(String budgetId, NewTransactions transactions) {
        JsonNode data = data(client.request(HttpMethod.POST, budgetPath(budgetId) + "/transactions",
                transactions.toRequestBody()));
        return saveResult(data);
    }

    private SaveTransactionsResult saveResult(JsonNode data) {
        List<TransactionDetail> saved = data.has("transactions")
                ? read(data.path("transactions"), TRANSACTIONS)
                : data.has("transaction") ? List.of(read(data.path("transaction"), TransactionDetail.class)) : List.of();
        return new SaveTransactionsResult(
                data.has("transaction_ids") ? read(data.path("transaction_ids"), STRINGS) : List.of(),
                data.has("duplicate_import_ids") ? read(data.path("duplicate_import_ids"), STRINGS) : List.of(),
                saved,
                data.has("server_knowledge") ? data.path("server_knowledge").asLong() : null
        );
    }

    private static String budgetPath(String budgetId) {
        return "/budgets/" + segment(budgetId);
    }

    private static String transactionPath(String budgetId, String transactionId) {
        return budgetPath(budgetId) + "/transactions/" + segment(transactionId);
    }

    private static String transactionsPath(String budgetId, TransactionQuery query) {
        String path = budgetPath(budgetId);
        if (query.scope() != TransactionQuery.Scope.BUDGET) {
            path += "/" + query.scope().pathSegment() + "/" + segment(query.scopeId());
        }
        path += "/transactions";
        List<String> params = new ArrayList<>();
        if (query.sinceDate() != null) {
            params.add("since_date=" + query.sinceDate());
        }
        if (query.type() != null) {
            params.add("type=" + query.type().wireValue());
        }
        return params.isEmpty() ? path : path + "?" + String.join("&", params);
    }

    private static String collectionPath(String budgetId, String collection, OptionalLong sinceToken) {
        String path = budgetPath(budgetId) + "/" + collection;
        return sinceToken.isPresent() ? path + "?last_knowledge_of_server=" + sinceToken.getAsLong() : path;
    }

    private static String segment(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("path segment must be provided");
        }
        return UriUtils.encodePathSegment(value, StandardCharsets.UTF_8);
    }

    private static JsonNode data(JsonNode root) {
        JsonNode data = root == null ? null : root.get("data");
        if (data == null || !data.isObject()) {
            throw new RemoteApiException(502, "Remote API response is missing the data envelope", root == null ? null : root.toString());
        }
        return data;
    }

    private static long syncToken(JsonNode data) {
        JsonNode token = data.get("server_knowledge");
        if (token == null || !token.canConvertToLong()) {
            throw new RemoteApiException(502, "Remote API response is missing server_knowledge", data.toString());
        }
        return token.asLong();
    }

    private <T> T read(JsonNode node, TypeReference<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new RemoteApiException(502, "Remote API response is missing an expected collection", null);
        }
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException ex) {
            throw new RemoteApiException(502, "Unexpected remote payload: " + ex.getMessage(), node.toString(), ex);
        }
    }

    private <T> T read(JsonNode node, Class<T> type) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw new RemoteApiException(502, "Remote API response is missing " + type.getSimpleName(), null);
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            throw new RemoteApiException(502, "Unexpected remote payload: " + ex.getMessage(), node.toString(), ex);
        }
    }
}
