package com.ledgerpilot.budget.staging;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.budget.BudgetMetadata;
import com.ledgerpilot.budget.cache.SettingsCacheStore;
import com.ledgerpilot.budget.error.ValidationException;
import com.ledgerpilot.budget.model.CurrencyFormat;
import com.ledgerpilot.budget.model.Milliunits;
import com.ledgerpilot.budget.model.SubTransactionEdit;
import com.ledgerpilot.budget.model.TransactionDetail;
import com.ledgerpilot.budget.model.TransactionFields;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.resolve.EntityResolver;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds staged changes from caller input: resolves names, snapshots the current transaction and
 * validates the proposal before anything reaches {@link StagingStore}.
 */
@Service
public class StagingService {

    private static final Logger log = LoggerFactory.getLogger(StagingService.class);

    private final BudgetContext budgetContext;
    private final BudgetApi budgetApi;
    private final EntityResolver entityResolver;
    private final SettingsCacheStore settingsCacheStore;
    private final StagingStore stagingStore;

    public StagingService(
            BudgetContext budgetContext,
            BudgetApi budgetApi,
            EntityResolver entityResolver,
            SettingsCacheStore settingsCacheStore,
            StagingStore stagingStore
    ) {
        this.budgetContext = budgetContext;
        this.budgetApi = budgetApi;
        this.entityResolver = entityResolver;
        this.settingsCacheStore = settingsCacheStore;
        this.stagingStore = stagingStore;
    }

    public StagingReceipt stageCategorization(
            String budgetId,
            String transactionId,
            CategoryReference category,
            String memo,
            String description
    ) {
        String targetBudget = budgetContext.resolveBudgetId(budgetId);
        String categoryId = resolveCategory(targetBudget, category);
        TransactionDetail transaction = budgetApi.getTransaction(targetBudget, transactionId);

        StagedChange change = stageCategorizationOf(targetBudget, transaction, categoryId, memo,
                description != null ? description : "Categorize transaction to category " + categoryId);

        String summary = "Staged: %s (%s) - Category: %s -> %s".formatted(
                payeeLabel(targetBudget, transaction),
                Milliunits.format(transaction.amount(), currencyFormat(targetBudget)),
                entityResolver.categoryName(targetBudget, transaction.categoryId()),
                entityResolver.categoryName(targetBudget, categoryId));
        return new StagingReceipt(change, summary);
    }

    public StagingReceipt stageSplit(String budgetId, String transactionId, List<SplitPart> parts, String description) {
        if (parts == null || parts.size() < 2) {
            throw new ValidationException("A split needs at least two subtransactions");
        }
        String targetBudget = budgetContext.resolveBudgetId(budgetId);
        TransactionDetail transaction = budgetApi.getTransaction(targetBudget, transactionId);

        List<SubTransactionEdit> resolved = parts.stream()
                .map(part -> new SubTransactionEdit(part.amount(), part.payeeId(), part.payeeName(),
                        part.category() == null ? null : resolveCategory(targetBudget, part.category()), part.memo()))
                .toList();

        long total = resolved.stream().mapToLong(SubTransactionEdit::amount).sum();
        if (total != transaction.amount()) {
            throw splitMismatch(transaction.amount(), total, currencyFormat(targetBudget));
        }

        TransactionFields original = new TransactionFields(transaction.categoryId(), null, null, null, null, null, null,
                transaction.subtransactions().stream().map(SubTransactionEdit::from).toList());
        StagedChange change = stagingStore.stageChange(
                ChangeType.SPLIT,
                targetBudget,
                transactionId,
                description != null ? description : "Split transaction into " + resolved.size() + " parts",
                original,
                TransactionFields.split(resolved));

        CurrencyFormat format = currencyFormat(targetBudget);
        StringBuilder summary = new StringBuilder("Staged split: %s (%s) -> %d parts".formatted(
                payeeLabel(targetBudget, transaction), Milliunits.format(transaction.amount(), format), resolved.size()));
        for (SubTransactionEdit part : resolved) {
            summary.append("\n  - ")
                    .append(Milliunits.format(part.amount(), format))
                    .append(" -> ")
                    .append(entityResolver.categoryName(targetBudget, part.categoryId()));
        }
        return new StagingReceipt(change, summary.toString());
    }

    /**
     * Stages an arbitrary field update; the original values of the touched fields are kept for review.
     */
    public StagingReceipt stageUpdate(String budgetId, String transactionId, TransactionFields fields, String description) {
        if (fields == null || fields.isEmpty()) {
            throw new ValidationException("At least one field to update must be provided");
        }
        String targetBudget = budgetContext.resolveBudgetId(budgetId);
        TransactionDetail transaction = budgetApi.getTransaction(targetBudget, transactionId);
        StagedChange change = stagingStore.stageChange(
                ChangeType.UPDATE,
                targetBudget,
                transactionId,
                description != null ? description : "Update transaction " + transactionId,
                fields.snapshotOf(transaction),
                fields);
        String summary = "Staged update: %s (%s)".formatted(
                payeeLabel(targetBudget, transaction),
                Milliunits.format(transaction.amount(), currencyFormat(targetBudget)));
        return new StagingReceipt(change, summary);
    }

    /**
     * Stages the same categorization for every transaction. A transaction that cannot be read is
     * reported in the result and does not stop the others.
     */
    public BulkStagingResult bulkCategorize(
            String budgetId,
            List<String> transactionIds,
            CategoryReference category,
            String memo,
            String description
    ) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new ValidationException("transactionIds must not be empty");
        }
        String targetBudget = budgetContext.resolveBudgetId(budgetId);
        String categoryId = resolveCategory(targetBudget, category);

        List<StagedChange> staged = new ArrayList<>();
        List<BulkStagingResult.Failure> failures = new ArrayList<>();
        for (String transactionId : transactionIds) {
            try {
                TransactionDetail transaction = budgetApi.getTransaction(targetBudget, transactionId);
                staged.add(stageCategorizationOf(targetBudget, transaction, categoryId, memo,
                        description != null ? description : "Bulk categorize to " + categoryId));
            } catch (RuntimeException ex) {
                log.warn("Could not stage categorization for transaction {}: {}", transactionId, ex.getMessage());
                failures.add(new BulkStagingResult.Failure(transactionId, ex.getMessage()));
            }
        }
        return new BulkStagingResult(categoryId, entityResolver.categoryName(targetBudget, categoryId), staged, failures);
    }

    private StagedChange stageCategorizationOf(
            String budgetId,
            TransactionDetail transaction,
            String categoryId,
            String memo,
            String description
    ) {
        return stagingStore.stageChange(
                ChangeType.CATEGORIZATION,
                budgetId,
                transaction.id(),
                description,
                TransactionFields.categorization(transaction.categoryId(), transaction.memo()),
                TransactionFields.categorization(categoryId, memo));
    }

    private String resolveCategory(String budgetId, CategoryReference category) {
        if (category == null) {
            throw new ValidationException("Either categoryId or categoryName must be provided");
        }
        if (category instanceof CategoryReference.ById byId) {
            return byId.categoryId();
        }
        return entityResolver.requireCategoryId(budgetId, ((CategoryReference.ByName) category).categoryName());
    }

    private String payeeLabel(String budgetId, TransactionDetail transaction) {
        if (transaction.payeeName() != null) {
            return transaction.payeeName();
        }
        return entityResolver.payeeName(budgetId, transaction.payeeId());
    }

    private CurrencyFormat currencyFormat(String budgetId) {
        try {
            return settingsCacheStore.getCurrencyFormat(budgetId)
                    .orElseGet(() -> metadataCurrencyFormat(budgetId));
        } catch (RuntimeException ex) {
            log.debug("Settings unavailable for budget {}, using budget metadata: {}", budgetId, ex.getMessage());
            return metadataCurrencyFormat(budgetId);
        }
    }

    private CurrencyFormat metadataCurrencyFormat(String budgetId) {
        return budgetContext.getBudgetMetadata(budgetId).map(BudgetMetadata::currencyFormat).orElse(null);
    }

    static ValidationException splitMismatch(long expected, long actual, CurrencyFormat format) {
        long difference = actual - expected;
        String direction = (difference > 0 ? "over by " : "under by ") + Milliunits.format(Math.abs(difference), format);
        String message = String.join("\n",
                "Split transaction validation failed:",
                "- Expected subtransactions to sum to: %s (%d milliunits)".formatted(Milliunits.format(expected, format), expected),
                "- Actual subtransactions sum to: %s (%d milliunits)".formatted(Milliunits.format(actual, format), actual),
                "- Difference: " + direction,
                "Adjust subtransaction amounts so they sum exactly to %s.".formatted(Milliunits.format(expected, format)));
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expectedMilliunits", expected);
        details.put("actualMilliunits", actual);
        details.put("differenceMilliunits", difference);
        return new ValidationException(message, details);
    }
}
