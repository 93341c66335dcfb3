package com.ledgerpilot.budget.staging;

import com.ledgerpilot.budget.model.TransactionFields;
import com.ledgerpilot.budget.model.TransactionPatch;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.SaveTransactionsResult;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Holds proposed transaction edits until they are applied or discarded.
 *
 * <p>Applying groups the selected changes by budget and sends one batch update per budget. A change
 * leaves the store only when the remote reports its transaction as updated; anything else keeps it
 * staged and reports it as failed. A failing batch never affects the outcome of another budget's
 * batch. A change being sent by one apply is skipped by any other apply until that one finishes.
 *
 * <p>The store does no semantic validation of the proposed fields.
 */
@Component
public class StagingStore {

    private static final Logger log = LoggerFactory.getLogger(StagingStore.class);

    static final String EMPTY_RESPONSE_ERROR = "Update response did not contain any transaction ids";
    static final String NOT_UPDATED_ERROR = "Transaction was not updated by the remote API";

    private final BudgetApi budgetApi;
    private final Clock clock;
    private final Map<String, StagedChange> stagedChanges = new LinkedHashMap<>();
    // ids currently being sent by an apply
    private final Set<String> applying = new HashSet<>();
    private String sessionId = newSessionId();

    @Autowired
    public StagingStore(BudgetApi budgetApi) {
        this(budgetApi, Clock.systemUTC());
    }

    StagingStore(BudgetApi budgetApi, Clock clock) {
        this.budgetApi = budgetApi;
        this.clock = clock;
    }

    public synchronized StagedChange stageChange(
            ChangeType type,
            String budgetId,
            String transactionId,
            String description,
            TransactionFields originalTransaction,
            TransactionFields proposedChanges
    ) {
        Objects.requireNonNull(type, "type");
        requireText(budgetId, "budgetId");
        requireText(transactionId, "transactionId");
        Objects.requireNonNull(proposedChanges, "proposedChanges");
        StagedChange change = new StagedChange(
                UUID.randomUUID().toString(),
                type,
                budgetId,
                transactionId,
                description,
                clock.instant(),
                originalTransaction,
                proposedChanges
        );
        stagedChanges.put(change.id(), change);
        log.debug("Staged {} change {} for transaction {} in budget {}", type, change.id(), transactionId, budgetId);
        return change;
    }

    public synchronized List<StagedChange> getStagedChanges() {
        return List.copyOf(stagedChanges.values());
    }

    public synchronized Optional<StagedChange> getStagedChange(String changeId) {
        return Optional.ofNullable(stagedChanges.get(changeId));
    }

    public synchronized List<StagedChange> getStagedChangesForTransaction(String budgetId, String transactionId) {
        return stagedChanges.values().stream()
                .filter(change -> change.budgetId().equals(budgetId) && change.transactionId().equals(transactionId))
                .toList();
    }

    public synchronized boolean clearStagedChange(String changeId) {
        return stagedChanges.remove(changeId) != null;
    }

    /**
     * Clears the given changes, or every staged change when {@code changeIds} is null or empty.
     */
    public synchronized int clearStagedChanges(Collection<String> changeIds) {
        if (changeIds == null || changeIds.isEmpty()) {
            return clearStagedChanges();
        }
        int cleared = 0;
        for (String changeId : changeIds) {
            if (stagedChanges.remove(changeId) != null) {
                cleared++;
            }
        }
        return cleared;
    }

    public synchronized int clearStagedChanges() {
        int cleared = stagedChanges.size();
        stagedChanges.clear();
        return cleared;
    }

    public synchronized StagingStats getStats() {
        return new StagingStats(sessionId, stagedChanges.size());
    }

    public synchronized String getSessionId() {
        return sessionId;
    }

    public synchronized void reset() {
        stagedChanges.clear();
        applying.clear();
        sessionId = newSessionId();
    }

    /**
     * Applies the given changes, or every staged change when {@code changeIds} is null or empty. Ids
     * that are not staged, or that another apply is already sending, are ignored. Never throws for a
     * failed change; see {@link ApplyResult}.
     */
    public ApplyResult applyChanges(Collection<String> changeIds) {
        List<StagedChange> claimed = claim(changeIds);
        Map<String, List<StagedChange>> partitions = claimed.stream()
                .collect(Collectors.groupingBy(StagedChange::budgetId, LinkedHashMap::new, Collectors.toList()));
        if (partitions.isEmpty()) {
            return ApplyResult.of(0, List.of());
        }

        List<ChangeOutcome> outcomes = new ArrayList<>();
        try {
            partitions.forEach((budgetId, changes) -> outcomes.addAll(applyBatch(budgetId, changes)));
        } finally {
            release(claimed);
        }
        ApplyResult result = ApplyResult.of(partitions.size(), outcomes);
        log.info("Applied staged changes: {} succeeded, {} failed across {} batch(es)",
                result.appliedCount(), result.failedCount(), result.batchCount());
        return result;
    }

    public ApplyResult applyChanges() {
        return applyChanges(null);
    }

    private synchronized List<StagedChange> claim(Collection<String> changeIds) {
        Set<String> wanted = changeIds == null || changeIds.isEmpty() ? null : new HashSet<>(changeIds);
        List<StagedChange> claimed = stagedChanges.values().stream()
                .filter(change -> wanted == null || wanted.contains(change.id()))
                .filter(change -> !applying.contains(change.id()))
                .toList();
        claimed.forEach(change -> applying.add(change.id()));
        return claimed;
    }

    private synchronized void release(List<StagedChange> claimed) {
        claimed.forEach(change -> applying.remove(change.id()));
    }

    private List<ChangeOutcome> applyBatch(String budgetId, List<StagedChange> changes) {
        List<TransactionPatch> patches = changes.stream()
                .map(change -> new TransactionPatch(change.transactionId(), change.proposedChanges()))
                .toList();
        SaveTransactionsResult response;
        try {
            response = budgetApi.updateTransactions(budgetId, patches);
        } catch (RuntimeException ex) {
            log.warn("Batch update of {} change(s) for budget {} failed: {}", changes.size(), budgetId, ex.getMessage());
            return changes.stream().map(change -> ChangeOutcome.failed(change, describe(ex))).toList();
        }

        if (!response.duplicateImportIds().isEmpty()) {
            log.warn("Batch update for budget {} reported duplicate import ids {}", budgetId, response.duplicateImportIds());
        }
        if (response.transactionIds().isEmpty()) {
            log.warn("Batch update for budget {} returned no transaction ids; keeping {} change(s) staged",
                    budgetId, changes.size());
            return changes.stream().map(change -> ChangeOutcome.failed(change, EMPTY_RESPONSE_ERROR)).toList();
        }

        Set<String> updated = Set.copyOf(response.transactionIds());
        List<ChangeOutcome> outcomes = new ArrayList<>(changes.size());
        for (StagedChange change : changes) {
            if (updated.contains(change.transactionId())) {
                removeApplied(change.id());
                outcomes.add(ChangeOutcome.applied(change));
            } else {
                outcomes.add(ChangeOutcome.failed(change, NOT_UPDATED_ERROR));
            }
        }
        return outcomes;
    }

    private synchronized void removeApplied(String changeId) {
        stagedChanges.remove(changeId);
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must be provided");
        }
    }

    private static String newSessionId() {
        return UUID.randomUUID().toString();
    }
}
