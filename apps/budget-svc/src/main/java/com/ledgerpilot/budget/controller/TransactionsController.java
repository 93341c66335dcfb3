package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.controller.dto.CreateTransactionsRequestDto;
import com.ledgerpilot.budget.controller.dto.SaveTransactionsResponseDto;
import com.ledgerpilot.budget.model.NewTransactions;
import com.ledgerpilot.budget.model.TransactionDetail;
import com.ledgerpilot.budget.model.TransactionFields;
import com.ledgerpilot.budget.model.TransactionQuery;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.SaveTransactionsResult;
import com.ledgerpilot.budget.security.RequestContextHolder;
import java.time.LocalDate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Direct, unstaged transaction access. Writes are refused in read-only mode.
 */
@RestController
@RequestMapping("/budgets/{budgetId}/transactions")
public class TransactionsController {

    private static final Logger log = LoggerFactory.getLogger(TransactionsController.class);

    private final BudgetApi budgetApi;
    private final ReadOnlyGuard readOnlyGuard;

    public TransactionsController(BudgetApi budgetApi, ReadOnlyGuard readOnlyGuard) {
        this.budgetApi = budgetApi;
        this.readOnlyGuard = readOnlyGuard;
    }

    /**
     * Lists transactions, optionally narrowed to one account, category, payee or month
     * ({@code YYYY-MM-DD} or {@code current}), to those dated on or after {@code sinceDate}, and to
     * {@code uncategorized} or {@code unapproved} ones.
     */
    @GetMapping
    public ResponseEntity<List<TransactionDetail>> listTransactions(
            @PathVariable("budgetId") String budgetId,
            @RequestParam(value = "accountId", required = false) String accountId,
            @RequestParam(value = "categoryId", required = false) String categoryId,
            @RequestParam(value = "payeeId", required = false) String payeeId,
            @RequestParam(value = "month", required = false) String month,
            @RequestParam(value = "sinceDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate sinceDate,
            @RequestParam(value = "type", required = false) String type
    ) {
        TransactionQuery query = TransactionQuery.of(
                accountId, categoryId, payeeId, month, sinceDate, TransactionQuery.Type.parse(type));
        return ResponseEntity.ok(budgetApi.getTransactions(budgetId, query));
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<TransactionDetail> getTransaction(
            @PathVariable("budgetId") String budgetId,
            @PathVariable("transactionId") String transactionId
    ) {
        return ResponseEntity.ok(budgetApi.getTransaction(budgetId, transactionId));
    }

    @PutMapping("/{transactionId}")
    public ResponseEntity<TransactionDetail> updateTransaction(
            @PathVariable("budgetId") String budgetId,
            @PathVariable("transactionId") String transactionId,
            @RequestBody TransactionFields fields
    ) {
        readOnlyGuard.requireWritable("updateTransaction");
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field to update must be provided");
        }
        TransactionDetail updated = budgetApi.updateTransaction(budgetId, transactionId, fields);
        log.info("Updated transaction {} in budget {}", transactionId, budgetId);
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{transactionId}")
    public ResponseEntity<TransactionDetail> deleteTransaction(
            @PathVariable("budgetId") String budgetId,
            @PathVariable("transactionId") String transactionId
    ) {
        readOnlyGuard.requireWritable("deleteTransaction");
        TransactionDetail deleted = budgetApi.deleteTransaction(budgetId, transactionId);
        log.info("Deleted transaction {} in budget {}", transactionId, budgetId);
        return ResponseEntity.ok(deleted);
    }

    @PostMapping
    public ResponseEntity<SaveTransactionsResponseDto> createTransactions(
            @PathVariable("budgetId") String budgetId,
            @RequestBody CreateTransactionsRequestDto request
    ) {
        readOnlyGuard.requireWritable("createTransactions");
        NewTransactions transactions = request.toNewTransactions();
        SaveTransactionsResult result = budgetApi.createTransactions(budgetId, transactions);
        if (!result.duplicateImportIds().isEmpty()) {
            log.warn("Create in budget {} skipped duplicate import ids {}", budgetId, result.duplicateImportIds());
        }
        log.info("Created {} of {} transaction(s) in budget {}", result.transactionIds().size(), transactions.size(), budgetId);
        String traceId = RequestContextHolder.traceId().orElse(null);
        return ResponseEntity.status(HttpStatus.CREATED).body(new SaveTransactionsResponseDto(
                result.transactionIds(),
                result.duplicateImportIds(),
                result.transactions(),
                traceId));
    }
}
