package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.controller.dto.ApplyRequestDto;
import com.ledgerpilot.budget.controller.dto.BulkCategorizationRequestDto;
import com.ledgerpilot.budget.controller.dto.CategorizationRequestDto;
import com.ledgerpilot.budget.controller.dto.ClearStagedChangesResponseDto;
import com.ledgerpilot.budget.controller.dto.SplitRequestDto;
import com.ledgerpilot.budget.controller.dto.StagedChangesResponseDto;
import com.ledgerpilot.budget.controller.dto.UpdateRequestDto;
import com.ledgerpilot.budget.staging.ApplyResult;
import com.ledgerpilot.budget.staging.BulkStagingResult;
import com.ledgerpilot.budget.staging.CategoryReference;
import com.ledgerpilot.budget.staging.SplitPart;
import com.ledgerpilot.budget.staging.StagedChange;
import com.ledgerpilot.budget.staging.StagingReceipt;
import com.ledgerpilot.budget.staging.StagingService;
import com.ledgerpilot.budget.staging.StagingStore;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/staged-changes")
public class StagingController {

    private final StagingService stagingService;
    private final StagingStore stagingStore;
    private final ReadOnlyGuard readOnlyGuard;

    public StagingController(StagingService stagingService, StagingStore stagingStore, ReadOnlyGuard readOnlyGuard) {
        this.stagingService = stagingService;
        this.stagingStore = stagingStore;
        this.readOnlyGuard = readOnlyGuard;
    }

    @PostMapping("/categorizations")
    public ResponseEntity<StagingReceipt> stageCategorization(@RequestBody @Valid CategorizationRequestDto request) {
        StagingReceipt receipt = stagingService.stageCategorization(
                request.budgetId(),
                request.transactionId(),
                CategoryReference.of(request.categoryId(), request.categoryName()),
                request.memo(),
                request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/splits")
    public ResponseEntity<StagingReceipt> stageSplit(@RequestBody @Valid SplitRequestDto request) {
        List<SplitPart> parts = request.subtransactions().stream()
                .map(part -> new SplitPart(
                        part.amount(),
                        part.payeeId(),
                        part.payeeName(),
                        CategoryReference.ofOptional(part.categoryId(), part.categoryName()),
                        part.memo()))
                .toList();
        StagingReceipt receipt = stagingService.stageSplit(request.budgetId(), request.transactionId(), parts, request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/updates")
    public ResponseEntity<StagingReceipt> stageUpdate(@RequestBody @Valid UpdateRequestDto request) {
        StagingReceipt receipt = stagingService.stageUpdate(
                request.budgetId(), request.transactionId(), request.fields(), request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/bulk-categorizations")
    public ResponseEntity<BulkStagingResult> bulkCategorize(@RequestBody @Valid BulkCategorizationRequestDto request) {
        BulkStagingResult result = stagingService.bulkCategorize(
                request.budgetId(),
                request.transactionIds(),
                CategoryReference.of(request.categoryId(), request.categoryName()),
                request.memo(),
                request.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public ResponseEntity<StagedChangesResponseDto> review(
            @RequestParam(value = "transactionId", required = false) String transactionId
    ) {
        List<StagedChange> changes = stagingStore.getStagedChanges();
        if (transactionId != null && !transactionId.isBlank()) {
            changes = changes.stream().filter(change -> change.transactionId().equals(transactionId)).toList();
        }
        return ResponseEntity.ok(new StagedChangesResponseDto(stagingStore.getSessionId(), changes.size(), changes));
    }

    @PostMapping("/apply")
    public ResponseEntity<ApplyResult> apply(@RequestBody(required = false) ApplyRequestDto request) {
        readOnlyGuard.requireWritable("applyChanges");
        List<String> changeIds = request == null ? null : request.changeIds();
        return ResponseEntity.ok(stagingStore.applyChanges(changeIds));
    }

    @DeleteMapping
    public ResponseEntity<ClearStagedChangesResponseDto> clear(
            @RequestParam(value = "changeIds", required = false) List<String> changeIds
    ) {
        int cleared = stagingStore.clearStagedChanges(changeIds);
        return ResponseEntity.ok(new ClearStagedChangesResponseDto(cleared, stagingStore.getStats().stagedCount()));
    }
}
