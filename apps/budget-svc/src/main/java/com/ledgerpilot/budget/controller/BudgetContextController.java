package com.ledgerpilot.budget.controller;

import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.budget.BudgetContextView;
import com.ledgerpilot.budget.controller.dto.ActiveBudgetRequestDto;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/budget-context")
public class BudgetContextController {

    private final BudgetContext budgetContext;

    public BudgetContextController(BudgetContext budgetContext) {
        this.budgetContext = budgetContext;
    }

    @GetMapping
    public ResponseEntity<BudgetContextView> getBudgetContext() {
        return ResponseEntity.ok(budgetContext.getBudgetContext());
    }

    @PutMapping("/active")
    public ResponseEntity<BudgetContextView> setActiveBudget(@RequestBody @Valid ActiveBudgetRequestDto request) {
        budgetContext.setActiveBudget(request.budgetId());
        return ResponseEntity.ok(budgetContext.getBudgetContext());
    }

    @PostMapping("/refresh")
    public ResponseEntity<BudgetContextView> refresh() {
        budgetContext.refreshCache();
        return ResponseEntity.ok(budgetContext.getBudgetContext());
    }
}
