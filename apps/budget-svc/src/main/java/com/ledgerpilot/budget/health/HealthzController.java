package com.ledgerpilot.budget.health;

import com.ledgerpilot.budget.budget.BudgetContext;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus whether the budget list has been loaded. Never calls the remote API.
 */
@RestController
public class HealthzController {

    private final BudgetContext budgetContext;

    public HealthzController(BudgetContext budgetContext) {
        this.budgetContext = budgetContext;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("budgetsLoaded", budgetContext.isLoaded());
        body.put("activeBudget", budgetContext.getActiveBudgetId().orElse(null));
        return body;
    }
}
