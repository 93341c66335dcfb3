package com.ledgerpilot.budget.controller;

import static com.ledgerpilot.budget.ModelFixtures.budget;
import static com.ledgerpilot.budget.ModelFixtures.transaction;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ledgerpilot.budget.ModelFixtures;
import com.ledgerpilot.budget.budget.BudgetContext;
import com.ledgerpilot.budget.model.BudgetSettings;
import com.ledgerpilot.budget.model.TransactionFields;
import com.ledgerpilot.budget.remote.BudgetApi;
import com.ledgerpilot.budget.remote.SaveTransactionsResult;
import com.ledgerpilot.budget.staging.ChangeType;
import com.ledgerpilot.budget.staging.StagingStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class StagingControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    BudgetContext budgetContext;

    @Autowired
    StagingStore stagingStore;

    @MockBean
    BudgetApi budgetApi;

    @BeforeEach
    void setUp() {
        stagingStore.reset();
        budgetContext.reset();
        when(budgetApi.listBudgets()).thenReturn(List.of(budget("b1", "Household")));
        when(budgetApi.getBudgetSettings("b1")).thenReturn(new BudgetSettings(null, ModelFixtures.USD));
        budgetContext.initialize();
    }

    @Test
    void stageReviewAndApplyCategorization() throws Exception {
        when(budgetApi.getTransaction("b1", "t1")).thenReturn(transaction("t1", -4_500L, null, null));
        when(budgetApi.updateTransactions(eq("b1"), anyList()))
                .thenReturn(new SaveTransactionsResult(List.of("t1"), List.of(), List.of(), 2L));

        mockMvc.perform(post("/staged-changes/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\":\"t1\",\"categoryId\":\"c-food\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.change.type").value("categorization"))
                .andExpect(jsonPath("$.change.budgetId").value("b1"))
                .andExpect(jsonPath("$.change.proposedChanges.category_id").value("c-food"));

        mockMvc.perform(get("/staged-changes").param("transactionId", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1));

        mockMvc.perform(post("/staged-changes/apply"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.appliedCount").value(1))
                .andExpect(jsonPath("$.results[0].status").value("SUCCESS"));

        assertThat(stagingStore.getStagedChanges()).isEmpty();
    }

    @Test
    void unbalancedSplitIsRejected() throws Exception {
        when(budgetApi.getTransaction("b1", "t1")).thenReturn(transaction("t1", -10_000L, null, null));

        mockMvc.perform(post("/staged-changes/splits")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"transactionId":"t1","subtransactions":[
                                  {"amount":-6000,"categoryId":"c1"},
                                  {"amount":-3000,"categoryId":"c2"}]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.differenceMilliunits").value(1000));

        assertThat(stagingStore.getStagedChanges()).isEmpty();
    }

    @Test
    void categoryIdAndNameTogetherAreRejected() throws Exception {
        mockMvc.perform(post("/staged-changes/categorizations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"transactionId\":\"t1\",\"categoryId\":\"c1\",\"categoryName\":\"Food\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Cannot provide both categoryId and categoryName"));
    }

    @Test
    void clearDiscardsStagedChanges() throws Exception {
        stagingStore.stageChange(ChangeType.UPDATE, "b1", "t9", "memo",
                null, TransactionFields.categorization(null, "note"));

        mockMvc.perform(delete("/staged-changes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clearedCount").value(1))
                .andExpect(jsonPath("$.remainingCount").value(0));
    }
}
