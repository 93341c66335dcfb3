package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BudgetSummary(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("last_modified_on") String lastModifiedOn,
        @JsonProperty("first_month") String firstMonth,
        @JsonProperty("last_month") String lastMonth,
        @JsonProperty("date_format") DateFormat dateFormat,
        @JsonProperty("currency_format") CurrencyFormat currencyFormat
) {
}
