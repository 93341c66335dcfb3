package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BudgetSettings(
        @JsonProperty("date_format") DateFormat dateFormat,
        @JsonProperty("currency_format") CurrencyFormat currencyFormat
) {
}
