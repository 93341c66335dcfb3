package com.ledgerpilot.budget.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CurrencyFormat(
        @JsonProperty("iso_code") String isoCode,
        @JsonProperty("example_format") String exampleFormat,
        @JsonProperty("decimal_digits") int decimalDigits,
        @JsonProperty("decimal_separator") String decimalSeparator,
        @JsonProperty("symbol_first") boolean symbolFirst,
        @JsonProperty("group_separator") String groupSeparator,
        @JsonProperty("currency_symbol") String currencySymbol,
        @JsonProperty("display_symbol") boolean displaySymbol
) {
}
