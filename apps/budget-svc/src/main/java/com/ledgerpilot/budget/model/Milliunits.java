package com.ledgerpilot.budget.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Amounts travel as milliunits: 1000 milliunits are one currency unit whatever the currency's
 * decimal digits.
 */
public final class Milliunits {

    static final CurrencyFormat DEFAULT_FORMAT =
            new CurrencyFormat("USD", "$123.45", 2, ".", true, ",", "$", true);

    private Milliunits() {
    }

    public static BigDecimal toUnits(long milliunits) {
        return BigDecimal.valueOf(milliunits, 3);
    }

    /**
     * Formats using the budget's currency format, or USD when none is known.
     */
    public static String format(long milliunits, CurrencyFormat currencyFormat) {
        CurrencyFormat format = currencyFormat == null ? DEFAULT_FORMAT : currencyFormat;
        String plain = toUnits(milliunits).abs()
                .setScale(Math.max(format.decimalDigits(), 0), RoundingMode.HALF_UP)
                .toPlainString();
        int dot = plain.indexOf('.');
        String integerPart = dot < 0 ? plain : plain.substring(0, dot);
        String fraction = dot < 0 ? "" : plain.substring(dot + 1);

        String number = group(integerPart, nonNull(format.groupSeparator(), ","));
        if (!fraction.isEmpty()) {
            number = number + nonNull(format.decimalSeparator(), ".") + fraction;
        }
        if (format.displaySymbol()) {
            String symbol = nonNull(format.currencySymbol(), "");
            number = format.symbolFirst() ? symbol + number : number + symbol;
        }
        return milliunits < 0 ? "-" + number : number;
    }

    private static String group(String digits, String separator) {
        StringBuilder grouped = new StringBuilder();
        int firstGroup = digits.length() % 3 == 0 ? 3 : digits.length() % 3;
        grouped.append(digits, 0, firstGroup);
        for (int i = firstGroup; i < digits.length(); i += 3) {
            grouped.append(separator).append(digits, i, i + 3);
        }
        return grouped.toString();
    }

    private static String nonNull(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
