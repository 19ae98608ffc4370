package dev.univer.kuberan.util;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.Map;

public final class MoneyFormat {

    private static final Map<String, String> SYMBOLS = Map.of(
            "USD", "$",
            "EUR", "€",
            "GBP", "£",
            "INR", "₹",
            "MYR", "RM");

    private MoneyFormat() {}

    /** 1050, "MYR" -> "RM10.50"; unknown codes are used as a prefix: "JPY 10.50". */
    public static String currency(long minorUnits, String currency) {
        String code = currency == null ? "" : currency;
        String symbol = SYMBOLS.getOrDefault(code, code.isEmpty() ? "" : code + " ");
        String sign = minorUnits < 0 ? "-" : "";
        return sign + symbol + amount(Math.abs(minorUnits));
    }

    /** 123456 -> "1,234.56" */
    public static String amount(long minorUnits) {
        DecimalFormat df = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.US));
        return df.format(BigDecimal.valueOf(minorUnits, 2));
    }

    public static String percentage(double value) {
        return String.format(Locale.US, "%.1f%%", value);
    }
}
