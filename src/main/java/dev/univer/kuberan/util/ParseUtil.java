package dev.univer.kuberan.util;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    // "Amount [Description]": "50", "50 Coffee", "12.5 Lunch Wallet"
    private static final String AMOUNT = "(?<amount>\\d+(?:\\.\\d{1,2})?)(?![\\d.])";
    private static final String OPT_DESC = "\\s*(?<desc>.*)";
    private static final Pattern AMOUNT_LINE = Pattern.compile("^\\s*" + AMOUNT + OPT_DESC + "$", Pattern.DOTALL);

    private static final Pattern CURRENCY = Pattern.compile("^[A-Z]{3}$");

    public static class AmountMatch {
        public final long minorUnits;
        public final String description; // never null, may be empty
        public AmountMatch(long minorUnits, String description) {
            this.minorUnits = minorUnits;
            this.description = description == null ? "" : description.trim();
        }
    }

    private ParseUtil() {}

    /**
     * Leading amount with at most two decimals, then an optional description.
     * Empty when the text does not start with a positive amount.
     */
    public static Optional<AmountMatch> parseAmountDescription(String text) {
        if (text == null) return Optional.empty();
        Matcher m = AMOUNT_LINE.matcher(text);
        if (!m.matches()) return Optional.empty();
        long minor;
        try {
            minor = toMinorUnits(m.group("amount"));
        } catch (ArithmeticException e) {
            return Optional.empty(); // does not fit in a long
        }
        if (minor <= 0) return Optional.empty();
        return Optional.of(new AmountMatch(minor, m.group("desc")));
    }

    /** "12.5" -> 1250. Exact: the input never has more than two decimals. */
    public static long toMinorUnits(String decimal) {
        return new BigDecimal(decimal).movePointRight(2).longValueExact();
    }

    /** ISO 4217 style code: trimmed, upper-cased, exactly three letters A-Z. */
    public static Optional<String> normalizeCurrency(String raw) {
        if (raw == null) return Optional.empty();
        String code = raw.trim().toUpperCase(Locale.ROOT);
        return CURRENCY.matcher(code).matches() ? Optional.of(code) : Optional.empty();
    }
}
