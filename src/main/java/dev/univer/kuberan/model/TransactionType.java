package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Direction of money; categories carry the same values. */
public enum TransactionType {
    EXPENSE, INCOME;

    @JsonValue
    public String wireValue() { return name().toLowerCase(Locale.ROOT); }

    /** "Expense", "Income". */
    public String title() {
        String v = wireValue();
        return Character.toUpperCase(v.charAt(0)) + v.substring(1);
    }

    @JsonCreator
    public static TransactionType fromWire(String value) {
        if (value == null) return null;
        for (TransactionType t : values()) {
            if (t.wireValue().equalsIgnoreCase(value.trim())) return t;
        }
        return null;
    }
}
