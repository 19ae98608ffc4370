package dev.univer.kuberan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum AccountType {
    CASH("cash", "💵 Cash"),
    CREDIT_CARD("credit_card", "💳 Credit Card"),
    DEBT("debt", "Debt"),
    INVESTMENT("investment", "📈 Investment"),
    UNKNOWN("unknown", "Other");

    private final String wireValue;
    private final String label;

    AccountType(String wireValue, String label) {
        this.wireValue = wireValue;
        this.label = label;
    }

    @JsonValue
    public String wireValue() { return wireValue; }

    public String label() { return label; }

    /** Only these may be the target of an expense or income. */
    public boolean isTransactionTarget() {
        return this == CASH || this == CREDIT_CARD || this == DEBT;
    }

    @JsonCreator
    public static AccountType fromWire(String value) {
        if (value == null) return UNKNOWN;
        return Arrays.stream(values())
                .filter(t -> t.wireValue.equalsIgnoreCase(value))
                .findFirst()
                .orElse(UNKNOWN);
    }
}
