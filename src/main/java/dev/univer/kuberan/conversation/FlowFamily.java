package dev.univer.kuberan.conversation;

import dev.univer.kuberan.keyboard.CallbackData;

/** Sessions of different families may live side by side for the same chat and user. */
public enum FlowFamily {
    TRANSACTION("Session expired. Please start over with /expense or /income."),
    LINK("Session expired. Please try /start again.");

    private final String expiredMessage;

    FlowFamily(String expiredMessage) {
        this.expiredMessage = expiredMessage;
    }

    /** Answer to a button press that no live session of this family owns. */
    public String expiredMessage() {
        return expiredMessage;
    }

    /** Family that owns buttons of the given payload namespace, null for unknown namespaces. */
    public static FlowFamily forNamespace(String namespace) {
        if (namespace == null) return null;
        return switch (namespace) {
            case CallbackData.CATEGORY, CallbackData.ACCOUNT, CallbackData.CURRENCY,
                 CallbackData.NEW_CATEGORY_PARENT, CallbackData.NEW_CATEGORY_ICON,
                 CallbackData.TRANSACTION -> TRANSACTION;
            case CallbackData.LINK_CURRENCY -> LINK;
            default -> null;
        };
    }
}
