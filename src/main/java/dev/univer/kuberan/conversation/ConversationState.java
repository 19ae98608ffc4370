package dev.univer.kuberan.conversation;

import dev.univer.kuberan.keyboard.CallbackData;

import java.util.EnumSet;
import java.util.Set;

import static dev.univer.kuberan.conversation.FlowFamily.LINK;
import static dev.univer.kuberan.conversation.FlowFamily.TRANSACTION;

/**
 * Where a session is waiting. Each state accepts typed text, buttons of one payload
 * namespace, or both; cancel and timeout are accepted everywhere.
 */
public enum ConversationState {
    AWAITING_AMOUNT(TRANSACTION, null, InputKind.TEXT),
    AWAITING_CATEGORY(TRANSACTION, CallbackData.CATEGORY, InputKind.BUTTON),
    AWAITING_NEW_CATEGORY_NAME(TRANSACTION, null, InputKind.TEXT),
    AWAITING_NEW_CATEGORY_PARENT(TRANSACTION, CallbackData.NEW_CATEGORY_PARENT, InputKind.BUTTON),
    AWAITING_NEW_CATEGORY_ICON(TRANSACTION, CallbackData.NEW_CATEGORY_ICON, InputKind.TEXT, InputKind.BUTTON),
    AWAITING_ACCOUNT(TRANSACTION, CallbackData.ACCOUNT, InputKind.BUTTON),
    AWAITING_NEW_ACCOUNT_NAME(TRANSACTION, null, InputKind.TEXT),
    AWAITING_CURRENCY_CHOICE(TRANSACTION, CallbackData.CURRENCY, InputKind.BUTTON),
    AWAITING_NEW_CURRENCY_CODE(TRANSACTION, null, InputKind.TEXT),
    CONFIRM(TRANSACTION, CallbackData.TRANSACTION, InputKind.BUTTON),

    LINK_AWAITING_CURRENCY(LINK, CallbackData.LINK_CURRENCY, InputKind.BUTTON),
    LINK_AWAITING_CUSTOM_CURRENCY(LINK, null, InputKind.TEXT);

    private final FlowFamily family;
    private final String buttonNamespace;
    private final Set<InputKind> accepted;

    ConversationState(FlowFamily family, String buttonNamespace, InputKind first, InputKind... rest) {
        this.family = family;
        this.buttonNamespace = buttonNamespace;
        this.accepted = EnumSet.of(first, rest);
        this.accepted.add(InputKind.CANCEL);
        this.accepted.add(InputKind.TIMEOUT);
    }

    public FlowFamily family() { return family; }

    public boolean accepts(InputKind kind) {
        return accepted.contains(kind);
    }

    /** True for buttons this state is waiting for; anything else is a stale button. */
    public boolean acceptsButton(String namespace) {
        return accepts(InputKind.BUTTON) && buttonNamespace != null && buttonNamespace.equals(namespace);
    }
}
