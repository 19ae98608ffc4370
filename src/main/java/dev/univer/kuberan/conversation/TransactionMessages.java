package dev.univer.kuberan.conversation;

import dev.univer.kuberan.model.Category;
import dev.univer.kuberan.model.TransactionType;
import dev.univer.kuberan.util.MoneyFormat;

/** Texts of the expense and income flows. Plain text, no markup. */
final class TransactionMessages {

    static final String NOT_LINKED = "Your Telegram account is not linked.\nUse /start to link your account.";
    static final String NO_ACCOUNTS = "No active accounts found. Please create an account in the web app first.";
    static final String LOAD_FAILED = "Failed to load your accounts. Please try again later.";
    static final String INVALID_AMOUNT = "Please enter a valid amount (e.g. 50 or 50 Coffee)";
    static final String NEW_CATEGORY_NAME = "Type a name for the new category:";
    static final String BLANK_CATEGORY_NAME = "Please type a category name:";
    static final String ICON_PROMPT = "Send an emoji to use as the icon (e.g. ☕ 🍕 💰), or tap Skip:";
    static final String CATEGORY_FAILED = "Could not create the category. Send the icon again, or tap Skip to retry.";
    static final String SELECT_ACCOUNT = "Select an account:";
    static final String NEW_ACCOUNT_NAME = "Type a name for the new account:";
    static final String BLANK_ACCOUNT_NAME = "Please type an account name:";
    static final String ACCOUNT_FAILED = "Could not create the account. Please type the name again.";
    static final String SELECT_CURRENCY = "Select a currency:";
    static final String CURRENCY_CODE = "Type your currency code (3 letters, e.g. JPY, CAD, AUD):";
    static final String INVALID_CURRENCY = "Please enter a valid 3-letter currency code (e.g. JPY, CAD, AUD):";
    static final String CANCELLED = "Cancelled.";

    private TransactionMessages() {}

    static String amountPrompt(TransactionType type) {
        return "How much was the " + type.wireValue() + "?\n"
                + "Type the amount, or amount and description (e.g. 50 Coffee)";
    }

    static String categoryPrompt(TransactionSession s) {
        return headline(s) + "\n" + s.effectiveDescription() + "\n\nSelect a category:";
    }

    static String newCategoryParent(String name) {
        return "Category: " + name + "\n\nIs this a subcategory of an existing category?";
    }

    static String confirmCard(TransactionSession s) {
        return headline(s) + "\n"
                + s.effectiveDescription() + "\n\n"
                + "Category: " + categoryName(s.getCategory()) + "\n"
                + "Account: " + s.getAccount().getName() + "\n"
                + "Currency: " + s.getCurrency();
    }

    static String commitFailed(TransactionSession s) {
        return "Failed to record the " + s.getType().wireValue() + ". Please try again.\n\n" + confirmCard(s);
    }

    static String recorded(TransactionSession s) {
        return s.getType().title() + " Recorded\n\n"
                + "Amount: " + MoneyFormat.currency(s.getAmount(), s.getCurrency()) + "\n"
                + "Description: " + s.effectiveDescription() + "\n"
                + "Category: " + categoryName(s.getCategory()) + "\n"
                + "Account: " + s.getAccount().getName();
    }

    private static String headline(TransactionSession s) {
        return s.getType().title() + ": " + MoneyFormat.currency(s.getAmount(), s.getCurrency());
    }

    private static String categoryName(Category c) {
        if (c == null) return "None";
        return c.hasIcon() ? c.getIcon() + " " + c.getName() : c.getName();
    }
}
