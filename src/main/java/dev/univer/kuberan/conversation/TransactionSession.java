package dev.univer.kuberan.conversation;

import dev.univer.kuberan.model.Account;
import dev.univer.kuberan.model.Category;
import dev.univer.kuberan.model.TransactionType;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Draft of an expense or income. Accounts and categories are the user's, loaded once when
 * the session starts; anything created mid-flow is appended here.
 */
@Getter
@Setter
public class TransactionSession extends Session {

    private final TransactionType type;
    private final String authToken;
    /** The user's default, offered first in the currency picker. */
    private final String defaultCurrency;
    private final List<Account> accounts;
    private final List<Category> categories;

    private Account account;
    private Category category;
    /** Minor units, null until an amount has been accepted. */
    private Long amount;
    private String description = "";
    private String currency;

    /** Only set while a new category is being created. */
    private NewCategoryDraft newCategory;

    public TransactionSession(SessionKey key, Duration timeout, TransactionType type, String authToken,
                              String currency, List<Account> accounts, List<Category> categories,
                              Account account) {
        super(key, ConversationState.AWAITING_AMOUNT, timeout);
        this.type = type;
        this.authToken = authToken;
        this.defaultCurrency = currency;
        this.currency = currency;
        this.accounts = new ArrayList<>(accounts);
        this.categories = new ArrayList<>(categories);
        this.account = account;
    }

    /** Description to store and show: what the user typed, or "Expense"/"Income". */
    public String effectiveDescription() {
        return description == null || description.isBlank() ? type.title() : description;
    }

    @Getter
    @Setter
    public static class NewCategoryDraft {
        private final String name;
        private String parentId;

        public NewCategoryDraft(String name) {
            this.name = name;
        }
    }
}
