package dev.univer.kuberan.keyboard;

import dev.univer.kuberan.model.Account;
import dev.univer.kuberan.model.Category;
import dev.univer.kuberan.model.TransactionType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static dev.univer.kuberan.keyboard.CallbackData.*;

/**
 * Builds the button lists shown during a conversation. Every payload produced here is
 * understood by the conversation engine through {@link CallbackData#parse}.
 */
public final class ChoiceListBuilder {

    public static final int CATEGORY_PAGE_SIZE = 9;
    private static final int CATEGORIES_PER_ROW = 3;
    private static final int ACCOUNTS_PER_ROW = 2;
    private static final int PARENTS_PER_ROW = 2;

    private ChoiceListBuilder() {}

    // ===================== categories =====================

    /**
     * Parents in fetch order, each followed by its children in fetch order. Anything left
     * over (parent not loaded, or nested deeper) goes to the end, once.
     */
    public static List<Category> orderCategories(List<Category> categories) {
        Map<String, List<Category>> children = new LinkedHashMap<>();
        for (Category c : categories) {
            if (!c.isTopLevel()) children.computeIfAbsent(c.getParentId(), k -> new ArrayList<>()).add(c);
        }

        List<Category> ordered = new ArrayList<>(categories.size());
        Set<String> seen = new HashSet<>();
        for (Category p : categories) {
            if (!p.isTopLevel() || !seen.add(p.getId())) continue;
            ordered.add(p);
            for (Category child : children.getOrDefault(p.getId(), List.of())) {
                if (seen.add(child.getId())) ordered.add(child);
            }
        }
        for (Category c : categories) {
            if (seen.add(c.getId())) ordered.add(c);
        }
        return ordered;
    }

    public static int pageCount(int total) {
        return Math.max(1, (total + CATEGORY_PAGE_SIZE - 1) / CATEGORY_PAGE_SIZE);
    }

    /** Out-of-range pages (stale buttons) are pulled back into range. */
    public static int clampPage(int total, int page) {
        return Math.min(Math.max(page, 0), pageCount(total) - 1);
    }

    public static Keyboard categoryPage(List<Category> categories, int requested) {
        List<Category> ordered = orderCategories(categories);
        int page = clampPage(ordered.size(), requested);
        int start = page * CATEGORY_PAGE_SIZE;
        List<Category> slice = start >= ordered.size()
                               ? List.of()
                               : ordered.subList(start, Math.min(start + CATEGORY_PAGE_SIZE, ordered.size()));

        List<Choice> choices = slice.stream()
                .map(c -> new Choice(categoryLabel(c), of(CATEGORY, c.getId())))
                .toList();
        List<List<Choice>> rows = new ArrayList<>(Keyboard.chunk(choices, CATEGORIES_PER_ROW));

        List<Choice> nav = new ArrayList<>();
        if (page > 0) nav.add(new Choice("< Prev", CallbackData.categoryPage(page - 1)));
        if (start + CATEGORY_PAGE_SIZE < ordered.size()) nav.add(new Choice("Next >", CallbackData.categoryPage(page + 1)));
        if (!nav.isEmpty()) rows.add(nav);

        rows.add(List.of(new Choice("+ New", of(CATEGORY, NEW)),
                         new Choice("Skip", of(CATEGORY, NONE))));
        return new Keyboard(rows);
    }

    public static String categoryLabel(Category c) {
        if (c.hasIcon()) return c.getIcon() + " " + c.getName();
        if (!c.isTopLevel()) return "  " + c.getName();
        return c.getName();
    }

    /** Top-level categories of the given type, offered as parents for a new category. */
    public static Keyboard parentCategories(List<Category> categories, TransactionType type) {
        List<Choice> choices = categories.stream()
                .filter(c -> c.isTopLevel() && c.getType() == type)
                .map(c -> new Choice(c.hasIcon() ? c.getIcon() + " " + c.getName() : c.getName(),
                                     of(NEW_CATEGORY_PARENT, c.getId())))
                .toList();
        List<List<Choice>> rows = new ArrayList<>(Keyboard.chunk(choices, PARENTS_PER_ROW));
        rows.add(List.of(new Choice("Top-level (no parent)", of(NEW_CATEGORY_PARENT, NONE))));
        return new Keyboard(rows);
    }

    public static Keyboard iconSkip() {
        return Keyboard.of(List.of(new Choice("Skip", of(NEW_CATEGORY_ICON, SKIP))));
    }

    // ===================== accounts =====================

    public static List<Account> eligibleAccounts(List<Account> accounts) {
        return accounts.stream().filter(Account::isEligible).toList();
    }

    public static Keyboard accounts(List<Account> accounts) {
        List<Choice> choices = eligibleAccounts(accounts).stream()
                .map(a -> new Choice(a.getName(), of(ACCOUNT, a.getId())))
                .toList();
        List<List<Choice>> rows = new ArrayList<>(Keyboard.chunk(choices, ACCOUNTS_PER_ROW));
        rows.add(List.of(new Choice("+ New", of(ACCOUNT, NEW)),
                         new Choice("Back", of(ACCOUNT, BACK))));
        return new Keyboard(rows);
    }

    // ===================== currency & confirm =====================

    public static Keyboard currencies(String defaultCurrency) {
        return Keyboard.of(
                List.of(new Choice(defaultCurrency + " (Default)", of(CURRENCY, defaultCurrency)),
                        new Choice("Other", of(CURRENCY, OTHER))),
                List.of(new Choice("Back", of(CURRENCY, BACK))));
    }

    public static Keyboard linkCurrencies(String defaultCurrency) {
        return Keyboard.of(
                List.of(new Choice(defaultCurrency + " (Default)", of(LINK_CURRENCY, defaultCurrency)),
                        new Choice("Other", of(LINK_CURRENCY, OTHER))));
    }

    public static Keyboard confirm() {
        return Keyboard.of(
                List.of(new Choice("Change Category", of(TRANSACTION, CHANGE_CATEGORY)),
                        new Choice("Change Account", of(TRANSACTION, CHANGE_ACCOUNT))),
                List.of(new Choice("Change Currency", of(TRANSACTION, CHANGE_CURRENCY))),
                List.of(new Choice("Confirm", of(TRANSACTION, CONFIRM))),
                List.of(new Choice("Cancel", of(TRANSACTION, CANCEL))));
    }
}
