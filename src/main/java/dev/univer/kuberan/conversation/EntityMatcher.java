package dev.univer.kuberan.conversation;

import dev.univer.kuberan.model.Account;
import dev.univer.kuberan.model.Category;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Picks an account and a category out of the tail of a description:
 * "Coffee Food Wallet" -> description "Coffee", category Food, account Wallet.
 * Only whole last words are compared, case-insensitively; the account is tried first.
 */
public final class EntityMatcher {

    public record Match(String description, Account account, Category category) {
    }

    private EntityMatcher() {}

    public static Match match(String text, List<Account> accounts, List<Category> categories) {
        if (text == null || text.isBlank()) return new Match("", null, null);
        List<String> words = new ArrayList<>(Arrays.asList(text.trim().split("\\s+")));

        Account account = takeLast(words, accounts, Account::getName);
        Category category = takeLast(words, categories, Category::getName);
        return new Match(String.join(" ", words), account, category);
    }

    private static <T> T takeLast(List<String> words, List<T> candidates, Function<T, String> name) {
        if (words.isEmpty()) return null;
        String last = words.get(words.size() - 1);
        for (T c : candidates) {
            String n = name.apply(c);
            if (n != null && n.equalsIgnoreCase(last)) {
                words.remove(words.size() - 1);
                return c;
            }
        }
        return null;
    }
}
