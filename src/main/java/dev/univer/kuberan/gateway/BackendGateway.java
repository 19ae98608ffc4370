package dev.univer.kuberan.gateway;

import dev.univer.kuberan.model.*;

import java.util.List;
import java.util.Optional;

/**
 * Calls into the Kuberan API. Two principals are involved: the bot itself (internal
 * secret) for linking and resolving users, and the resolved user (bearer token) for
 * everything that touches their data.
 *
 * <p>Failures surface as {@link BackendException}, except {@link #recordActivity} which
 * never throws.
 */
public interface BackendGateway {

    /** Empty when the Telegram user has not linked an account. */
    Optional<LinkedUser> resolve(long telegramUserId);

    void recordActivity(long telegramUserId);

    /** @throws LinkFailedException when the code is invalid or expired */
    void completeLink(LinkRequest request);

    List<Account> listAccounts(String authToken);

    List<Category> listCategories(String authToken);

    Category createCategory(String authToken, NewCategory category);

    Account createCashAccount(String authToken, NewCashAccount account);

    void createTransaction(String authToken, NewTransaction transaction);

    List<Budget> listBudgets(String authToken);

    BudgetProgress getBudgetProgress(String authToken, String budgetId);

    List<MonthlySummary> getMonthlySummary(String authToken, int months);
}
