package dev.univer.kuberan.service;

import dev.univer.kuberan.gateway.BackendException;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.*;
import dev.univer.kuberan.util.MoneyFormat;
import dev.univer.kuberan.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only reports for the informational commands. Top-level fetch failures propagate as
 * {@link BackendException}; only budget progress degrades per entry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportService {

    private static final String RULE = "━━━━━━━━━━━━━━━━";
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private final BackendGateway gateway;
    private final BotProperties props;
    private final Clock clock;

    // ===================== accounts =====================

    public String renderBalance(LinkedUser user) {
        List<Account> accounts = gateway.listAccounts(user.getAuthToken());
        if (accounts.isEmpty()) return noAccounts();

        StringBuilder sb = new StringBuilder("💰 Your Accounts\n\n");
        long total = 0;
        for (Account a : accounts) {
            if (!a.isActive()) continue;
            sb.append(typeLabel(a)).append("\n")
              .append(a.getName()).append("\n")
              .append("Balance: ").append(MoneyFormat.currency(a.getBalance(), a.getCurrency())).append("\n\n");
            total += a.getBalance();
        }
        sb.append(RULE).append("\n")
          .append("Total: ").append(MoneyFormat.currency(total, currencyOf(user)));
        return sb.toString();
    }

    public String renderAccounts(LinkedUser user) {
        List<Account> accounts = gateway.listAccounts(user.getAuthToken());
        if (accounts.isEmpty()) return noAccounts();

        StringBuilder sb = new StringBuilder("🏦 Your Accounts\n\n");
        for (Account a : accounts) {
            sb.append(a.isActive() ? "✅ " : "🔒 ").append(typeLabel(a)).append("\n")
              .append(a.getName() == null ? "Unnamed Account" : a.getName()).append("\n")
              .append("Balance: ").append(MoneyFormat.currency(a.getBalance(), a.getCurrency())).append("\n");
            if (a.getType() == AccountType.CREDIT_CARD && a.getCreditLimit() != null && a.getCreditLimit() != 0) {
                sb.append("Limit: ").append(MoneyFormat.currency(a.getCreditLimit(), a.getCurrency())).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    // ===================== categories =====================

    public String renderCategories(LinkedUser user) {
        List<Category> categories = gateway.listCategories(user.getAuthToken());
        if (categories.isEmpty()) {
            return "You don't have any categories yet.\n" +
                   "Create categories using /expense or /income, or in the web app!";
        }

        StringBuilder sb = new StringBuilder("Your Categories\n\n");
        for (TransactionType type : TransactionType.values()) {
            List<Category> ofType = categories.stream().filter(c -> c.getType() == type).toList();
            if (ofType.isEmpty()) continue;
            sb.append(type.title()).append("\n");
            appendTree(sb, ofType);
            sb.append("\n");
        }
        return sb.toString().trim();
    }

    /** Parents with their children indented below; orphans are listed after, flat. */
    private static void appendTree(StringBuilder sb, List<Category> categories) {
        Map<String, List<Category>> children = new LinkedHashMap<>();
        for (Category c : categories) {
            if (!c.isTopLevel()) children.computeIfAbsent(c.getParentId(), k -> new ArrayList<>()).add(c);
        }
        for (Category p : categories) {
            if (!p.isTopLevel()) continue;
            sb.append(categoryLine("", p)).append("\n");
            for (Category child : children.getOrDefault(p.getId(), List.of())) {
                sb.append(categoryLine("  ", child)).append("\n");
            }
            children.remove(p.getId());
        }
        children.values().forEach(orphans -> orphans.forEach(o -> sb.append(categoryLine("", o)).append("\n")));
    }

    private static String categoryLine(String indent, Category c) {
        String line = indent + (c.hasIcon() ? c.getIcon() + " " : "") + c.getName();
        if (c.getDescription() != null && !c.getDescription().isBlank()) line += " - " + c.getDescription();
        return line;
    }

    // ===================== budgets =====================

    public String renderBudgets(LinkedUser user) {
        List<Budget> budgets = gateway.listBudgets(user.getAuthToken());
        if (budgets.isEmpty()) {
            return "You don't have any budgets yet.\n" +
                   "Create budgets in the web app to track your spending!";
        }

        String currency = currencyOf(user);
        StringBuilder sb = new StringBuilder("📊 Your Budgets\n\n");
        for (Budget b : budgets) {
            if (!b.isActive()) continue;
            String name = b.getName() == null ? "Unnamed Budget" : b.getName();
            String period = b.getPeriod() == null ? "monthly" : b.getPeriod();
            BudgetProgress progress;
            try {
                progress = gateway.getBudgetProgress(user.getAuthToken(), b.getId());
            } catch (BackendException e) {
                log.warn("No progress for budget {}: {}", b.getId(), e.getMessage());
                sb.append("📋 ").append(name).append(" (").append(period).append(")\n")
                  .append("Budget: ").append(MoneyFormat.currency(b.getAmount(), currency)).append("\n\n");
                continue;
            }
            sb.append(statusMark(progress.getPercentage())).append(" ").append(name)
              .append(" (").append(period).append(")\n")
              .append("Budget: ").append(MoneyFormat.currency(b.getAmount(), currency)).append("\n")
              .append("Spent: ").append(MoneyFormat.currency(progress.getSpent(), currency))
              .append(" (").append(MoneyFormat.percentage(progress.getPercentage())).append(")\n")
              .append("Remaining: ").append(MoneyFormat.currency(progress.getRemaining(), currency)).append("\n\n");
        }
        return sb.toString().trim();
    }

    static String statusMark(double percentage) {
        if (percentage < 80) return "✅";
        if (percentage < 100) return "⚠️";
        return "🚨";
    }

    // ===================== summary =====================

    public String renderSummary(LinkedUser user) {
        List<MonthlySummary> months = gateway.getMonthlySummary(user.getAuthToken(), 1);
        if (months.isEmpty()) return "No transaction data available for this month.";

        MonthlySummary m = months.get(0);
        String currency = currencyOf(user);
        return "📈 Monthly Summary - " + LocalDate.now(clock).format(MONTH) + "\n\n" +
               "💰 Income: " + MoneyFormat.currency(m.getIncome(), currency) + "\n" +
               "💸 Expenses: " + MoneyFormat.currency(m.getExpenses(), currency) + "\n" +
               RULE + "\n" +
               (m.net() >= 0 ? "✅" : "⚠️") + " Net: " + MoneyFormat.currency(m.net(), currency);
    }

    // ===================== helpers =====================

    private String currencyOf(LinkedUser user) {
        return ParseUtil.normalizeCurrency(user.getDefaultCurrency()).orElse(props.getDefaultCurrency());
    }

    private static String typeLabel(Account a) {
        return a.getType() == null ? AccountType.CASH.label() : a.getType().label();
    }

    private static String noAccounts() {
        return "You don't have any accounts yet.\n" +
               "Create accounts in the web app to get started!";
    }
}
