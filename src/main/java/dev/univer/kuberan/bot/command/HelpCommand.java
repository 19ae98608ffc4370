package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.conversation.InboundEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(100)
@RequiredArgsConstructor
public class HelpCommand implements BotCommandHandler {

    static final String HELP = "Kuberan Bot Commands\n\n" +
            "Account Management\n" +
            "/balance - View all account balances\n" +
            "/accounts - List all your accounts\n\n" +
            "Categories\n" +
            "/categories - Browse your categories (with subcategories)\n\n" +
            "Transactions\n" +
            "/expense - Record an expense\n" +
            "/expense 50 Coffee - Quick expense with amount & description\n" +
            "/income - Record income\n" +
            "/income 3000 Salary - Quick income with amount & description\n\n" +
            "Budgets\n" +
            "/budgets - View budget status\n\n" +
            "Reports\n" +
            "/summary - Monthly income/expense summary\n\n" +
            "Help\n" +
            "/help - Show this help message\n" +
            "/start - Link your Kuberan account\n" +
            "/cancel - Cancel current operation\n" +
            "/clear - Push old messages out of view\n\n" +
            "Tips:\n" +
            "- Amounts can include decimals (e.g. 50.50)\n" +
            "- End the description with a category or account name to pick it, e.g. 50 Coffee Food Wallet\n" +
            "- Use buttons to pick category and account\n" +
            "- When creating a new category, you can set a parent and emoji icon\n" +
            "- Just type the command alone for a guided flow";

    private final ChatTransport transport;

    @Override public String command() { return "help"; }
    @Override public String description() { return "Show available commands"; }

    @Override
    public void handle(InboundEvent event) {
        transport.send(event.chatId(), HELP, null);
    }
}
