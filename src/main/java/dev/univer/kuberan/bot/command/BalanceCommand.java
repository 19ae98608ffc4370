package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.ReportService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(40)
public class BalanceCommand extends LinkedUserCommand {

    private final ReportService reports;

    public BalanceCommand(BackendGateway gateway, ChatTransport transport, ReportService reports) {
        super(gateway, transport);
        this.reports = reports;
    }

    @Override public String command() { return "balance"; }
    @Override public String description() { return "View all account balances"; }
    @Override protected String subject() { return "accounts"; }

    @Override
    protected String render(LinkedUser user) {
        return reports.renderBalance(user);
    }
}
