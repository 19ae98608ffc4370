package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.ReportService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(50)
public class AccountsCommand extends LinkedUserCommand {

    private final ReportService reports;

    public AccountsCommand(BackendGateway gateway, ChatTransport transport, ReportService reports) {
        super(gateway, transport);
        this.reports = reports;
    }

    @Override public String command() { return "accounts"; }
    @Override public String description() { return "List all your accounts"; }
    @Override protected String subject() { return "accounts"; }

    @Override
    protected String render(LinkedUser user) {
        return reports.renderAccounts(user);
    }
}
