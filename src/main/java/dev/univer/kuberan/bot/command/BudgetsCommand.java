package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.ReportService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(70)
public class BudgetsCommand extends LinkedUserCommand {

    private final ReportService reports;

    public BudgetsCommand(BackendGateway gateway, ChatTransport transport, ReportService reports) {
        super(gateway, transport);
        this.reports = reports;
    }

    @Override public String command() { return "budgets"; }
    @Override public String description() { return "View budget status"; }
    @Override protected String subject() { return "budgets"; }

    @Override
    protected String render(LinkedUser user) {
        return reports.renderBudgets(user);
    }
}
