package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.ReportService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(80)
public class SummaryCommand extends LinkedUserCommand {

    private final ReportService reports;

    public SummaryCommand(BackendGateway gateway, ChatTransport transport, ReportService reports) {
        super(gateway, transport);
        this.reports = reports;
    }

    @Override public String command() { return "summary"; }
    @Override public String description() { return "Monthly income/expense summary"; }
    @Override protected String subject() { return "summary"; }

    @Override
    protected String render(LinkedUser user) {
        return reports.renderSummary(user);
    }
}
