package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.ReportService;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(60)
public class CategoriesCommand extends LinkedUserCommand {

    private final ReportService reports;

    public CategoriesCommand(BackendGateway gateway, ChatTransport transport, ReportService reports) {
        super(gateway, transport);
        this.reports = reports;
    }

    @Override public String command() { return "categories"; }
    @Override public String description() { return "Browse your categories"; }
    @Override protected String subject() { return "categories"; }

    @Override
    protected String render(LinkedUser user) {
        return reports.renderCategories(user);
    }
}
