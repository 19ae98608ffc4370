package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.InboundEvent;
import dev.univer.kuberan.conversation.TransactionFlow;
import dev.univer.kuberan.model.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
@RequiredArgsConstructor
public class IncomeCommand implements BotCommandHandler {

    private final TransactionFlow transactionFlow;

    @Override public String command() { return "income"; }
    @Override public String description() { return "Record income"; }

    @Override
    public void handle(InboundEvent event) {
        transactionFlow.start(event, TransactionType.INCOME);
    }
}
