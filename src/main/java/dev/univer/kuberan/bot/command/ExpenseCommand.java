package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.InboundEvent;
import dev.univer.kuberan.conversation.TransactionFlow;
import dev.univer.kuberan.model.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** {@code /expense} alone starts the guided flow, {@code /expense 50 Coffee} the quick one. */
@Component
@Order(20)
@RequiredArgsConstructor
public class ExpenseCommand implements BotCommandHandler {

    private final TransactionFlow transactionFlow;

    @Override public String command() { return "expense"; }
    @Override public String description() { return "Record an expense"; }

    @Override
    public void handle(InboundEvent event) {
        transactionFlow.start(event, TransactionType.EXPENSE);
    }
}
