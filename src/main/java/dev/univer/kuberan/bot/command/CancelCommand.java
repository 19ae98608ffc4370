package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ConversationEngine;
import dev.univer.kuberan.conversation.InboundEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(90)
@RequiredArgsConstructor
public class CancelCommand implements BotCommandHandler {

    private final ConversationEngine engine;

    @Override public String command() { return "cancel"; }
    @Override public String description() { return "Cancel current operation"; }

    @Override
    public void handle(InboundEvent event) {
        engine.cancel(event);
    }
}
