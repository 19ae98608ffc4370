package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.InboundEvent;
import dev.univer.kuberan.conversation.LinkFlow;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
@RequiredArgsConstructor
public class StartCommand implements BotCommandHandler {

    private final LinkFlow linkFlow;

    @Override public String command() { return "start"; }
    @Override public String description() { return "Link your Kuberan account"; }

    @Override
    public void handle(InboundEvent event) {
        linkFlow.start(event);
    }
}
