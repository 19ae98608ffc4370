package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.conversation.InboundEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Bots cannot delete a user's history; a tall message pushes it out of view instead. */
@Component
@Order(110)
@RequiredArgsConstructor
public class ClearCommand implements BotCommandHandler {

    private static final int BLANK_LINES = 50;

    private final ChatTransport transport;

    @Override public String command() { return "clear"; }
    @Override public String description() { return "Clear the chat view"; }

    @Override
    public void handle(InboundEvent event) {
        // Telegram trims plain leading newlines, a zero-width space keeps them
        transport.send(event.chatId(), "\u200B" + "\n".repeat(BLANK_LINES) + "Chat cleared.", null);
    }
}
