package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.InboundEvent;

/** One slash command. Implementations are collected by the command router at startup. */
public interface BotCommandHandler {

    /** Name without the slash, lower case. */
    String command();

    /** Shown in the client's command menu. */
    String description();

    void handle(InboundEvent event);
}
