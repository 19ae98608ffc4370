package dev.univer.kuberan.bot.command;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.conversation.InboundEvent;
import dev.univer.kuberan.gateway.BackendException;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.model.LinkedUser;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/** Commands that only make sense for a linked user: resolve, record activity, render one report. */
@Slf4j
public abstract class LinkedUserCommand implements BotCommandHandler {

    static final String NOT_LINKED = "Your Telegram account is not linked.\nUse /start to link your account.";

    protected final BackendGateway gateway;
    protected final ChatTransport transport;

    protected LinkedUserCommand(BackendGateway gateway, ChatTransport transport) {
        this.gateway = gateway;
        this.transport = transport;
    }

    /** @throws BackendException when the data behind the report cannot be fetched */
    protected abstract String render(LinkedUser user);

    /** "accounts", "budgets", ...: used in the failure message. */
    protected abstract String subject();

    @Override
    public void handle(InboundEvent event) {
        String text;
        try {
            Optional<LinkedUser> user = gateway.resolve(event.userId());
            if (user.isEmpty()) {
                text = NOT_LINKED;
            } else {
                gateway.recordActivity(event.userId());
                text = render(user.get());
            }
        } catch (BackendException e) {
            log.error("/{} failed for user {}: {}", command(), event.userId(), e.getMessage());
            text = "Failed to fetch " + subject() + ". Please try again later.";
        }
        transport.send(event.chatId(), text, null);
    }
}
