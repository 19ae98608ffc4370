package dev.univer.kuberan.bot;

import dev.univer.kuberan.conversation.ConversationDispatcher;
import dev.univer.kuberan.conversation.ConversationEngine;
import dev.univer.kuberan.conversation.InboundEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns Telegram updates into {@link InboundEvent}s and hands them to the dispatcher, keyed
 * by chat and user so one user's events never overlap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UpdateRouter {

    private static final String MENTION_OPT = "(?:@\\w+)?";
    private static final Pattern COMMAND = Pattern.compile("^/(\\w+)" + MENTION_OPT + "(?:\\s+(.*))?$", Pattern.DOTALL);

    private final CommandRouter commands;
    private final ConversationEngine engine;
    private final ConversationDispatcher dispatcher;

    @EventListener
    public void onUpdate(Update update) {
        try {
            InboundEvent event = toEvent(update);
            if (event == null) return;
            dispatcher.submit(event.chatUser(), () -> route(event));
        } catch (Exception e) {
            log.error("Error processing update", e);
        }
    }

    void route(InboundEvent event) {
        switch (event.kind()) {
            case COMMAND -> commands.dispatch(event);
            case TEXT -> engine.onText(event);
            case BUTTON -> engine.onButton(event);
        }
    }

    /** Null for updates the bot does not react to. */
    static InboundEvent toEvent(Update update) {
        if (update.hasCallbackQuery()) {
            CallbackQuery q = update.getCallbackQuery();
            Message m = q.getMessage();
            if (m == null || q.getFrom() == null) return null;
            return InboundEvent.builder()
                    .kind(InboundEvent.Kind.BUTTON)
                    .chatId(m.getChatId())
                    .userId(q.getFrom().getId())
                    .username(q.getFrom().getUserName())
                    .firstName(q.getFrom().getFirstName())
                    .payload(q.getData())
                    .messageId(m.getMessageId())
                    .callbackQueryId(q.getId())
                    .build();
        }

        if (!update.hasMessage() || !update.getMessage().hasText()) return null;
        Message msg = update.getMessage();
        User from = msg.getFrom();
        if (from == null) return null;

        String text = msg.getText().trim();
        InboundEvent.InboundEventBuilder event = InboundEvent.builder()
                .chatId(msg.getChatId())
                .userId(from.getId())
                .username(from.getUserName())
                .firstName(from.getFirstName())
                .messageId(msg.getMessageId());

        Matcher m = COMMAND.matcher(text);
        if (m.matches()) {
            String args = m.group(2) == null ? "" : m.group(2).trim();
            return event.kind(InboundEvent.Kind.COMMAND)
                    .command(m.group(1).toLowerCase(Locale.ROOT))
                    .text(args)
                    .build();
        }
        // other slash-text is a command for some other bot
        if (text.startsWith("/")) return null;
        return event.kind(InboundEvent.Kind.TEXT).text(text).build();
    }
}
