package dev.univer.kuberan.conversation;

import lombok.Builder;

/**
 * A user action, already stripped of transport details. Commands carry their name and
 * arguments, text carries the message, buttons carry the payload and the message they
 * were attached to.
 */
@Builder
public record InboundEvent(Kind kind,
                           long chatId,
                           long userId,
                           String username,
                           String firstName,
                           String command,
                           String text,
                           String payload,
                           Integer messageId,
                           String callbackQueryId) {

    public enum Kind { COMMAND, TEXT, BUTTON }

    public ChatUser chatUser() {
        return new ChatUser(chatId, userId);
    }

    public boolean isButton() {
        return kind == Kind.BUTTON;
    }

    /** Command arguments, or the message text; never null. */
    public String textOrEmpty() {
        return text == null ? "" : text;
    }
}
