package dev.univer.kuberan.conversation;

import dev.univer.kuberan.keyboard.Keyboard;

/** Outbound side of the chat platform. Keyboards may be null. */
public interface ChatTransport {

    /** @return id of the sent message, null when the platform did not report one */
    Integer send(long chatId, String text, Keyboard keyboard);

    void edit(long chatId, int messageId, String text, Keyboard keyboard);

    /** Stops the button spinner on the client. */
    void acknowledge(String callbackQueryId);
}
