package dev.univer.kuberan.service;

import dev.univer.kuberan.conversation.ChatTransport;
import dev.univer.kuberan.conversation.ChatTransportException;
import dev.univer.kuberan.keyboard.Keyboard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/** {@link ChatTransport} over the Bot API; choice lists become inline keyboards. */
@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramSender implements ChatTransport {

    private final TelegramWrapper wrapper;

    @Override
    public Integer send(long chatId, String text, Keyboard keyboard) {
        SendMessage sm = SendMessage.builder()
                .chatId(Long.toString(chatId))
                .text(text)
                .replyMarkup(markup(keyboard))
                .build();
        try {
            Message sent = wrapper.execute(sm);
            return sent == null ? null : sent.getMessageId();
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to send message to chat " + chatId, e);
        }
    }

    @Override
    public void edit(long chatId, int messageId, String text, Keyboard keyboard) {
        EditMessageText edit = EditMessageText.builder()
                .chatId(Long.toString(chatId))
                .messageId(messageId)
                .text(text)
                .replyMarkup(markup(keyboard))
                .build();
        try {
            wrapper.execute(edit);
        } catch (TelegramApiException e) {
            throw new ChatTransportException("Failed to edit message " + messageId + " in chat " + chatId, e);
        }
    }

    @Override
    public void acknowledge(String callbackQueryId) {
        if (callbackQueryId == null) return;
        try {
            wrapper.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
        } catch (TelegramApiException e) {
            // the spinner times out on its own
            log.warn("Failed to answer callback query {}: {}", callbackQueryId, e.getMessage());
        }
    }

    static InlineKeyboardMarkup markup(Keyboard keyboard) {
        if (keyboard == null) return null;
        List<List<InlineKeyboardButton>> rows = keyboard.rows().stream()
                .map(row -> row.stream()
                        .map(c -> InlineKeyboardButton.builder().text(c.label()).callbackData(c.payload()).build())
                        .toList())
                .toList();
        return InlineKeyboardMarkup.builder().keyboard(rows).build();
    }
}
