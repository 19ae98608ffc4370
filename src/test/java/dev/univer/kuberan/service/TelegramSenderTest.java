package dev.univer.kuberan.service;

import dev.univer.kuberan.conversation.ChatTransportException;
import dev.univer.kuberan.keyboard.Choice;
import dev.univer.kuberan.keyboard.Keyboard;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TelegramSenderTest {

    @Mock
    private TelegramWrapper wrapper;

    @Test
    void keyboardBecomesInlineMarkup() {
        Keyboard keyboard = Keyboard.of(
                List.of(new Choice("Food", "cat:c1"), new Choice("Transport", "cat:c2")),
                List.of(new Choice("Skip", "cat:none")));

        InlineKeyboardMarkup markup = TelegramSender.markup(keyboard);

        assertThat(markup.getKeyboard()).hasSize(2);
        assertThat(markup.getKeyboard().get(0)).extracting(InlineKeyboardButton::getText)
                .containsExactly("Food", "Transport");
        assertThat(markup.getKeyboard().get(1).get(0).getCallbackData()).isEqualTo("cat:none");
        assertThat(TelegramSender.markup(null)).isNull();
    }

    @Test
    void sendReturnsNewMessageId() throws TelegramApiException {
        Message sent = new Message();
        sent.setMessageId(321);
        when(wrapper.execute(any(SendMessage.class))).thenReturn(sent);

        Integer id = new TelegramSender(wrapper).send(7L, "hello", null);

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(wrapper).execute(captor.capture());
        assertThat(id).isEqualTo(321);
        assertThat(captor.getValue().getChatId()).isEqualTo("7");
        assertThat(captor.getValue().getText()).isEqualTo("hello");
        assertThat(captor.getValue().getReplyMarkup()).isNull();
    }

    @Test
    void failedEditSurfaces() throws TelegramApiException {
        doThrow(new TelegramApiException("message not found")).when(wrapper).execute(any(EditMessageText.class));

        assertThatThrownBy(() -> new TelegramSender(wrapper).edit(7L, 100, "x", null))
                .isInstanceOf(ChatTransportException.class)
                .hasMessageContaining("message 100");
    }

    @Test
    void acknowledgeWithoutQueryIsNoop() {
        new TelegramSender(wrapper).acknowledge(null);

        verifyNoInteractions(wrapper);
    }
}
