package dev.univer.kuberan.conversation;

import dev.univer.kuberan.gateway.BackendException;
import dev.univer.kuberan.gateway.BackendGateway;
import dev.univer.kuberan.gateway.LinkFailedException;
import dev.univer.kuberan.keyboard.CallbackData;
import dev.univer.kuberan.keyboard.ChoiceListBuilder;
import dev.univer.kuberan.model.LinkRequest;
import dev.univer.kuberan.model.LinkedUser;
import dev.univer.kuberan.service.BotProperties;
import dev.univer.kuberan.util.ParseUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.function.BiConsumer;

import static dev.univer.kuberan.conversation.ConversationState.LINK_AWAITING_CURRENCY;
import static dev.univer.kuberan.conversation.ConversationState.LINK_AWAITING_CUSTOM_CURRENCY;

/** {@code /start <code>}: pick a default currency, then redeem the code from the web app. */
@Component
@Slf4j
public class LinkFlow extends FlowSupport {

    static final String ALREADY_LINKED = "You're already linked to Kuberan!\n\nUse /help to see available commands.";
    static final String WELCOME = "Welcome to Kuberan!\n\n" +
                                  "To link your account:\n" +
                                  "1. Go to Settings in the Kuberan web app\n" +
                                  "2. Click 'Link Telegram'\n" +
                                  "3. Copy your link code\n" +
                                  "4. Send: /start <code>\n\n" +
                                  "Use /help to see what I can do.";
    static final String CHOOSE_CURRENCY = "Choose your default currency:";
    static final String CURRENCY_CODE = "Type your currency code (3 letters, e.g. JPY, CAD, AUD):";
    static final String INVALID_CURRENCY = "Please enter a valid 3-letter currency code (e.g. JPY, CAD, AUD):";
    static final String LINK_FAILED = "Invalid or expired link code.\nPlease generate a new code from the web app.";
    static final String UNAVAILABLE = "Kuberan is not reachable right now. Choose your default currency to try again:";
    static final String RESOLVE_FAILED = "Something went wrong. Please try again later.";

    private final BackendGateway gateway;
    private final BotProperties props;

    public LinkFlow(SessionStore store, ChatTransport transport, BackendGateway gateway, BotProperties props) {
        super(store, transport);
        this.gateway = gateway;
        this.props = props;
    }

    void register(TransitionTable.Builder table) {
        table.on(LINK_AWAITING_CURRENCY, InputKind.BUTTON, handler(this::onCurrency))
             .on(LINK_AWAITING_CUSTOM_CURRENCY, InputKind.TEXT, handler(this::onCustomCurrency));
    }

    private static StateHandler handler(BiConsumer<LinkSession, InboundEvent> h) {
        return (session, event) -> h.accept((LinkSession) session, event);
    }

    public void start(InboundEvent event) {
        Optional<LinkedUser> linked;
        try {
            linked = gateway.resolve(event.userId());
        } catch (BackendException e) {
            reply(event, RESOLVE_FAILED);
            return;
        }
        if (linked.isPresent()) {
            reply(event, ALREADY_LINKED);
            return;
        }

        String code = event.textOrEmpty().trim();
        if (code.isEmpty()) {
            reply(event, WELCOME);
            return;
        }
        code = code.split("\\s+")[0];

        LinkSession session = new LinkSession(SessionKey.of(event.chatUser(), FlowFamily.LINK), props.getLinkTimeout(),
                code, nullToEmpty(event.username()), nullToEmpty(event.firstName()));
        store.put(session);
        session.setPromptMessageId(transport.send(event.chatId(), CHOOSE_CURRENCY,
                ChoiceListBuilder.linkCurrencies(props.getDefaultCurrency())));
    }

    private void onCurrency(LinkSession s, InboundEvent e) {
        CallbackData.Callback cb = CallbackData.parse(e.payload());
        if (cb.is(CallbackData.OTHER)) {
            s.setState(LINK_AWAITING_CUSTOM_CURRENCY);
            prompt(s, e, CURRENCY_CODE, null);
            return;
        }
        Optional<String> code = ParseUtil.normalizeCurrency(cb.value());
        if (code.isEmpty()) {
            prompt(s, e, CHOOSE_CURRENCY, ChoiceListBuilder.linkCurrencies(props.getDefaultCurrency()));
            return;
        }
        complete(s, e, code.get());
    }

    private void onCustomCurrency(LinkSession s, InboundEvent e) {
        Optional<String> code = ParseUtil.normalizeCurrency(e.text());
        if (code.isEmpty()) {
            reply(e, INVALID_CURRENCY);
            return;
        }
        complete(s, e, code.get());
    }

    private void complete(LinkSession s, InboundEvent e, String currency) {
        LinkRequest request = LinkRequest.builder()
                .linkCode(s.getLinkCode())
                .telegramUserId(s.telegramUserId())
                .telegramUsername(s.getUsername())
                .telegramFirstName(s.getFirstName())
                .defaultCurrency(currency)
                .build();
        try {
            gateway.completeLink(request);
        } catch (LinkFailedException ex) {
            finish(s, e, LINK_FAILED);
            return;
        } catch (BackendException ex) {
            s.setState(LINK_AWAITING_CURRENCY);
            prompt(s, e, UNAVAILABLE, ChoiceListBuilder.linkCurrencies(props.getDefaultCurrency()));
            return;
        }
        log.info("Linked Telegram user {} with default currency {}", s.telegramUserId(), currency);
        finish(s, e, "Your Telegram account is now linked to Kuberan!\n"
                + "Default currency: " + currency + "\n\n"
                + "Use /help to see available commands.");
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
