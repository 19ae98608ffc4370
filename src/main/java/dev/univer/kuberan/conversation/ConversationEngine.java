package dev.univer.kuberan.conversation;

import dev.univer.kuberan.keyboard.CallbackData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Routes typed text and button presses to the live session of the user and runs the
 * handler the transition table has for (state, input kind).
 */
@Service
@Slf4j
public class ConversationEngine {

    static final String CANCELLED = "Cancelled.";

    private final SessionStore store;
    private final ChatTransport transport;
    private final TransitionTable table;

    public ConversationEngine(SessionStore store, ChatTransport transport,
                              TransactionFlow transactionFlow, LinkFlow linkFlow) {
        this.store = store;
        this.transport = transport;
        this.table = TransitionTable.builder()
                .with(transactionFlow::register)
                .with(linkFlow::register)
                .onEvery(InputKind.CANCEL, this::cancelled)
                .onEvery(InputKind.TIMEOUT, this::timedOut)
                .build();
    }

    /** Free text goes to the most recently active session waiting for text; otherwise it is not for us. */
    public void onText(InboundEvent event) {
        Optional<Session> target = store.findAll(event.chatUser()).stream()
                .filter(s -> s.getState().accepts(InputKind.TEXT))
                .max(Comparator.comparing(Session::getLastActivity));
        if (target.isEmpty()) {
            log.debug("Ignoring text from user {} with no session waiting for text", event.userId());
            return;
        }
        run(target.get(), InputKind.TEXT, event);
    }

    public void onButton(InboundEvent event) {
        transport.acknowledge(event.callbackQueryId());

        CallbackData.Callback cb = CallbackData.parse(event.payload());
        FlowFamily family = cb == null ? null : FlowFamily.forNamespace(cb.namespace());
        Optional<Session> session = family == null
                                    ? Optional.empty()
                                    : store.find(SessionKey.of(event.chatUser(), family));
        if (session.isEmpty()) {
            String text = (family == null ? FlowFamily.TRANSACTION : family).expiredMessage();
            if (event.messageId() != null) transport.edit(event.chatId(), event.messageId(), text, null);
            else transport.send(event.chatId(), text, null);
            return;
        }

        Session s = session.get();
        if (!s.getState().acceptsButton(cb.namespace())) {
            log.debug("Stale button {} for user {} in {}", event.payload(), event.userId(), s.getState());
            return;
        }
        run(s, InputKind.BUTTON, event);
    }

    /** {@code /cancel}: ends every live session of the user in this chat. */
    public void cancel(InboundEvent event) {
        List<Session> live = store.findAll(event.chatUser());
        boolean any = false;
        for (Session s : live) {
            if (store.remove(s)) {
                table.find(s.getState(), InputKind.CANCEL).ifPresent(h -> h.handle(s, event));
                any = true;
            }
        }
        if (any) transport.send(event.chatId(), CANCELLED, null);
    }

    @EventListener
    public void onExpired(SessionExpiredEvent event) {
        Session s = event.session();
        table.find(s.getState(), InputKind.TIMEOUT).ifPresent(h -> h.handle(s, null));
    }

    private void run(Session session, InputKind kind, InboundEvent event) {
        StateHandler handler = table.find(session.getState(), kind).orElse(null);
        if (handler == null) {
            log.debug("{} does not take {} input", session.getState(), kind);
            return;
        }
        store.touch(session);
        handler.handle(session, event);
    }

    private void cancelled(Session session, InboundEvent event) {
        log.info("User {} cancelled {} session in {}", session.getKey().userId(),
                session.getKey().family(), session.getState());
    }

    private void timedOut(Session session, InboundEvent event) {
        log.debug("Timed out {} session of user {} in {}", session.getKey().family(),
                session.getKey().userId(), session.getState());
    }
}
