package dev.univer.kuberan.conversation;

import dev.univer.kuberan.keyboard.Keyboard;

/** Reply helpers shared by the flows. */
abstract class FlowSupport {

    protected final SessionStore store;
    protected final ChatTransport transport;

    protected FlowSupport(SessionStore store, ChatTransport transport) {
        this.store = store;
        this.transport = transport;
    }

    /**
     * Shows the next step. A button press edits the message it came from, typed input gets
     * a fresh message; either way the session remembers where its buttons now live.
     */
    protected void prompt(Session session, InboundEvent event, String text, Keyboard keyboard) {
        if (event.isButton()) {
            Integer target = session.getPromptMessageId() != null ? session.getPromptMessageId() : event.messageId();
            if (target != null) {
                transport.edit(event.chatId(), target, text, keyboard);
                session.setPromptMessageId(target);
                return;
            }
        }
        session.setPromptMessageId(transport.send(event.chatId(), text, keyboard));
    }

    protected void reply(InboundEvent event, String text) {
        transport.send(event.chatId(), text, null);
    }

    /** Ends the session and shows the outcome in place of the last prompt. */
    protected void finish(Session session, InboundEvent event, String text) {
        store.remove(session);
        prompt(session, event, text, null);
    }
}
