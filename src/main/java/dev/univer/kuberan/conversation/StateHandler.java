package dev.univer.kuberan.conversation;

@FunctionalInterface
public interface StateHandler {

    void handle(Session session, InboundEvent event);
}
