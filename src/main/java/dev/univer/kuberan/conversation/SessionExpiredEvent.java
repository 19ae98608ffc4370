package dev.univer.kuberan.conversation;

public record SessionExpiredEvent(Session session) {
}
