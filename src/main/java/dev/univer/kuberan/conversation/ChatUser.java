package dev.univer.kuberan.conversation;

/** One user in one chat. Events for the same pair are handled one at a time. */
public record ChatUser(long chatId, long userId) {
}
