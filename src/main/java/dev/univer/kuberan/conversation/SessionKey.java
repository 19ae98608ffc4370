package dev.univer.kuberan.conversation;

public record SessionKey(long chatId, long userId, FlowFamily family) {

    public static SessionKey of(ChatUser who, FlowFamily family) {
        return new SessionKey(who.chatId(), who.userId(), family);
    }

    public ChatUser chatUser() {
        return new ChatUser(chatId, userId);
    }
}
