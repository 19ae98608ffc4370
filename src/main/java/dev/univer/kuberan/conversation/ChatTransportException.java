package dev.univer.kuberan.conversation;

public class ChatTransportException extends RuntimeException {

    public ChatTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
