package dev.univer.kuberan.conversation;

public enum InputKind {
    TEXT,
    BUTTON,
    CANCEL,
    TIMEOUT
}
