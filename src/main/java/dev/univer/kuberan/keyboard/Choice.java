package dev.univer.kuberan.keyboard;

/** One button: what the user sees and the payload that comes back when it is pressed. */
public record Choice(String label, String payload) {}
