package dev.univer.kuberan.gateway;

/** The Kuberan API could not be reached or answered with an error. */
public class BackendException extends RuntimeException {
    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
