package dev.univer.kuberan.gateway;

/** The link code was rejected: unknown, already used or expired. */
public class LinkFailedException extends BackendException {
    public LinkFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
