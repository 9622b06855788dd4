package de.mirkosertic.mediashrink.archive;

/**
 * A rollback was refused; the task and the filesystem are unchanged.
 */
public class RollbackException extends Exception {

    public RollbackException(final String message) {
        super(message);
    }

    public RollbackException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
