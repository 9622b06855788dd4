package de.mirkosertic.mediashrink.recovery;

/**
 * Startup cannot continue because crash leftovers could not be cleaned up.
 */
public class RecoveryException extends Exception {

    public RecoveryException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
