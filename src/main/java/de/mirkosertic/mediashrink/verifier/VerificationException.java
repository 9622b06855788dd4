package de.mirkosertic.mediashrink.verifier;

public class VerificationException extends Exception {

    public VerificationException(final String message) {
        super(message);
    }
}
