package de.mirkosertic.mediashrink.encoder;

/**
 * The encoder exited unsuccessfully or reported a stream it could not copy.
 */
public class TranscodeException extends Exception {

    private final String stderrTail;

    public TranscodeException(final String message, final String stderrTail) {
        super(message);
        this.stderrTail = stderrTail;
    }

    public String getStderrTail() {
        return stderrTail;
    }
}
