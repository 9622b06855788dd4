package de.mirkosertic.mediashrink.encoder;

/**
 * Result of one encoder run.
 *
 * @param stderrTail last part of the encoder's diagnostics, empty on success
 */
public record EncodeOutcome(Status status, int exitCode, String message, String stderrTail) {

    public enum Status {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    public static EncodeOutcome success() {
        return new EncodeOutcome(Status.SUCCESS, 0, "Encode finished", "");
    }

    public static EncodeOutcome failed(final int exitCode, final String message, final String stderrTail) {
        return new EncodeOutcome(Status.FAILED, exitCode, message, stderrTail);
    }

    public static EncodeOutcome cancelled(final String reason) {
        return new EncodeOutcome(Status.CANCELLED, -1, reason, "");
    }

    /**
     * Message plus diagnostics as stored on a failed task.
     */
    public String describe() {
        if (stderrTail == null || stderrTail.isBlank()) {
            return message;
        }
        return message + "\n" + stderrTail;
    }
}
