package de.mirkosertic.mediashrink.encoder;

/**
 * One block of encoder progress output.
 *
 * @param outTimeMicros encoded media time so far
 * @param speed         encode speed as a multiple of real time, 0 while unknown
 * @param finished      true for the final block
 */
public record ProgressEvent(long frame, double fps, double speed, long outTimeMicros, boolean finished) {

    public double outTimeSeconds() {
        return outTimeMicros / 1_000_000.0;
    }
}
