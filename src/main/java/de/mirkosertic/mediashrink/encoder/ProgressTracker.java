package de.mirkosertic.mediashrink.encoder;

import de.mirkosertic.mediashrink.model.CurrentProgress;
import de.mirkosertic.mediashrink.model.TaskStatus;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the in-memory {@link CurrentProgress} of the active task. Written by the worker, polled by readers.
 */
public class ProgressTracker {

    private final AtomicReference<CurrentProgress> current = new AtomicReference<>(CurrentProgress.IDLE);

    public CurrentProgress current() {
        return current.get();
    }

    public void begin(final long taskId, final TaskStatus status) {
        current.set(new CurrentProgress(taskId, status, 0, 0, 0, null));
    }

    public void stage(final TaskStatus status) {
        current.updateAndGet(progress -> progress.withStatus(status));
    }

    public void update(final long taskId, final ProgressEvent event, final double originalDurationSeconds) {
        current.set(compute(taskId, event, originalDurationSeconds));
    }

    public void clear() {
        current.set(CurrentProgress.IDLE);
    }

    /**
     * Completion is encoded time over source duration clamped to [0,1]. The remaining time is
     * only known while the encoder reports a positive speed.
     */
    static CurrentProgress compute(final long taskId, final ProgressEvent event, final double durationSeconds) {
        final double encoded = event.outTimeSeconds();
        final double fraction;
        final Double eta;
        if (durationSeconds > 0) {
            fraction = Math.max(0.0, Math.min(1.0, encoded / durationSeconds));
            eta = event.speed() > 0 ? Math.max(0.0, durationSeconds - encoded) / event.speed() : null;
        } else {
            fraction = 0.0;
            eta = null;
        }
        return new CurrentProgress(taskId, TaskStatus.TRANSCODING, event.fps(), event.speed(),
                event.finished() ? 1.0 : fraction, event.finished() ? Double.valueOf(0.0) : eta);
    }
}
