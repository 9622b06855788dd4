package de.mirkosertic.mediashrink.queue;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalLong;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory queue control shared by the worker and the user-facing operations: the paused flag, the
 * active task with its cancellation token, and the signal queue the worker waits on.
 * Nothing here is persisted; a restart begins with the {@code start-paused} setting.
 */
public class QueueController {

    private static final Logger logger = LoggerFactory.getLogger(QueueController.class);

    public enum Signal {
        WAKE_UP,
        SHUTDOWN
    }

    static final String SHUTDOWN_REASON = "Interrupted by shutdown";

    private record ActiveTask(long taskId, CancellationToken token) {
    }

    private final AtomicBoolean paused;
    private final AtomicReference<ActiveTask> active = new AtomicReference<>();
    private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();

    public QueueController(final boolean startPaused) {
        this.paused = new AtomicBoolean(startPaused);
    }

    public boolean isPaused() {
        return paused.get();
    }

    /**
     * Stops the worker from taking new tasks. With {@code immediate} the active task is cancelled as well.
     *
     * @return true if an active task was interrupted
     */
    public boolean pause(final boolean immediate) {
        paused.set(true);
        logger.info("Queue paused{}", immediate ? " (immediate)" : "");
        if (!immediate) {
            return false;
        }
        final ActiveTask current = active.get();
        return current != null && current.token().cancel("Interrupted by immediate pause");
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            logger.info("Queue resumed");
        }
        signal();
    }

    /**
     * Cancels the task if it is the active one.
     *
     * @return false if the task is not active or was already cancelled
     */
    public boolean cancel(final long taskId, final String reason) {
        final ActiveTask current = active.get();
        if (current == null || current.taskId() != taskId) {
            return false;
        }
        return current.token().cancel(reason);
    }

    public OptionalLong activeTaskId() {
        final ActiveTask current = active.get();
        return current == null ? OptionalLong.empty() : OptionalLong.of(current.taskId());
    }

    /**
     * Called by the worker before it moves a task out of PENDING.
     */
    CancellationToken activate(final long taskId) {
        final CancellationToken token = new CancellationToken();
        if (!active.compareAndSet(null, new ActiveTask(taskId, token))) {
            throw new IllegalStateException("Task " + active.get().taskId() + " is still active");
        }
        return token;
    }

    void deactivate(final long taskId) {
        active.updateAndGet(current -> current != null && current.taskId() == taskId ? null : current);
    }

    /**
     * Wakes the worker, e.g. after a retry or a scan added work.
     */
    public void signal() {
        signals.offer(Signal.WAKE_UP);
    }

    void shutdown() {
        signals.offer(Signal.SHUTDOWN);
        final ActiveTask current = active.get();
        if (current != null) {
            current.token().cancel(SHUTDOWN_REASON);
        }
    }

    /**
     * @return the next signal, or null after the timeout
     */
    @Nullable Signal awaitSignal(final long timeoutMs) throws InterruptedException {
        return signals.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }
}
