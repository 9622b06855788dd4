package de.mirkosertic.mediashrink.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal for the active task. Callbacks registered with {@link #onCancel}
 * run once the token is cancelled, or immediately if it already is.
 */
public class CancellationToken {

    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    /**
     * @return true if this call cancelled the token, false if it was cancelled before
     */
    public boolean cancel(final String cancelReason) {
        if (!reason.compareAndSet(null, cancelReason)) {
            return false;
        }
        for (final Runnable callback : callbacks) {
            runSafely(callback);
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    /**
     * Registers a callback. Callbacks must tolerate running twice when registration races a cancel.
     */
    public Registration onCancel(final Runnable callback) {
        callbacks.add(callback);
        if (isCancelled()) {
            runSafely(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private static void runSafely(final Runnable callback) {
        try {
            callback.run();
        } catch (final RuntimeException e) {
            logger.warn("Cancellation callback failed", e);
        }
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
