package de.mirkosertic.mediashrink.scanner;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters of the running scan. Thread-safe; the scan thread writes, any thread reads a snapshot.
 */
public class ScanProgressTracker {

    private volatile boolean scanning;
    private volatile ScanPhase phase = ScanPhase.IDLE;
    private volatile String currentFile;
    private volatile long startTime;

    private final AtomicLong filesFound = new AtomicLong();
    private final AtomicLong filesChecked = new AtomicLong();
    private final AtomicLong skippedUnchanged = new AtomicLong();
    private final AtomicLong tasksCreated = new AtomicLong();
    private final AtomicLong tasksRemoved = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksRefreshed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public void start() {
        filesFound.set(0);
        filesChecked.set(0);
        skippedUnchanged.set(0);
        tasksCreated.set(0);
        tasksRemoved.set(0);
        tasksCompleted.set(0);
        tasksRefreshed.set(0);
        errors.set(0);
        currentFile = null;
        startTime = System.currentTimeMillis();
        phase = ScanPhase.IDLE;
        scanning = true;
    }

    public void phase(final ScanPhase newPhase) {
        this.phase = newPhase;
        this.currentFile = null;
    }

    public void currentFile(final String file) {
        this.currentFile = file;
    }

    public void fileFound() {
        filesFound.incrementAndGet();
    }

    public void fileChecked() {
        filesChecked.incrementAndGet();
    }

    public void skippedUnchanged() {
        skippedUnchanged.incrementAndGet();
    }

    public void taskCreated() {
        tasksCreated.incrementAndGet();
    }

    public void taskRemoved() {
        tasksRemoved.incrementAndGet();
    }

    public void taskCompleted() {
        tasksCompleted.incrementAndGet();
    }

    public void taskRefreshed() {
        tasksRefreshed.incrementAndGet();
    }

    public void error() {
        errors.incrementAndGet();
    }

    public ScanResult finish() {
        scanning = false;
        phase = ScanPhase.IDLE;
        currentFile = null;
        return new ScanResult(
                filesFound.get(),
                filesChecked.get(),
                skippedUnchanged.get(),
                tasksCreated.get(),
                tasksRemoved.get(),
                tasksCompleted.get(),
                tasksRefreshed.get(),
                errors.get(),
                System.currentTimeMillis() - startTime
        );
    }

    public ScanProgress snapshot() {
        return new ScanProgress(scanning, phase, currentFile, filesFound.get(), filesChecked.get(),
                tasksCreated.get(), tasksRemoved.get());
    }
}
