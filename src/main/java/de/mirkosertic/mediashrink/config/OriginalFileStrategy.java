package de.mirkosertic.mediashrink.config;

/**
 * Where install moves the original file.
 */
public enum OriginalFileStrategy {
    /** The trash area below the temp directory. */
    TRASH,
    /** A user-chosen archive directory. */
    ARCHIVE
}
