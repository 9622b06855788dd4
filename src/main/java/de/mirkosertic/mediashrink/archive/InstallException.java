package de.mirkosertic.mediashrink.archive;

import org.jspecify.annotations.Nullable;

/**
 * A move during install failed. The filesystem is left as it was after the last successful move.
 */
public class InstallException extends Exception {

    private final @Nullable String archivedPath;

    public InstallException(final String message, final @Nullable String archivedPath) {
        super(message);
        this.archivedPath = archivedPath;
    }

    /**
     * Where the original went if the first move succeeded, null otherwise.
     */
    public @Nullable String getArchivedPath() {
        return archivedPath;
    }
}
