package de.mirkosertic.mediashrink.scanner;

import org.jspecify.annotations.Nullable;

public record ScanProgress(
        boolean scanning,
        ScanPhase phase,
        @Nullable String currentFile,
        long filesFound,
        long filesChecked,
        long tasksCreated,
        long tasksRemoved
) {
}
