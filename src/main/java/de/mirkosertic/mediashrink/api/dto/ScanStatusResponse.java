package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.scanner.ScanProgress;

public record ScanStatusResponse(
        boolean success,
        boolean scanning,
        String phase,
        String currentFile,
        long filesFound,
        long filesChecked,
        long tasksCreated,
        long tasksRemoved,
        String error
) {
    public static ScanStatusResponse from(final ScanProgress progress) {
        return new ScanStatusResponse(true, progress.scanning(), progress.phase().name(), progress.currentFile(),
                progress.filesFound(), progress.filesChecked(), progress.tasksCreated(), progress.tasksRemoved(),
                null);
    }
}
