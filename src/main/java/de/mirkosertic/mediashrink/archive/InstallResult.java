package de.mirkosertic.mediashrink.archive;

import java.nio.file.Path;

public record InstallResult(Path archivedPath, Path installedPath) {
}
