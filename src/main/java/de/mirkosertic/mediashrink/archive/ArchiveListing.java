package de.mirkosertic.mediashrink.archive;

import java.util.List;

public record ArchiveListing(String baseDirectory, List<ArchivedFile> files, long totalFiles, long totalBytes) {
}
