package de.mirkosertic.mediashrink.archive;

public record ArchivedFile(String relativePath, String name, long size, long modifiedAt) {
}
