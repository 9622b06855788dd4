package de.mirkosertic.mediashrink.archive;

/**
 * @param failedFiles files that could not be deleted and are still in the trash
 */
public record EmptyTrashResult(long deletedFiles, long freedBytes, long failedFiles) {
}
