package de.mirkosertic.mediashrink.api.dto;

import de.mirkosertic.mediashrink.archive.ArchiveListing;
import de.mirkosertic.mediashrink.archive.ArchivedFile;

import java.util.List;

/**
 * Contents of the trash or the archive directory.
 */
public record ArchiveListingResponse(
        boolean success,
        String baseDirectory,
        List<ArchivedFile> files,
        Long totalFiles,
        Long totalBytes,
        String error
) {
    public static ArchiveListingResponse success(final ArchiveListing listing) {
        return new ArchiveListingResponse(true, listing.baseDirectory(), listing.files(), listing.totalFiles(),
                listing.totalBytes(), null);
    }

    public static ArchiveListingResponse error(final String errorMessage) {
        return new ArchiveListingResponse(false, null, null, null, null, errorMessage);
    }
}
