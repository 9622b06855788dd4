package de.mirkosertic.mediashrink.scanner;

import de.mirkosertic.mediashrink.encoder.MediaInfo;
import de.mirkosertic.mediashrink.encoder.MediaProbe;
import de.mirkosertic.mediashrink.model.Task;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Three-level change detection for one discovered file.
 * <ol>
 *     <li>L1: stored modification time and size equal the filesystem values and a task exists.
 *     No further I/O.</li>
 *     <li>L2: the head/tail/size fingerprint equals the stored one. Only the stored signals change.</li>
 *     <li>L3: the container comment carries the processed marker. The file is already converted.</li>
 * </ol>
 * Anything else is a new or changed file.
 */
public class ChangeDetector {

    public enum Kind {
        UNCHANGED,
        METADATA_ONLY,
        PROCESSED,
        CHANGED
    }

    /**
     * @param fingerprint null for {@link Kind#UNCHANGED}, where no content was read
     * @param mediaInfo   probe result, only for {@link Kind#PROCESSED} and {@link Kind#CHANGED}
     */
    public record Decision(Kind kind, long modifiedAt, long size, @Nullable String fingerprint,
                           @Nullable MediaInfo mediaInfo) {
    }

    private final FileFingerprint fingerprint;
    private final MediaProbe probe;
    private final String marker;

    public ChangeDetector(final FileFingerprint fingerprint, final MediaProbe probe, final String marker) {
        this.fingerprint = fingerprint;
        this.probe = probe;
        this.marker = marker;
    }

    /**
     * @param existing the task whose file currently lives at {@code file}, if any
     * @throws IOException if the file cannot be read or probed; the caller skips it for this scan
     */
    public Decision evaluate(final Path file, final long modifiedAt, final long size, final @Nullable Task existing)
            throws IOException {
        if (existing != null && existing.fileModifiedAt() == modifiedAt && existing.fileSize() == size) {
            return new Decision(Kind.UNCHANGED, modifiedAt, size, null, null);
        }

        final String currentFingerprint = fingerprint.compute(file);
        if (existing != null && currentFingerprint.equals(existing.fingerprint())) {
            return new Decision(Kind.METADATA_ONLY, modifiedAt, size, currentFingerprint, null);
        }

        final MediaInfo info = probe.probe(file);
        if (info.hasMarker(marker)) {
            return new Decision(Kind.PROCESSED, modifiedAt, size, currentFingerprint, info);
        }
        return new Decision(Kind.CHANGED, modifiedAt, size, currentFingerprint, info);
    }
}
