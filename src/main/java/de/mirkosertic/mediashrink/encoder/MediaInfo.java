package de.mirkosertic.mediashrink.encoder;

import org.jspecify.annotations.Nullable;

/**
 * What the probe tool reports about a media file.
 *
 * @param durationSeconds container duration, 0 if unknown
 * @param comment         container-level comment tag, where the processed marker lives
 */
public record MediaInfo(
        double durationSeconds,
        int videoStreams,
        int audioStreams,
        int subtitleStreams,
        @Nullable String comment
) {

    public boolean hasVideoStream() {
        return videoStreams > 0;
    }

    public boolean hasMarker(final String marker) {
        return comment != null && comment.contains(marker);
    }
}
