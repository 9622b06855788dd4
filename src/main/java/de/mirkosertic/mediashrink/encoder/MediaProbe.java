package de.mirkosertic.mediashrink.encoder;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads container metadata of a media file.
 */
public interface MediaProbe {

    /**
     * @throws IOException if the file cannot be probed, e.g. because it is not a media file
     */
    MediaInfo probe(Path file) throws IOException;
}
