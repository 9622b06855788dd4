package de.mirkosertic.mediashrink.encoder;

import de.mirkosertic.mediashrink.queue.CancellationToken;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * Runs one encode to completion, failure or cancellation.
 */
public interface Encoder {

    /**
     * Blocks until the encoder has exited. A cancelled or failed run leaves no output file behind.
     *
     * @param progressListener receives progress events on the calling thread
     * @throws IOException if the encoder cannot be started or its output cannot be cleaned up
     */
    EncodeOutcome encode(EncodeRequest request, CancellationToken token, Consumer<ProgressEvent> progressListener)
            throws IOException;
}
