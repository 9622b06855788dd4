package de.mirkosertic.mediashrink.scanner;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Cheap content signature from the leading bytes, the trailing bytes and the total size of a file.
 * Tolerates metadata-only changes such as a copy that resets the modification time.
 */
public class FileFingerprint {

    public static final int DEFAULT_SAMPLE_BYTES = 64 * 1024;

    private final int sampleBytes;

    public FileFingerprint() {
        this(DEFAULT_SAMPLE_BYTES);
    }

    public FileFingerprint(final int sampleBytes) {
        if (sampleBytes <= 0) {
            throw new IllegalArgumentException("sampleBytes must be positive: " + sampleBytes);
        }
        this.sampleBytes = sampleBytes;
    }

    public String compute(final Path file) throws IOException {
        try (final SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            final long size = channel.size();
            final Hasher hasher = Hashing.murmur3_128().newHasher();
            hasher.putLong(size);

            final int headLength = (int) Math.min(size, sampleBytes);
            hasher.putBytes(read(channel, 0, headLength));

            if (size > sampleBytes) {
                // Tail never overlaps the head
                final long tailStart = Math.max(sampleBytes, size - sampleBytes);
                hasher.putBytes(read(channel, tailStart, (int) (size - tailStart)));
            }
            return hasher.hash().toString();
        }
    }

    private static ByteBuffer read(final SeekableByteChannel channel, final long position, final int length)
            throws IOException {
        final ByteBuffer buffer = ByteBuffer.allocate(length);
        channel.position(position);
        while (buffer.hasRemaining()) {
            if (channel.read(buffer) < 0) {
                break;
            }
        }
        buffer.flip();
        return buffer;
    }
}
