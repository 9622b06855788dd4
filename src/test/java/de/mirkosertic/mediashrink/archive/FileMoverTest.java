package de.mirkosertic.mediashrink.archive;

import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("FileMover Tests")
class FileMoverTest {

    @TempDir
    Path tempDir;

    /**
     * Behaves as if source and target were on different filesystems.
     */
    private static final class CrossDeviceMover extends FileMover {

        CrossDeviceMover(final FileFingerprint fingerprint) {
            super(fingerprint);
        }

        @Override
        protected void atomicMove(final Path source, final Path target) throws IOException {
            throw new AtomicMoveNotSupportedException(source.toString(), target.toString(), "cross-device");
        }
    }

    @Test
    @DisplayName("Should move and create missing parent directories")
    void shouldMove() throws IOException {
        // Given
        final Path source = Files.writeString(tempDir.resolve("movie.mkv"), "content");
        final Path target = tempDir.resolve("trash/Movies/movie.mkv");

        // When
        new FileMover(new FileFingerprint()).move(source, target);

        // Then
        assertThat(source).doesNotExist();
        assertThat(target).hasContent("content");
    }

    @Test
    @DisplayName("Should never overwrite an existing target")
    void shouldNotOverwrite() throws IOException {
        final Path source = Files.writeString(tempDir.resolve("a.mkv"), "new");
        final Path target = Files.writeString(tempDir.resolve("b.mkv"), "old");

        assertThatThrownBy(() -> new FileMover(new FileFingerprint()).move(source, target))
                .isInstanceOf(FileAlreadyExistsException.class);
        assertThat(target).hasContent("old");
        assertThat(source).hasContent("new");
    }

    @Test
    @DisplayName("Falls back to copy, verify and delete across filesystems")
    void shouldCopyAcrossFilesystems() throws IOException {
        // Given
        final byte[] content = new byte[200_000];
        for (int i = 0; i < content.length; i++) {
            content[i] = (byte) (i % 251);
        }
        final Path source = Files.write(tempDir.resolve("big.mkv"), content);
        final Path target = tempDir.resolve("nas/big.mkv");

        // When
        new CrossDeviceMover(new FileFingerprint(1024)).move(source, target);

        // Then
        assertThat(source).doesNotExist();
        assertThat(target).hasBinaryContent(content);
        assertThat(target.resolveSibling("big.mkv" + FileMover.PARTIAL_SUFFIX))
                .as("No partial file should remain")
                .doesNotExist();
    }

    @Test
    @DisplayName("Missing source is an error")
    void missingSource() {
        assertThatThrownBy(() -> new FileMover(new FileFingerprint())
                .move(tempDir.resolve("nope.mkv"), tempDir.resolve("target.mkv")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("does not exist");
    }
}
