package de.mirkosertic.mediashrink.archive;

import de.mirkosertic.mediashrink.scanner.FileFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves files without ever overwriting the target.
 * <p>
 * Within one filesystem this is an atomic rename. Across filesystems (NAS mounts, separate volumes)
 * the file is copied to a {@code .partial} sibling of the target, checked against size and fingerprint,
 * renamed into place and only then deleted at the source.
 */
public class FileMover {

    private static final Logger logger = LoggerFactory.getLogger(FileMover.class);

    static final String PARTIAL_SUFFIX = ".partial";

    private final FileFingerprint fingerprint;

    public FileMover(final FileFingerprint fingerprint) {
        this.fingerprint = fingerprint;
    }

    /**
     * @throws FileAlreadyExistsException if the target exists
     * @throws IOException                if any step fails; a failed copy leaves no partial file behind
     */
    public void move(final Path source, final Path target) throws IOException {
        if (!Files.exists(source)) {
            throw new IOException("Source does not exist: " + source);
        }
        if (Files.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        final Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        try {
            atomicMove(source, target);
            logger.debug("Moved {} -> {}", source, target);
            return;
        } catch (final AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not possible from {} to {}, copying", source, target);
        }
        copyVerifyDelete(source, target);
    }

    /**
     * Same-filesystem rename. Throws {@link AtomicMoveNotSupportedException} across filesystems.
     */
    protected void atomicMove(final Path source, final Path target) throws IOException {
        Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    }

    private void copyVerifyDelete(final Path source, final Path target) throws IOException {
        final Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        try {
            Files.deleteIfExists(partial);
            Files.copy(source, partial, StandardCopyOption.COPY_ATTRIBUTES);

            final long sourceSize = Files.size(source);
            final long copySize = Files.size(partial);
            if (sourceSize != copySize) {
                throw new IOException("Copy of " + source + " has " + copySize + " bytes, expected " + sourceSize);
            }
            if (!fingerprint.compute(source).equals(fingerprint.compute(partial))) {
                throw new IOException("Copy of " + source + " does not match the source content");
            }
            Files.move(partial, target);
        } catch (final IOException e) {
            try {
                Files.deleteIfExists(partial);
            } catch (final IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        try {
            Files.delete(source);
        } catch (final IOException e) {
            throw new IOException("Copied " + source + " to " + target
                    + " but could not delete the source, both copies exist", e);
        }
        logger.debug("Copied and removed {} -> {}", source, target);
    }
}
