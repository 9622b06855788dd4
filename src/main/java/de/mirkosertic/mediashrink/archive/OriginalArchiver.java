package de.mirkosertic.mediashrink.archive;

import de.mirkosertic.mediashrink.config.OriginalFileStrategy;
import de.mirkosertic.mediashrink.config.RuntimeSettings;
import de.mirkosertic.mediashrink.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Path-preserving install and rollback.
 * <p>
 * Install moves the original to {@code base/relativePath} (base being the trash area or the archive
 * directory) and then the encoded output to the source location. If the archive destination is taken
 * by a file from an earlier run, a numeric suffix is added ({@code movie.1.mkv}, {@code movie.2.mkv}, ...);
 * nothing is ever overwritten.
 */
public class OriginalArchiver {

    private static final Logger logger = LoggerFactory.getLogger(OriginalArchiver.class);

    private static final String SET_ASIDE_SUFFIX = ".rollback";

    private final FileMover mover;
    private final Path trashDir;

    public OriginalArchiver(final FileMover mover, final Path trashDir) {
        this.mover = mover;
        this.trashDir = trashDir;
    }

    public Path baseDirectory(final RuntimeSettings settings) {
        if (settings.originalFileStrategy() == OriginalFileStrategy.ARCHIVE && settings.archivePath() != null) {
            return settings.archivePath();
        }
        return trashDir;
    }

    /**
     * Archives the original and puts the encoded output in its place. Only the first failing move is
     * reported; the other one is not attempted.
     *
     * @param installTarget where the output goes, the source path or the source path with the output extension
     */
    public InstallResult install(final Task task, final Path encodedOutput, final Path installTarget,
                                 final RuntimeSettings settings) throws InstallException {
        final Path source = Paths.get(task.sourcePath());
        if (!Files.exists(source)) {
            throw new InstallException("Source file disappeared before install: " + source, null);
        }
        if (!Files.exists(encodedOutput)) {
            throw new InstallException("Encoded output is missing: " + encodedOutput, null);
        }
        if (!installTarget.equals(source) && Files.exists(installTarget)) {
            throw new InstallException("Install target is already occupied by another file: " + installTarget, null);
        }

        final Path archived;
        try {
            archived = uniqueDestination(baseDirectory(settings), task.relativePath());
            mover.move(source, archived);
        } catch (final IOException e) {
            throw new InstallException("Could not move original " + source + " to the archive: " + e.getMessage(),
                    null);
        }

        try {
            mover.move(encodedOutput, installTarget);
        } catch (final IOException e) {
            throw new InstallException("Original was moved to " + archived + " but the encoded output "
                    + encodedOutput + " could not be moved to " + installTarget + ": " + e.getMessage()
                    + ". Resolve manually.", archived.toString());
        }

        logger.info("Installed {} (original archived at {})", installTarget, archived);
        return new InstallResult(archived, installTarget);
    }

    /**
     * Restores the archived original to the source path and removes the installed output.
     *
     * @throws RollbackException if the archived original is gone or the source path is taken;
     *                           the filesystem is unchanged in that case
     */
    public void rollback(final Task task) throws RollbackException {
        if (task.archivedPath() == null) {
            throw new RollbackException("Task " + task.id() + " has no archived original");
        }
        final Path archived = Paths.get(task.archivedPath());
        if (!Files.isRegularFile(archived)) {
            throw new RollbackException("Archived original no longer exists: " + archived);
        }

        final Path source = Paths.get(task.sourcePath());
        final Path installed = Paths.get(task.installedPath() != null ? task.installedPath() : task.sourcePath());
        if (!installed.equals(source) && Files.exists(source)) {
            throw new RollbackException("Source path is occupied by another file: " + source);
        }

        Path setAside = null;
        try {
            if (Files.exists(installed)) {
                setAside = installed.resolveSibling(installed.getFileName() + SET_ASIDE_SUFFIX);
                Files.deleteIfExists(setAside);
                Files.move(installed, setAside);
            }
            mover.move(archived, source);
        } catch (final IOException e) {
            restore(setAside, installed);
            throw new RollbackException("Could not restore " + archived + " to " + source + ": " + e.getMessage(), e);
        }

        if (setAside != null) {
            try {
                Files.delete(setAside);
            } catch (final IOException e) {
                logger.warn("Rolled back task {} but could not delete the replaced output {}", task.id(), setAside, e);
            }
        }
        logger.info("Rolled back {} from {}", source, archived);
    }

    private static void restore(final Path setAside, final Path installed) {
        if (setAside == null || !Files.exists(setAside)) {
            return;
        }
        try {
            Files.move(setAside, installed);
        } catch (final IOException e) {
            logger.error("Could not restore {} to {}, the encoded output remains at the former path",
                    setAside, installed, e);
        }
    }

    /**
     * {@code base/relativePath}, or the first free {@code name.N.ext} sibling of it.
     *
     * @throws IOException if the relative path escapes the base directory
     */
    Path uniqueDestination(final Path base, final String relativePath) throws IOException {
        final Path normalizedBase = base.toAbsolutePath().normalize();
        final Path destination = normalizedBase.resolve(relativePath).normalize();
        if (!destination.startsWith(normalizedBase) || destination.equals(normalizedBase)) {
            throw new IOException("Relative path escapes the archive directory: " + relativePath);
        }
        if (!Files.exists(destination)) {
            return destination;
        }

        final String fileName = destination.getFileName().toString();
        final int dot = fileName.lastIndexOf('.');
        final String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        final String extension = dot > 0 ? fileName.substring(dot) : "";
        for (int version = 1; version < 10_000; version++) {
            final Path candidate = destination.resolveSibling(stem + "." + version + extension);
            if (!Files.exists(candidate)) {
                logger.info("Archive destination {} exists, using {}", destination, candidate);
                return candidate;
            }
        }
        throw new IOException("No free archive name for " + destination);
    }
}
