package de.mirkosertic.mediashrink.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lists the trash and archive areas and empties the trash.
 * Emptying the trash makes rollback impossible for every task whose original was there.
 */
public class TrashService {

    private static final Logger logger = LoggerFactory.getLogger(TrashService.class);

    private final Path trashDir;

    public TrashService(final Path trashDir) {
        this.trashDir = trashDir;
    }

    public ArchiveListing listTrash() throws IOException {
        return list(trashDir);
    }

    /**
     * Every regular file below {@code base}, ordered by relative path.
     */
    public ArchiveListing list(final Path base) throws IOException {
        final List<ArchivedFile> files = new ArrayList<>();
        if (Files.isDirectory(base)) {
            Files.walkFileTree(base, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (attrs.isRegularFile()) {
                        files.add(new ArchivedFile(
                                base.relativize(file).toString(),
                                file.getFileName().toString(),
                                attrs.size(),
                                attrs.lastModifiedTime().toMillis()));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                    logger.warn("Cannot read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        files.sort(Comparator.comparing(ArchivedFile::relativePath));
        final long totalBytes = files.stream().mapToLong(ArchivedFile::size).sum();
        return new ArchiveListing(base.toString(), files, files.size(), totalBytes);
    }

    /**
     * Deletes everything below the trash directory, keeping the directory itself.
     * Files that cannot be deleted are logged and counted, the rest is still removed.
     */
    public EmptyTrashResult emptyTrash() throws IOException {
        if (!Files.isDirectory(trashDir)) {
            return new EmptyTrashResult(0, 0, 0);
        }

        final AtomicLong deleted = new AtomicLong();
        final AtomicLong freed = new AtomicLong();
        final AtomicLong failed = new AtomicLong();

        Files.walkFileTree(trashDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                try {
                    Files.delete(file);
                    deleted.incrementAndGet();
                    freed.addAndGet(attrs.size());
                } catch (final IOException e) {
                    failed.incrementAndGet();
                    logger.warn("Could not delete {} from trash: {}", file, e.getMessage());
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(final Path file, final IOException exc) {
                failed.incrementAndGet();
                logger.warn("Cannot access {} in trash: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) {
                if (!dir.equals(trashDir)) {
                    try {
                        Files.delete(dir);
                    } catch (final IOException e) {
                        logger.debug("Keeping non-empty trash directory {}", dir);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });

        logger.info("Emptied trash: {} files deleted, {} bytes freed, {} failed", deleted.get(), freed.get(),
                failed.get());
        return new EmptyTrashResult(deleted.get(), freed.get(), failed.get());
    }

    public Path getTrashDir() {
        return trashDir;
    }
}
