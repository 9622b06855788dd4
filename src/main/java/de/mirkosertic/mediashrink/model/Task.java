package de.mirkosertic.mediashrink.model;

import org.jspecify.annotations.Nullable;

/**
 * One video file's journey through the pipeline.
 *
 * @param sourcePath       absolute path of the file as discovered by the scanner
 * @param relativePath     path below the source root, mirrored into the processing, trash and archive areas
 * @param queuePosition    FIFO key among PENDING tasks, reassigned on retry
 * @param fileModifiedAt   last seen modification time of the file currently at {@link #currentPath()}
 * @param fileSize         last seen size of that file
 * @param fingerprint      head/tail/size fingerprint of that file, null until computed
 * @param archivedPath     where install moved the original, null unless installed
 * @param installedPath    where install placed the encoded output, null unless installed
 */
public record Task(
        long id,
        String sourcePath,
        String relativePath,
        TaskStatus status,
        long originalSize,
        @Nullable Long newSize,
        double originalDuration,
        @Nullable Double newDuration,
        @Nullable String errorMessage,
        long createdAt,
        long updatedAt,
        long queuePosition,
        long fileModifiedAt,
        long fileSize,
        @Nullable String fingerprint,
        @Nullable String archivedPath,
        @Nullable String installedPath
) {

    /**
     * The path where this task's file lives right now. After install the encoded output may carry a
     * different extension than the source.
     */
    public String currentPath() {
        if (status == TaskStatus.COMPLETED && installedPath != null) {
            return installedPath;
        }
        return sourcePath;
    }

    public long savedBytes() {
        return newSize == null ? 0 : originalSize - newSize;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder builder(final String sourcePath, final String relativePath) {
        return new Builder(sourcePath, relativePath);
    }

    public static final class Builder {

        private long id;
        private final String sourcePath;
        private final String relativePath;
        private TaskStatus status = TaskStatus.PENDING;
        private long originalSize;
        private Long newSize;
        private double originalDuration;
        private Double newDuration;
        private String errorMessage;
        private long createdAt;
        private long updatedAt;
        private long queuePosition;
        private long fileModifiedAt;
        private long fileSize;
        private String fingerprint;
        private String archivedPath;
        private String installedPath;

        private Builder(final String sourcePath, final String relativePath) {
            this.sourcePath = sourcePath;
            this.relativePath = relativePath;
        }

        private Builder(final Task task) {
            this.id = task.id;
            this.sourcePath = task.sourcePath;
            this.relativePath = task.relativePath;
            this.status = task.status;
            this.originalSize = task.originalSize;
            this.newSize = task.newSize;
            this.originalDuration = task.originalDuration;
            this.newDuration = task.newDuration;
            this.errorMessage = task.errorMessage;
            this.createdAt = task.createdAt;
            this.updatedAt = task.updatedAt;
            this.queuePosition = task.queuePosition;
            this.fileModifiedAt = task.fileModifiedAt;
            this.fileSize = task.fileSize;
            this.fingerprint = task.fingerprint;
            this.archivedPath = task.archivedPath;
            this.installedPath = task.installedPath;
        }

        public Builder id(final long id) {
            this.id = id;
            return this;
        }

        public Builder status(final TaskStatus status) {
            this.status = status;
            return this;
        }

        public TaskStatus status() {
            return status;
        }

        public Builder originalSize(final long originalSize) {
            this.originalSize = originalSize;
            return this;
        }

        public Builder newSize(final @Nullable Long newSize) {
            this.newSize = newSize;
            return this;
        }

        public Builder originalDuration(final double originalDuration) {
            this.originalDuration = originalDuration;
            return this;
        }

        public Builder newDuration(final @Nullable Double newDuration) {
            this.newDuration = newDuration;
            return this;
        }

        public Builder errorMessage(final @Nullable String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Builder createdAt(final long createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(final long updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder queuePosition(final long queuePosition) {
            this.queuePosition = queuePosition;
            return this;
        }

        public Builder fileSignals(final long modifiedAt, final long size, final @Nullable String fingerprint) {
            this.fileModifiedAt = modifiedAt;
            this.fileSize = size;
            this.fingerprint = fingerprint;
            return this;
        }

        public Builder archivedPath(final @Nullable String archivedPath) {
            this.archivedPath = archivedPath;
            return this;
        }

        public Builder installedPath(final @Nullable String installedPath) {
            this.installedPath = installedPath;
            return this;
        }

        public Task build() {
            return new Task(id, sourcePath, relativePath, status, originalSize, newSize, originalDuration,
                    newDuration, errorMessage, createdAt, updatedAt, queuePosition, fileModifiedAt, fileSize,
                    fingerprint, archivedPath, installedPath);
        }
    }
}
