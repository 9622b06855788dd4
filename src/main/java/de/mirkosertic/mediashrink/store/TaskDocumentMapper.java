package de.mirkosertic.mediashrink.store;

import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.model.TaskStatus;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.NumericDocValuesField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;

import java.util.regex.Pattern;

/**
 * Maps tasks, task log entries and the stats aggregate to Lucene documents and back.
 * All three live in one index and are told apart by {@link #DOC_TYPE}.
 */
public class TaskDocumentMapper {

    /**
     * Schema version of the task index.
     * Stored in commit user data and compared on startup.
     * <p>
     * Version 1: Tasks, logs and stats in one index, keyed by {@code doc_id}.
     */
    public static final int SCHEMA_VERSION = 1;

    public static final String DOC_ID = "doc_id";
    public static final String DOC_TYPE = "doc_type";

    public static final String TYPE_TASK = "task";
    public static final String TYPE_LOG = "log";
    public static final String TYPE_STATS = "stats";

    // Task fields
    public static final String TASK_ID = "task_id";
    public static final String TASK_ID_SORT = "task_id_sort";
    public static final String SOURCE_PATH = "source_path";
    public static final String CURRENT_PATH = "current_path";
    public static final String RELATIVE_PATH = "relative_path";
    public static final String PATH_TEXT = "path_text";
    public static final String STATUS = "status";
    public static final String ORIGINAL_SIZE = "original_size";
    public static final String NEW_SIZE = "new_size";
    public static final String ORIGINAL_DURATION = "original_duration";
    public static final String NEW_DURATION = "new_duration";
    public static final String ERROR_MESSAGE = "error_message";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String QUEUE_POSITION = "queue_position";
    public static final String QUEUE_POSITION_SORT = "queue_position_sort";
    public static final String FILE_MODIFIED_AT = "file_modified_at";
    public static final String FILE_SIZE = "file_size";
    public static final String FINGERPRINT = "fingerprint";
    public static final String ARCHIVED_PATH = "archived_path";
    public static final String INSTALLED_PATH = "installed_path";

    // Log fields
    public static final String LOG_TASK_ID = "log_task_id";
    public static final String LOG_SEQUENCE = "log_sequence";
    public static final String LOG_SEQUENCE_SORT = "log_sequence_sort";
    public static final String LOG_TIMESTAMP = "log_timestamp";
    public static final String LOG_LEVEL = "log_level";
    public static final String LOG_MESSAGE = "log_message";

    // Stats fields
    public static final String STATS_SAVED_BYTES = "stats_saved_bytes";
    public static final String STATS_PROCESSED_FILES = "stats_processed_files";

    private static final String STATS_KEY = "stats";
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    public Document toDocument(final Task task) {
        final Document doc = new Document();
        doc.add(new StringField(DOC_ID, taskKey(task.id()).text(), Field.Store.YES));
        doc.add(new StringField(DOC_TYPE, TYPE_TASK, Field.Store.NO));

        doc.add(new StoredField(TASK_ID, task.id()));
        doc.add(new NumericDocValuesField(TASK_ID_SORT, task.id()));

        // Exact lookups go through the StringFields, free text search through path_text
        doc.add(new StringField(SOURCE_PATH, task.sourcePath(), Field.Store.YES));
        doc.add(new StringField(CURRENT_PATH, task.currentPath(), Field.Store.NO));
        doc.add(new StoredField(RELATIVE_PATH, task.relativePath()));
        doc.add(new TextField(PATH_TEXT, pathText(task.relativePath()), Field.Store.NO));

        doc.add(new StringField(STATUS, task.status().name(), Field.Store.YES));

        doc.add(new StoredField(ORIGINAL_SIZE, task.originalSize()));
        if (task.newSize() != null) {
            doc.add(new StoredField(NEW_SIZE, task.newSize()));
        }
        doc.add(new StoredField(ORIGINAL_DURATION, task.originalDuration()));
        if (task.newDuration() != null) {
            doc.add(new StoredField(NEW_DURATION, task.newDuration()));
        }
        if (task.errorMessage() != null) {
            doc.add(new StoredField(ERROR_MESSAGE, task.errorMessage()));
        }

        doc.add(new StoredField(CREATED_AT, task.createdAt()));
        doc.add(new StoredField(UPDATED_AT, task.updatedAt()));
        doc.add(new StoredField(QUEUE_POSITION, task.queuePosition()));
        doc.add(new NumericDocValuesField(QUEUE_POSITION_SORT, task.queuePosition()));

        doc.add(new StoredField(FILE_MODIFIED_AT, task.fileModifiedAt()));
        doc.add(new StoredField(FILE_SIZE, task.fileSize()));
        if (task.fingerprint() != null) {
            doc.add(new StoredField(FINGERPRINT, task.fingerprint()));
        }
        if (task.archivedPath() != null) {
            doc.add(new StoredField(ARCHIVED_PATH, task.archivedPath()));
        }
        if (task.installedPath() != null) {
            doc.add(new StoredField(INSTALLED_PATH, task.installedPath()));
        }
        return doc;
    }

    public Task toTask(final Document doc) {
        return new Task(
                longValue(doc, TASK_ID),
                doc.get(SOURCE_PATH),
                doc.get(RELATIVE_PATH),
                TaskStatus.valueOf(doc.get(STATUS)),
                longValue(doc, ORIGINAL_SIZE),
                optionalLong(doc, NEW_SIZE),
                doubleValue(doc, ORIGINAL_DURATION),
                optionalDouble(doc, NEW_DURATION),
                doc.get(ERROR_MESSAGE),
                longValue(doc, CREATED_AT),
                longValue(doc, UPDATED_AT),
                longValue(doc, QUEUE_POSITION),
                longValue(doc, FILE_MODIFIED_AT),
                longValue(doc, FILE_SIZE),
                doc.get(FINGERPRINT),
                doc.get(ARCHIVED_PATH),
                doc.get(INSTALLED_PATH)
        );
    }

    public Document toLogDocument(final TaskLogEntry entry) {
        final Document doc = new Document();
        doc.add(new StringField(DOC_ID, logKey(entry.sequence()).text(), Field.Store.YES));
        doc.add(new StringField(DOC_TYPE, TYPE_LOG, Field.Store.NO));
        doc.add(new StringField(LOG_TASK_ID, Long.toString(entry.taskId()), Field.Store.YES));
        doc.add(new StoredField(LOG_SEQUENCE, entry.sequence()));
        doc.add(new LongPoint(LOG_SEQUENCE, entry.sequence()));
        doc.add(new NumericDocValuesField(LOG_SEQUENCE_SORT, entry.sequence()));
        doc.add(new StoredField(LOG_TIMESTAMP, entry.timestamp()));
        doc.add(new StoredField(LOG_LEVEL, entry.level().name()));
        doc.add(new StoredField(LOG_MESSAGE, entry.message()));
        return doc;
    }

    public TaskLogEntry toLogEntry(final Document doc) {
        return new TaskLogEntry(
                Long.parseLong(doc.get(LOG_TASK_ID)),
                longValue(doc, LOG_SEQUENCE),
                longValue(doc, LOG_TIMESTAMP),
                LogLevel.valueOf(doc.get(LOG_LEVEL)),
                doc.get(LOG_MESSAGE)
        );
    }

    public Document toStatsDocument(final ProcessingStats stats) {
        final Document doc = new Document();
        doc.add(new StringField(DOC_ID, STATS_KEY, Field.Store.YES));
        doc.add(new StringField(DOC_TYPE, TYPE_STATS, Field.Store.NO));
        doc.add(new StoredField(STATS_SAVED_BYTES, stats.totalSavedBytes()));
        doc.add(new StoredField(STATS_PROCESSED_FILES, stats.totalProcessedFiles()));
        return doc;
    }

    public ProcessingStats toStats(final Document doc) {
        return new ProcessingStats(longValue(doc, STATS_SAVED_BYTES), longValue(doc, STATS_PROCESSED_FILES));
    }

    public static Term taskKey(final long taskId) {
        return new Term(DOC_ID, "task:" + taskId);
    }

    public static Term logKey(final long sequence) {
        return new Term(DOC_ID, "log:" + sequence);
    }

    public static Term statsKey() {
        return new Term(DOC_ID, STATS_KEY);
    }

    /**
     * Splits a relative path into searchable words: "Shows/The.Wire/S01E02.mkv" becomes
     * "Shows The Wire S01E02 mkv".
     */
    public static String pathText(final String relativePath) {
        return NON_WORD.matcher(relativePath).replaceAll(" ").trim();
    }

    private static long longValue(final Document doc, final String field) {
        final IndexableField f = doc.getField(field);
        return f == null ? 0L : f.numericValue().longValue();
    }

    private static Long optionalLong(final Document doc, final String field) {
        final IndexableField f = doc.getField(field);
        return f == null ? null : f.numericValue().longValue();
    }

    private static double doubleValue(final Document doc, final String field) {
        final IndexableField f = doc.getField(field);
        return f == null ? 0.0 : f.numericValue().doubleValue();
    }

    private static Double optionalDouble(final Document doc, final String field) {
        final IndexableField f = doc.getField(field);
        return f == null ? null : f.numericValue().doubleValue();
    }
}
