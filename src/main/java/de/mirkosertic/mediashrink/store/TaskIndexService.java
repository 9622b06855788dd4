package de.mirkosertic.mediashrink.store;

import de.mirkosertic.mediashrink.config.BuildInfo;
import de.mirkosertic.mediashrink.model.LogLevel;
import de.mirkosertic.mediashrink.model.ProcessingStats;
import de.mirkosertic.mediashrink.model.Task;
import de.mirkosertic.mediashrink.model.TaskLogEntry;
import de.mirkosertic.mediashrink.model.TaskNotFoundException;
import de.mirkosertic.mediashrink.model.TaskPage;
import de.mirkosertic.mediashrink.model.TaskQuery;
import de.mirkosertic.mediashrink.model.TaskStateException;
import de.mirkosertic.mediashrink.model.TaskStatus;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParser;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.Sort;
import org.apache.lucene.search.SortField;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Durable store for tasks, task logs and the {@link ProcessingStats} aggregate, backed by a Lucene index.
 * <p>
 * Every write method is synchronized, commits before it returns and refreshes the searcher, so readers
 * always see their own writes. A status change and the matching stats delta always go into the same commit.
 * Status changes are compare-and-set against an expected set of statuses, which serializes the worker,
 * the scanner and user actions without any further locking.
 */
public class TaskIndexService {

    private static final Logger logger = LoggerFactory.getLogger(TaskIndexService.class);

    static final String SCHEMA_VERSION_KEY = "schema_version";
    static final String SOFTWARE_VERSION_KEY = "software_version";

    private final Path indexPath;
    private final Clock clock;
    private final StandardAnalyzer analyzer;
    private final TaskDocumentMapper mapper;

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;

    private final AtomicLong lastTaskId = new AtomicLong();
    private final AtomicLong lastQueuePosition = new AtomicLong();
    private final AtomicLong lastLogSequence = new AtomicLong();

    private volatile ProcessingStats stats = ProcessingStats.EMPTY;
    private volatile int indexSchemaVersion = -1;
    private volatile String indexSoftwareVersion;

    public TaskIndexService(final Path indexPath) {
        this(indexPath, Clock.systemUTC());
    }

    public TaskIndexService(final Path indexPath, final Clock clock) {
        this.indexPath = indexPath;
        this.clock = clock;
        this.analyzer = new StandardAnalyzer();
        this.mapper = new TaskDocumentMapper();
    }

    /**
     * Opens or creates the index. Must be called before using the service.
     */
    public synchronized void init() throws IOException {
        if (!Files.exists(indexPath)) {
            Files.createDirectories(indexPath);
            logger.info("Created task index directory: {}", indexPath.toAbsolutePath());
        }

        directory = FSDirectory.open(indexPath);
        readCommitMetadata();

        final IndexWriterConfig config = new IndexWriterConfig(analyzer);
        config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        indexWriter = new IndexWriter(directory, config);

        if (indexSchemaVersion >= 0 && indexSchemaVersion != TaskDocumentMapper.SCHEMA_VERSION) {
            logger.warn("Task index schema version {} differs from current version {}",
                    indexSchemaVersion, TaskDocumentMapper.SCHEMA_VERSION);
        }
        indexWriter.setLiveCommitData(Map.of(
                SCHEMA_VERSION_KEY, String.valueOf(TaskDocumentMapper.SCHEMA_VERSION),
                SOFTWARE_VERSION_KEY, BuildInfo.getVersion()
        ).entrySet());
        indexWriter.commit();

        searcherManager = new SearcherManager(indexWriter, null);

        lastTaskId.set(maxStoredLong(TaskDocumentMapper.TYPE_TASK,
                TaskDocumentMapper.TASK_ID_SORT, TaskDocumentMapper.TASK_ID));
        lastQueuePosition.set(maxStoredLong(TaskDocumentMapper.TYPE_TASK,
                TaskDocumentMapper.QUEUE_POSITION_SORT, TaskDocumentMapper.QUEUE_POSITION));
        lastLogSequence.set(maxStoredLong(TaskDocumentMapper.TYPE_LOG,
                TaskDocumentMapper.LOG_SEQUENCE_SORT, TaskDocumentMapper.LOG_SEQUENCE));

        final Optional<ProcessingStats> storedStats = loadStoredStats();
        if (storedStats.isPresent()) {
            stats = storedStats.get();
        } else {
            stats = computeStats();
            writeStatsAndCommit(stats);
        }

        logger.info("Task index initialized at {}: lastTaskId={}, stats={}",
                indexPath.toAbsolutePath(), lastTaskId.get(), stats);
    }

    private void readCommitMetadata() throws IOException {
        if (!DirectoryReader.indexExists(directory)) {
            return;
        }
        final Map<String, String> userData = SegmentInfos.readLatestCommit(directory).getUserData();
        final String schemaVersion = userData.get(SCHEMA_VERSION_KEY);
        if (schemaVersion != null) {
            try {
                indexSchemaVersion = Integer.parseInt(schemaVersion);
            } catch (final NumberFormatException e) {
                logger.warn("Invalid schema version in task index commit data: {}", schemaVersion);
            }
        }
        indexSoftwareVersion = userData.get(SOFTWARE_VERSION_KEY);
    }

    public synchronized void close() throws IOException {
        // SearcherManager before IndexWriter
        if (searcherManager != null) {
            searcherManager.close();
        }
        if (indexWriter != null) {
            indexWriter.close();
        }
        if (directory != null) {
            directory.close();
        }
        logger.info("Task index closed");
    }

    // ==================== Tasks ====================

    /**
     * Persists a new task. Id, queue position and timestamps are assigned here.
     */
    public synchronized Task createTask(final Task.Builder draft) throws IOException {
        final long now = clock.millis();
        final Task task = draft
                .id(lastTaskId.incrementAndGet())
                .queuePosition(lastQueuePosition.incrementAndGet())
                .createdAt(now)
                .updatedAt(now)
                .build();

        indexWriter.updateDocument(TaskDocumentMapper.taskKey(task.id()), mapper.toDocument(task));
        applyStatsDelta(ProcessingStats.contributionOf(task));
        commitAndRefresh();

        logger.debug("Created task {} ({}) for {}", task.id(), task.status(), task.sourcePath());
        return task;
    }

    public Optional<Task> findById(final long taskId) throws IOException {
        return findFirst(new TermQuery(TaskDocumentMapper.taskKey(taskId)));
    }

    public Task getTask(final long taskId) throws IOException, TaskNotFoundException {
        return findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Finds the task whose file currently lives at {@code path}: the installed output for COMPLETED tasks,
     * the source file otherwise.
     */
    public Optional<Task> findByCurrentPath(final String path) throws IOException {
        return findFirst(new TermQuery(new Term(TaskDocumentMapper.CURRENT_PATH, path)));
    }

    /**
     * The PENDING task that has waited longest, if any.
     */
    public Optional<Task> nextPending() throws IOException {
        final List<Task> tasks = search(statusQuery(Set.of(TaskStatus.PENDING)), 1,
                new Sort(new SortField(TaskDocumentMapper.QUEUE_POSITION_SORT, SortField.Type.LONG)));
        return tasks.stream().findFirst();
    }

    /**
     * All tasks in one of the given statuses in queue order. An empty set selects every task.
     */
    public List<Task> findByStatus(final Set<TaskStatus> statuses) throws IOException {
        final Query query = statusQuery(statuses);
        final int count = withSearcher(searcher -> searcher.count(query));
        if (count == 0) {
            return List.of();
        }
        return search(query, count,
                new Sort(new SortField(TaskDocumentMapper.QUEUE_POSITION_SORT, SortField.Type.LONG)));
    }

    public List<Task> findAll() throws IOException {
        return findByStatus(Set.of());
    }

    /**
     * Filtered, newest-first page of tasks.
     */
    public TaskPage query(final TaskQuery taskQuery) throws IOException {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(statusQuery(taskQuery.statuses()), BooleanClause.Occur.FILTER);

        final Query textQuery = textQuery(taskQuery.search());
        if (textQuery != null) {
            builder.add(textQuery, BooleanClause.Occur.MUST);
        }
        final Query query = builder.build();

        return withSearcher(searcher -> {
            final long total = searcher.count(query);
            if (taskQuery.offset() >= total) {
                return new TaskPage(List.of(), total, taskQuery.offset(), taskQuery.limit());
            }
            final int maxResults = taskQuery.offset() + taskQuery.limit();
            final TopDocs topDocs = searcher.search(query, maxResults,
                    new Sort(new SortField(TaskDocumentMapper.TASK_ID_SORT, SortField.Type.LONG, true)));

            final List<Task> tasks = new ArrayList<>();
            final ScoreDoc[] scoreDocs = topDocs.scoreDocs;
            for (int i = taskQuery.offset(); i < scoreDocs.length && i < maxResults; i++) {
                tasks.add(mapper.toTask(searcher.storedFields().document(scoreDocs[i].doc)));
            }
            return new TaskPage(tasks, total, taskQuery.offset(), taskQuery.limit());
        });
    }

    public Map<TaskStatus, Long> countByStatus() throws IOException {
        return withSearcher(searcher -> {
            final Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
            for (final TaskStatus status : TaskStatus.values()) {
                counts.put(status, (long) searcher.count(statusQuery(Set.of(status))));
            }
            return counts;
        });
    }

    /**
     * Compare-and-set update of a single task.
     *
     * @param expected statuses the task must currently be in, empty to accept any status
     * @param change   mutation applied to a builder seeded with the current state
     * @throws TaskStateException if the task is not in an expected status or the change is not a legal transition
     */
    public synchronized Task update(final long taskId, final Set<TaskStatus> expected,
                                    final Consumer<Task.Builder> change)
            throws IOException, TaskNotFoundException, TaskStateException {
        return doUpdate(taskId, expected, change, false);
    }

    /**
     * Like {@link #update} but also moves the task to the back of the queue.
     */
    public synchronized Task requeue(final long taskId, final Set<TaskStatus> expected,
                                     final Consumer<Task.Builder> change)
            throws IOException, TaskNotFoundException, TaskStateException {
        return doUpdate(taskId, expected, change, true);
    }

    private Task doUpdate(final long taskId, final Set<TaskStatus> expected, final Consumer<Task.Builder> change,
                          final boolean moveToBack)
            throws IOException, TaskNotFoundException, TaskStateException {
        final Task current = getTask(taskId);
        if (!expected.isEmpty() && !expected.contains(current.status())) {
            throw TaskStateException.unexpected(taskId, current.status(), expected);
        }

        final Task.Builder builder = current.toBuilder();
        change.accept(builder);
        if (builder.status() != current.status() && !current.status().canTransitionTo(builder.status())) {
            throw new TaskStateException(taskId, current.status(),
                    "Illegal transition for task " + taskId + ": " + current.status() + " -> " + builder.status());
        }
        if (moveToBack) {
            builder.queuePosition(lastQueuePosition.incrementAndGet());
        }
        final Task updated = builder.updatedAt(clock.millis()).build();

        indexWriter.updateDocument(TaskDocumentMapper.taskKey(taskId), mapper.toDocument(updated));
        applyStatsDelta(ProcessingStats.contributionOf(updated).minus(ProcessingStats.contributionOf(current)));
        commitAndRefresh();

        if (current.status() != updated.status()) {
            logger.debug("Task {}: {} -> {}", taskId, current.status(), updated.status());
        }
        return updated;
    }

    /**
     * Removes a task together with its log entries.
     *
     * @return the removed task, empty if it did not exist
     * @throws TaskStateException if the task exists but is not in one of the expected statuses
     */
    public synchronized Optional<Task> remove(final long taskId, final Set<TaskStatus> expected)
            throws IOException, TaskStateException {
        final Optional<Task> existing = findById(taskId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        final Task task = existing.get();
        if (!expected.isEmpty() && !expected.contains(task.status())) {
            throw TaskStateException.unexpected(taskId, task.status(), expected);
        }

        indexWriter.deleteDocuments(TaskDocumentMapper.taskKey(taskId));
        indexWriter.deleteDocuments(new Term(TaskDocumentMapper.LOG_TASK_ID, Long.toString(taskId)));
        applyStatsDelta(ProcessingStats.EMPTY.minus(ProcessingStats.contributionOf(task)));
        commitAndRefresh();

        logger.debug("Removed task {} ({}) for {}", taskId, task.status(), task.sourcePath());
        return existing;
    }

    // ==================== Logs ====================

    public synchronized TaskLogEntry appendLog(final long taskId, final LogLevel level, final String message)
            throws IOException {
        final TaskLogEntry entry = new TaskLogEntry(taskId, lastLogSequence.incrementAndGet(), clock.millis(),
                level, message);
        indexWriter.addDocument(mapper.toLogDocument(entry));
        commitAndRefresh();
        return entry;
    }

    /**
     * Log entries of one task with a sequence number greater than {@code afterSequence}, oldest first.
     */
    public List<TaskLogEntry> getLogs(final long taskId, final long afterSequence, final int limit)
            throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(TaskDocumentMapper.LOG_TASK_ID, Long.toString(taskId))),
                        BooleanClause.Occur.FILTER)
                .add(LongPoint.newRangeQuery(TaskDocumentMapper.LOG_SEQUENCE,
                        afterSequence == Long.MAX_VALUE ? Long.MAX_VALUE : afterSequence + 1, Long.MAX_VALUE),
                        BooleanClause.Occur.FILTER)
                .build();

        return withSearcher(searcher -> {
            final TopDocs topDocs = searcher.search(query, Math.max(1, limit),
                    new Sort(new SortField(TaskDocumentMapper.LOG_SEQUENCE_SORT, SortField.Type.LONG)));
            final List<TaskLogEntry> entries = new ArrayList<>();
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                entries.add(mapper.toLogEntry(searcher.storedFields().document(scoreDoc.doc)));
            }
            return entries;
        });
    }

    // ==================== Stats ====================

    public ProcessingStats getStats() {
        return stats;
    }

    /**
     * Recomputes the aggregate from the COMPLETED tasks and compares it with the cached value.
     */
    public StatsCheck checkStatsInvariant() throws IOException {
        return new StatsCheck(stats, computeStats());
    }

    /**
     * Replaces the cached aggregate with the value derived from the tasks.
     */
    public synchronized ProcessingStats repairStats() throws IOException {
        final ProcessingStats computed = computeStats();
        writeStatsAndCommit(computed);
        stats = computed;
        return computed;
    }

    private ProcessingStats computeStats() throws IOException {
        ProcessingStats sum = ProcessingStats.EMPTY;
        for (final Task task : findByStatus(Set.of(TaskStatus.COMPLETED))) {
            sum = sum.plus(ProcessingStats.contributionOf(task));
        }
        return sum;
    }

    private void applyStatsDelta(final ProcessingStats delta) throws IOException {
        if (delta.equals(ProcessingStats.EMPTY)) {
            return;
        }
        final ProcessingStats updated = stats.plus(delta);
        indexWriter.updateDocument(TaskDocumentMapper.statsKey(), mapper.toStatsDocument(updated));
        stats = updated;
    }

    private void writeStatsAndCommit(final ProcessingStats value) throws IOException {
        indexWriter.updateDocument(TaskDocumentMapper.statsKey(), mapper.toStatsDocument(value));
        commitAndRefresh();
    }

    private Optional<ProcessingStats> loadStoredStats() throws IOException {
        return withSearcher(searcher -> {
            final TopDocs topDocs = searcher.search(new TermQuery(TaskDocumentMapper.statsKey()), 1);
            if (topDocs.totalHits.value == 0) {
                return Optional.empty();
            }
            return Optional.of(mapper.toStats(searcher.storedFields().document(topDocs.scoreDocs[0].doc)));
        });
    }

    // ==================== Metadata ====================

    /**
     * Schema version found in the index on startup, -1 for a new index.
     */
    public int getIndexSchemaVersion() {
        return indexSchemaVersion;
    }

    public String getIndexSoftwareVersion() {
        return indexSoftwareVersion;
    }

    public Path getIndexPath() {
        return indexPath;
    }

    // ==================== Internals ====================

    private void commitAndRefresh() throws IOException {
        indexWriter.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private Query statusQuery(final Set<TaskStatus> statuses) {
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();
        builder.add(new TermQuery(new Term(TaskDocumentMapper.DOC_TYPE, TaskDocumentMapper.TYPE_TASK)),
                BooleanClause.Occur.FILTER);
        if (!statuses.isEmpty()) {
            final BooleanQuery.Builder anyStatus = new BooleanQuery.Builder();
            for (final TaskStatus status : statuses) {
                anyStatus.add(new TermQuery(new Term(TaskDocumentMapper.STATUS, status.name())),
                        BooleanClause.Occur.SHOULD);
            }
            builder.add(anyStatus.build(), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private Query textQuery(final String search) {
        if (search == null) {
            return null;
        }
        final String text = TaskDocumentMapper.pathText(search);
        if (text.isEmpty()) {
            return null;
        }

        // Every word must match as a prefix, so "wir s01" finds "The.Wire.S01E02.mkv"
        final StringBuilder queryString = new StringBuilder();
        for (final String word : text.split("\\s+")) {
            if (queryString.length() > 0) {
                queryString.append(' ');
            }
            queryString.append(QueryParser.escape(word)).append('*');
        }

        final QueryParser parser = new QueryParser(TaskDocumentMapper.PATH_TEXT, analyzer);
        parser.setDefaultOperator(QueryParser.Operator.AND);
        try {
            return parser.parse(queryString.toString());
        } catch (final ParseException e) {
            throw new IllegalArgumentException("Invalid search text: " + search, e);
        }
    }

    private Optional<Task> findFirst(final Query query) throws IOException {
        final BooleanQuery taskQuery = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(TaskDocumentMapper.DOC_TYPE, TaskDocumentMapper.TYPE_TASK)),
                        BooleanClause.Occur.FILTER)
                .add(query, BooleanClause.Occur.FILTER)
                .build();
        final List<Task> tasks = search(taskQuery, 1,
                new Sort(new SortField(TaskDocumentMapper.TASK_ID_SORT, SortField.Type.LONG, true)));
        return tasks.stream().findFirst();
    }

    private List<Task> search(final Query query, final int maxResults, final Sort sort) throws IOException {
        return withSearcher(searcher -> {
            final TopDocs topDocs = searcher.search(query, maxResults, sort);
            final List<Task> tasks = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc scoreDoc : topDocs.scoreDocs) {
                final Document doc = searcher.storedFields().document(scoreDoc.doc);
                tasks.add(mapper.toTask(doc));
            }
            return tasks;
        });
    }

    private long maxStoredLong(final String docType, final String sortField, final String storedField)
            throws IOException {
        return withSearcher(searcher -> {
            final TopDocs topDocs = searcher.search(
                    new TermQuery(new Term(TaskDocumentMapper.DOC_TYPE, docType)), 1,
                    new Sort(new SortField(sortField, SortField.Type.LONG, true)));
            if (topDocs.scoreDocs.length == 0) {
                return 0L;
            }
            final Document doc = searcher.storedFields().document(topDocs.scoreDocs[0].doc);
            return doc.getField(storedField).numericValue().longValue();
        });
    }

    private <T> T withSearcher(final SearcherFunction<T> function) throws IOException {
        // Acquire from SearcherManager and always release, even on failure
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return function.apply(searcher);
        } finally {
            searcherManager.release(searcher);
        }
    }

    @FunctionalInterface
    private interface SearcherFunction<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }

    /**
     * Cached aggregate next to the value derived from the COMPLETED tasks.
     */
    public record StatsCheck(ProcessingStats cached, ProcessingStats computed) {

        public boolean consistent() {
            return cached.equals(computed);
        }
    }
}
