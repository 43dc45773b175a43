package org.stackgraphs.index;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.stackgraphs.arena.Handle;
import org.stackgraphs.cancellation.CancelAfterDuration;
import org.stackgraphs.cancellation.CancellationFlag;
import org.stackgraphs.cancellation.CancelledException;
import org.stackgraphs.graph.SourceFile;
import org.stackgraphs.graph.StackGraph;
import org.stackgraphs.partial.PartialPath;
import org.stackgraphs.partial.PartialPathFinder;
import org.stackgraphs.storage.GraphFragmentCodec;
import org.stackgraphs.storage.PathRecordCodec;
import org.stackgraphs.storage.api.FileIndex;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.stackgraphs.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Computes the partial paths of files and writes them to a path database.
 * <p>
 * Each file is handled on its own: its paths are computed from the graph, then its rows are
 * replaced in one {@link IPartialPathStore#storeFile(FileIndex)} call. Rows of other files are
 * never touched, so re-indexing one file does not invalidate anything else.
 * <p>
 * Configuration ({@code stack-graphs.indexer}):
 * <ul>
 *   <li>{@code threads}: worker threads for {@link #indexAll}, defaults to the processor count</li>
 *   <li>{@code fileTimeoutSeconds}: per-file limit for {@link #indexAll}, {@code 0} for none</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> the graph must not be modified while files are being indexed.
 * Callers serialize indexing and querying of the same file.
 */
public class StackGraphIndexer {

    private static final Logger log = LoggerFactory.getLogger(StackGraphIndexer.class);

    private final IPartialPathStore store;
    private final int threads;
    private final Duration fileTimeout;

    public StackGraphIndexer(IPartialPathStore store) {
        this(store, ConfigFactory.empty());
    }

    public StackGraphIndexer(IPartialPathStore store, Config options) {
        this.store = store;
        this.threads = options.hasPath("threads")
            ? options.getInt("threads")
            : Runtime.getRuntime().availableProcessors();
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1, got " + threads);
        }
        long timeoutSeconds = options.hasPath("fileTimeoutSeconds") ? options.getLong("fileTimeoutSeconds") : 0L;
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("fileTimeoutSeconds must not be negative, got " + timeoutSeconds);
        }
        this.fileTimeout = timeoutSeconds > 0 ? Duration.ofSeconds(timeoutSeconds) : null;
    }

    /**
     * Computes the rows of {@code file} without writing them.
     *
     * @throws CancelledException if the flag is raised during path finding
     */
    public FileIndex computeIndex(StackGraph graph, Handle<SourceFile> file, String tag,
                                  CancellationFlag cancellation) throws CancelledException {
        String fileName = graph.fileName(file);
        List<PartialPath> paths = new PartialPathFinder(graph).findAllPartialPathsInFile(file, cancellation);
        List<PartialPathRecord> records = new ArrayList<>(paths.size());
        for (PartialPath path : paths) {
            records.add(PathRecordCodec.encode(graph, fileName, records.size(), path));
        }
        return new FileIndex(fileName, tag, GraphFragmentCodec.encode(graph, file), records);
    }

    /**
     * Indexes {@code file} unless its stored rows already carry {@code tag}.
     * A {@code null} tag always indexes.
     */
    public FileIndexResult index(StackGraph graph, Handle<SourceFile> file, String tag,
                                 CancellationFlag cancellation) throws StorageException, CancelledException {
        String fileName = graph.fileName(file);
        if (tag != null) {
            Optional<String> stored = store.fileTag(fileName);
            if (stored.isPresent() && stored.get().equals(tag)) {
                log.debug("Skipping '{}': already indexed with tag '{}'", fileName, tag);
                return new FileIndexResult(fileName, tag, 0, true);
            }
        }
        return reindex(graph, file, tag, cancellation);
    }

    /**
     * Recomputes the rows of {@code file} and replaces the stored ones. If computation is
     * cancelled, the previous rows are left in place.
     */
    public FileIndexResult reindex(StackGraph graph, Handle<SourceFile> file, String tag,
                                   CancellationFlag cancellation) throws StorageException, CancelledException {
        FileIndex index = computeIndex(graph, file, tag, cancellation);
        store.storeFile(index);
        log.debug("Indexed '{}' with {} partial paths", index.file(), index.paths().size());
        return new FileIndexResult(index.file(), tag, index.paths().size(), false);
    }

    /**
     * Removes every stored row of {@code file}.
     *
     * @return {@code true} if the file was stored
     */
    public boolean invalidate(String file) throws StorageException {
        boolean removed = store.deleteFile(file);
        log.debug("Invalidated '{}' (present: {})", file, removed);
        return removed;
    }

    /**
     * Indexes several files in parallel. Failures of single files, including per-file timeouts,
     * are reported in the result and do not stop the other files.
     *
     * @param files files with their version tags, in submission order
     * @throws CancelledException if {@code cancellation} is raised or the calling thread is interrupted
     */
    public BatchIndexResult indexAll(StackGraph graph, Map<Handle<SourceFile>, String> files,
                                     CancellationFlag cancellation) throws CancelledException {
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        Map<String, Future<FileIndexResult>> futures = new LinkedHashMap<>();
        try {
            for (Map.Entry<Handle<SourceFile>, String> entry : files.entrySet()) {
                Handle<SourceFile> file = entry.getKey();
                String tag = entry.getValue();
                futures.put(graph.fileName(file),
                    executor.submit(() -> index(graph, file, tag, perFileFlag(cancellation))));
            }

            List<FileIndexResult> indexed = new ArrayList<>();
            Map<String, String> failed = new LinkedHashMap<>();
            for (Map.Entry<String, Future<FileIndexResult>> entry : futures.entrySet()) {
                try {
                    indexed.add(entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    log.warn("Failed to index '{}': {}", entry.getKey(), cause.getMessage());
                    failed.put(entry.getKey(), cause.getMessage());
                }
            }
            cancellation.check("batch indexing");
            log.info("Indexed {} files ({} partial paths), {} failed",
                indexed.size(), indexed.stream().mapToInt(FileIndexResult::pathCount).sum(), failed.size());
            return new BatchIndexResult(List.copyOf(indexed), Collections.unmodifiableMap(failed));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("batch indexing (interrupted)");
        } finally {
            executor.shutdownNow();
        }
    }

    private CancellationFlag perFileFlag(CancellationFlag outer) {
        if (fileTimeout == null) {
            return outer;
        }
        CancellationFlag timeout = new CancelAfterDuration(fileTimeout);
        return () -> outer.isCancelled() || timeout.isCancelled();
    }
}
