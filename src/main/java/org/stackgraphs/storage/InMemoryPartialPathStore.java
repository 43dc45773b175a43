package org.stackgraphs.storage;

import com.typesafe.config.Config;
import org.stackgraphs.storage.api.FileIndex;
import org.stackgraphs.storage.api.GraphFragment;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Heap-backed path database for tests, single-process tools and small workspaces.
 * <p>
 * Per-node indexes are maintained on every write, so lookups do not scan unrelated files.
 * All methods are synchronized; {@link #storeFile(FileIndex)} swaps a file's rows under the lock
 * and is therefore atomic for readers.
 */
public class InMemoryPartialPathStore implements IPartialPathStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPartialPathStore.class);

    private static final Comparator<PartialPathRecord> STORAGE_ORDER =
        Comparator.comparing(PartialPathRecord::file).thenComparingInt(PartialPathRecord::ordinal);

    private final TreeMap<String, FileIndex> files = new TreeMap<>();
    private final Map<NodeKey, List<PartialPathRecord>> byStart = new HashMap<>();
    private final Map<NodeKey, List<PartialPathRecord>> byEnd = new HashMap<>();

    public InMemoryPartialPathStore() {
    }

    /**
     * Constructor used by {@link PartialPathStoreFactory}; there are no options.
     */
    public InMemoryPartialPathStore(Config options) {
        this();
    }

    @Override
    public synchronized void storeFile(FileIndex index) {
        removeFromIndexes(index.file());
        files.put(index.file(), index);
        for (PartialPathRecord record : index.paths()) {
            byStart.computeIfAbsent(record.start(), k -> new ArrayList<>()).add(record);
            byEnd.computeIfAbsent(record.end(), k -> new ArrayList<>()).add(record);
        }
        log.debug("Stored {} partial paths for '{}'", index.paths().size(), index.file());
    }

    @Override
    public synchronized boolean deleteFile(String file) {
        boolean present = removeFromIndexes(file);
        files.remove(file);
        return present;
    }

    @Override
    public synchronized boolean containsFile(String file) {
        return files.containsKey(file);
    }

    @Override
    public synchronized Optional<String> fileTag(String file) {
        FileIndex index = files.get(file);
        if (index == null) {
            return Optional.empty();
        }
        return Optional.of(index.tag() == null ? "" : index.tag());
    }

    @Override
    public synchronized List<String> listFiles() {
        return List.copyOf(files.keySet());
    }

    @Override
    public synchronized Optional<GraphFragment> loadGraphFragment(String file) {
        return Optional.ofNullable(files.get(file)).map(FileIndex::fragment);
    }

    @Override
    public synchronized List<PartialPathRecord> findPathsByFile(String file) {
        FileIndex index = files.get(file);
        return index == null ? List.of() : List.copyOf(index.paths());
    }

    @Override
    public synchronized List<PartialPathRecord> findPathsByStartNode(NodeKey start) {
        return ordered(byStart.getOrDefault(start, List.of()));
    }

    @Override
    public synchronized List<PartialPathRecord> findPathsByEndNode(NodeKey end) {
        return ordered(byEnd.getOrDefault(end, List.of()));
    }

    @Override
    public synchronized List<PartialPathRecord> findRootPathsByPreconditionSymbol(String symbol) {
        return filterBySymbol(byStart.getOrDefault(NodeKey.ROOT, List.of()), symbol,
            PartialPathRecord::preconditionHeadSymbol);
    }

    @Override
    public synchronized List<PartialPathRecord> findRootPathsByPostconditionSymbol(String symbol) {
        return filterBySymbol(byEnd.getOrDefault(NodeKey.ROOT, List.of()), symbol,
            PartialPathRecord::postconditionHeadSymbol);
    }

    @Override
    public void close() {
        // nothing to release
    }

    private boolean removeFromIndexes(String file) {
        FileIndex previous = files.get(file);
        if (previous == null) {
            return false;
        }
        for (PartialPathRecord record : previous.paths()) {
            removeRecord(byStart, record.start(), file);
            removeRecord(byEnd, record.end(), file);
        }
        return true;
    }

    private static void removeRecord(Map<NodeKey, List<PartialPathRecord>> index, NodeKey key, String file) {
        List<PartialPathRecord> records = index.get(key);
        if (records == null) {
            return;
        }
        records.removeIf(r -> r.file().equals(file));
        if (records.isEmpty()) {
            index.remove(key);
        }
    }

    private static List<PartialPathRecord> filterBySymbol(List<PartialPathRecord> records, String symbol,
                                                          Function<PartialPathRecord, String> head) {
        List<PartialPathRecord> matching = new ArrayList<>();
        for (PartialPathRecord record : records) {
            String recordSymbol = head.apply(record);
            if (recordSymbol == null || Objects.equals(recordSymbol, symbol)) {
                matching.add(record);
            }
        }
        return ordered(matching);
    }

    private static List<PartialPathRecord> ordered(List<PartialPathRecord> records) {
        List<PartialPathRecord> sorted = new ArrayList<>(records);
        sorted.sort(STORAGE_ORDER);
        return List.copyOf(sorted);
    }
}
