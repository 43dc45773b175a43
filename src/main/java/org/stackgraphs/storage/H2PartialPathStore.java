package org.stackgraphs.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.stackgraphs.storage.api.FileIndex;
import org.stackgraphs.storage.api.GraphFragment;
import org.stackgraphs.storage.api.IPartialPathStore;
import org.stackgraphs.storage.api.NodeKey;
import org.stackgraphs.storage.api.PartialPathRecord;
import org.stackgraphs.storage.api.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2 path database using HikariCP for connection pooling.
 * <p>
 * <strong>Schema:</strong>
 * <pre>
 * CREATE TABLE indexed_files (
 *   file_name VARCHAR PRIMARY KEY,
 *   version_tag VARCHAR,
 *   fragment_json CLOB NOT NULL,
 *   path_count INT NOT NULL,
 *   indexed_at BIGINT NOT NULL
 * )
 * CREATE TABLE partial_paths (
 *   file_name VARCHAR NOT NULL,
 *   path_ordinal INT NOT NULL,
 *   start_file VARCHAR NOT NULL, start_local INT NOT NULL,
 *   end_file VARCHAR NOT NULL, end_local INT NOT NULL,
 *   pre_symbol VARCHAR, post_symbol VARCHAR,
 *   path_json CLOB NOT NULL,
 *   PRIMARY KEY (file_name, path_ordinal)
 * )
 * </pre>
 * Paths are indexed by start node, end node and, for the root, by the head symbol of the
 * precondition and postcondition. Conditions and edges are stored as JSON (Gson).
 * <p>
 * <strong>Atomicity:</strong> a file is replaced by deleting and inserting its rows in one
 * transaction.
 * <p>
 * <strong>Caching:</strong> decoded lookup results are kept in a Caffeine cache which is cleared
 * on every write. A generation counter keeps reads that raced with a write out of the cache.
 */
public class H2PartialPathStore implements IPartialPathStore {

    private static final Logger log = LoggerFactory.getLogger(H2PartialPathStore.class);

    private static final String SELECT_PATHS = "SELECT path_json FROM partial_paths ";
    private static final String ORDER = " ORDER BY file_name, path_ordinal";

    private final HikariDataSource dataSource;
    private final Gson gson = new Gson();
    private final Cache<String, List<PartialPathRecord>> lookupCache;
    private final AtomicLong generation = new AtomicLong();

    public H2PartialPathStore(Config options) {
        if (!options.hasPath("jdbcUrl")) {
            throw new IllegalArgumentException("'jdbcUrl' must be configured for H2PartialPathStore.");
        }
        final String jdbcUrl = options.getString("jdbcUrl");
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 10);
        hikariConfig.setMinimumIdle(options.hasPath("minIdle") ? options.getInt("minIdle") : 2);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName("stack-graphs-paths");

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String causeMsg = cause.getMessage() != null ? cause.getMessage() : "";
            if (causeMsg.contains("already in use") || causeMsg.contains("file is locked")) {
                String errorMsg = String.format(
                    "Cannot open path database: file already in use by another process. URL: %s", jdbcUrl);
                log.error(errorMsg);
                throw new RuntimeException(errorMsg, e);
            }
            String errorMsg = String.format("Failed to initialize path database: %s. Database: %s. Error: %s",
                cause.getClass().getSimpleName(), jdbcUrl, causeMsg);
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        long maxCacheSize = options.hasPath("cacheMaximumSize") ? options.getLong("cacheMaximumSize") : 10_000L;
        long expireSeconds = options.hasPath("cacheExpireAfterAccessSeconds")
            ? options.getLong("cacheExpireAfterAccessSeconds")
            : 300L;
        this.lookupCache = Caffeine.newBuilder()
            .maximumSize(maxCacheSize)
            .expireAfterAccess(Duration.ofSeconds(expireSeconds))
            .recordStats()
            .build();

        createSchema();
        log.debug("Path database opened (url={}, maxPool={}, cache={})",
            jdbcUrl, hikariConfig.getMaximumPoolSize(), maxCacheSize);
    }

    private void createSchema() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS indexed_files ("
                + "file_name VARCHAR PRIMARY KEY, "
                + "version_tag VARCHAR, "
                + "fragment_json CLOB NOT NULL, "
                + "path_count INT NOT NULL, "
                + "indexed_at BIGINT NOT NULL)");
            stmt.execute("CREATE TABLE IF NOT EXISTS partial_paths ("
                + "file_name VARCHAR NOT NULL, "
                + "path_ordinal INT NOT NULL, "
                + "start_file VARCHAR NOT NULL, "
                + "start_local INT NOT NULL, "
                + "end_file VARCHAR NOT NULL, "
                + "end_local INT NOT NULL, "
                + "pre_symbol VARCHAR, "
                + "post_symbol VARCHAR, "
                + "path_json CLOB NOT NULL, "
                + "PRIMARY KEY (file_name, path_ordinal))");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_paths_start ON partial_paths (start_file, start_local)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_paths_end ON partial_paths (end_file, end_local)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_paths_pre_symbol ON partial_paths (pre_symbol)");
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_paths_post_symbol ON partial_paths (post_symbol)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create path database schema", e);
        }
    }

    @Override
    public void storeFile(FileIndex index) throws StorageException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                deletePaths(conn, index.file());
                try (PreparedStatement merge = conn.prepareStatement(
                    "MERGE INTO indexed_files (file_name, version_tag, fragment_json, path_count, indexed_at) "
                        + "KEY (file_name) VALUES (?, ?, ?, ?, ?)")) {
                    merge.setString(1, index.file());
                    merge.setString(2, index.tag());
                    merge.setString(3, gson.toJson(index.fragment()));
                    merge.setInt(4, index.paths().size());
                    merge.setLong(5, System.currentTimeMillis());
                    merge.executeUpdate();
                }
                try (PreparedStatement insert = conn.prepareStatement(
                    "INSERT INTO partial_paths (file_name, path_ordinal, start_file, start_local, end_file, end_local, "
                        + "pre_symbol, post_symbol, path_json) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                    for (PartialPathRecord record : index.paths()) {
                        insert.setString(1, record.file());
                        insert.setInt(2, record.ordinal());
                        insert.setString(3, record.start().file());
                        insert.setInt(4, record.start().localId());
                        insert.setString(5, record.end().file());
                        insert.setInt(6, record.end().localId());
                        insert.setString(7, record.preconditionHeadSymbol());
                        insert.setString(8, record.postconditionHeadSymbol());
                        insert.setString(9, gson.toJson(record));
                        insert.addBatch();
                    }
                    insert.executeBatch();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to store partial paths of '" + index.file() + "'", e);
        } finally {
            invalidateCache();
        }
        log.debug("Stored {} partial paths for '{}'", index.paths().size(), index.file());
    }

    @Override
    public boolean deleteFile(String file) throws StorageException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                int removed = deletePaths(conn, file);
                conn.commit();
                return removed > 0;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to delete partial paths of '" + file + "'", e);
        } finally {
            invalidateCache();
        }
    }

    private int deletePaths(Connection conn, String file) throws SQLException {
        try (PreparedStatement paths = conn.prepareStatement("DELETE FROM partial_paths WHERE file_name = ?");
             PreparedStatement files = conn.prepareStatement("DELETE FROM indexed_files WHERE file_name = ?")) {
            paths.setString(1, file);
            paths.executeUpdate();
            files.setString(1, file);
            return files.executeUpdate();
        }
    }

    @Override
    public boolean containsFile(String file) throws StorageException {
        return fileTag(file).isPresent();
    }

    @Override
    public Optional<String> fileTag(String file) throws StorageException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT version_tag FROM indexed_files WHERE file_name = ?")) {
            stmt.setString(1, file);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                String tag = rs.getString(1);
                return Optional.of(tag == null ? "" : tag);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to read version tag of '" + file + "'", e);
        }
    }

    @Override
    public List<String> listFiles() throws StorageException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT file_name FROM indexed_files ORDER BY file_name")) {
            List<String> files = new ArrayList<>();
            while (rs.next()) {
                files.add(rs.getString(1));
            }
            return files;
        } catch (SQLException e) {
            throw new StorageException("Failed to list indexed files", e);
        }
    }

    @Override
    public Optional<GraphFragment> loadGraphFragment(String file) throws StorageException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                 "SELECT fragment_json FROM indexed_files WHERE file_name = ?")) {
            stmt.setString(1, file);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(gson.fromJson(rs.getString(1), GraphFragment.class));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load graph fragment of '" + file + "'", e);
        } catch (JsonParseException e) {
            throw new StorageException("Corrupt graph fragment stored for '" + file + "'", e);
        }
    }

    @Override
    public List<PartialPathRecord> findPathsByFile(String file) throws StorageException {
        return query("file:" + file, SELECT_PATHS + "WHERE file_name = ?" + ORDER, stmt -> stmt.setString(1, file));
    }

    @Override
    public List<PartialPathRecord> findPathsByStartNode(NodeKey start) throws StorageException {
        return query("start:" + start, SELECT_PATHS + "WHERE start_file = ? AND start_local = ?" + ORDER, stmt -> {
            stmt.setString(1, start.file());
            stmt.setInt(2, start.localId());
        });
    }

    @Override
    public List<PartialPathRecord> findPathsByEndNode(NodeKey end) throws StorageException {
        return query("end:" + end, SELECT_PATHS + "WHERE end_file = ? AND end_local = ?" + ORDER, stmt -> {
            stmt.setString(1, end.file());
            stmt.setInt(2, end.localId());
        });
    }

    @Override
    public List<PartialPathRecord> findRootPathsByPreconditionSymbol(String symbol) throws StorageException {
        return query("root-pre:" + symbol, SELECT_PATHS
            + "WHERE start_file = ? AND start_local = ? AND (pre_symbol = ? OR pre_symbol IS NULL)" + ORDER, stmt -> {
                stmt.setString(1, NodeKey.ROOT.file());
                stmt.setInt(2, NodeKey.ROOT.localId());
                stmt.setString(3, symbol);
            });
    }

    @Override
    public List<PartialPathRecord> findRootPathsByPostconditionSymbol(String symbol) throws StorageException {
        return query("root-post:" + symbol, SELECT_PATHS
            + "WHERE end_file = ? AND end_local = ? AND (post_symbol = ? OR post_symbol IS NULL)" + ORDER, stmt -> {
                stmt.setString(1, NodeKey.ROOT.file());
                stmt.setInt(2, NodeKey.ROOT.localId());
                stmt.setString(3, symbol);
            });
    }

    /**
     * Hit rate of the lookup cache since the store was opened.
     */
    public double cacheHitRate() {
        return lookupCache.stats().hitRate();
    }

    @Override
    public void close() {
        if (!dataSource.isClosed()) {
            dataSource.close();
            log.debug("Path database closed");
        }
    }

    @FunctionalInterface
    private interface ParameterBinder {
        void bind(PreparedStatement stmt) throws SQLException;
    }

    private List<PartialPathRecord> query(String cacheKey, String sql, ParameterBinder binder)
        throws StorageException {
        List<PartialPathRecord> cached = lookupCache.getIfPresent(cacheKey);
        if (cached != null) {
            return cached;
        }
        long observedGeneration = generation.get();
        List<PartialPathRecord> records = new ArrayList<>();
        try (Connection conn = dataSource.getConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            binder.bind(stmt);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    records.add(gson.fromJson(rs.getString(1), PartialPathRecord.class));
                }
            }
        } catch (SQLException e) {
            throw new StorageException("Path lookup failed (" + cacheKey + ")", e);
        } catch (JsonParseException e) {
            throw new StorageException("Corrupt partial path row (" + cacheKey + ")", e);
        }
        List<PartialPathRecord> result = List.copyOf(records);
        if (generation.get() == observedGeneration) {
            lookupCache.put(cacheKey, result);
        }
        return result;
    }

    private void invalidateCache() {
        generation.incrementAndGet();
        lookupCache.invalidateAll();
    }
}
