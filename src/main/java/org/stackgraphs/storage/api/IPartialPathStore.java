package org.stackgraphs.storage.api;

import java.util.List;
import java.util.Optional;

/**
 * Path database: persists graph fragments and partial paths per file and serves the lookups
 * needed for stitching.
 * <p>
 * <strong>Atomicity:</strong> {@link #storeFile(FileIndex)} replaces all rows of one file as a
 * unit; readers see either the old or the new rows, never a mixture. Rows of other files are
 * neither read nor written.
 * <p>
 * <strong>Ordering:</strong> lookups return records ordered by file name, then ordinal.
 * <p>
 * <strong>Thread Safety:</strong> implementations must be safe for concurrent use. Callers
 * serialize writes to the same file.
 */
public interface IPartialPathStore extends AutoCloseable {

    /**
     * Replaces the stored fragment and partial paths of {@code index.file()}.
     *
     * @throws StorageException if the write failed; the previous rows remain in place
     */
    void storeFile(FileIndex index) throws StorageException;

    /**
     * Removes every row of {@code file}.
     *
     * @return {@code true} if the file was present
     */
    boolean deleteFile(String file) throws StorageException;

    boolean containsFile(String file) throws StorageException;

    /**
     * Version tag stored with the file; present iff the file is stored, empty string when the
     * file was stored without a tag.
     */
    Optional<String> fileTag(String file) throws StorageException;

    /**
     * Names of all stored files in ascending order.
     */
    List<String> listFiles() throws StorageException;

    Optional<GraphFragment> loadGraphFragment(String file) throws StorageException;

    List<PartialPathRecord> findPathsByFile(String file) throws StorageException;

    List<PartialPathRecord> findPathsByStartNode(NodeKey start) throws StorageException;

    List<PartialPathRecord> findPathsByEndNode(NodeKey end) throws StorageException;

    /**
     * Paths leaving the root whose precondition starts with {@code symbol} or has no concrete
     * entry at all.
     */
    List<PartialPathRecord> findRootPathsByPreconditionSymbol(String symbol) throws StorageException;

    /**
     * Paths arriving at the root whose postcondition starts with {@code symbol} or has no
     * concrete entry at all.
     */
    List<PartialPathRecord> findRootPathsByPostconditionSymbol(String symbol) throws StorageException;

    @Override
    void close();
}
