package org.stackgraphs.storage.api;

/**
 * Checked exception for failures of the path database (I/O, SQL, corrupt rows).
 * <p>
 * Query code surfaces these to the caller; they are never turned into empty results.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
