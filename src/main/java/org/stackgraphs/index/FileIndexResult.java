package org.stackgraphs.index;

/**
 * Outcome of indexing one file.
 *
 * @param file      file name
 * @param tag       version tag stored with the file's rows
 * @param pathCount number of partial paths stored
 * @param skipped   {@code true} if the stored rows already carried {@code tag} and nothing was written
 */
public record FileIndexResult(String file, String tag, int pathCount, boolean skipped) {
}
