package org.stackgraphs.storage.api;

import java.util.List;

/**
 * Everything the path database holds for one file; replaced as a unit.
 *
 * @param file     the file name
 * @param tag      caller-supplied version tag (e.g. a content hash), may be empty
 * @param fragment the file's part of the stack graph
 * @param paths    the file's partial paths in finder order
 */
public record FileIndex(String file, String tag, GraphFragment fragment, List<PartialPathRecord> paths) {
}
