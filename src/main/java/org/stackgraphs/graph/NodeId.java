package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Stable identity of a node: the owning file plus an identifier that is unique within that file.
 * The two global nodes (root and jump-to) have no file.
 *
 * @param file    owning file, or {@code null} for the global nodes
 * @param localId identifier within the file
 */
public record NodeId(Handle<SourceFile> file, int localId) {

    public boolean isGlobal() {
        return file == null;
    }

    public boolean isInFile(Handle<SourceFile> other) {
        return file != null && file.equals(other);
    }

    @Override
    public String toString() {
        return (file == null ? "[global]" : "[file " + file.index() + "]") + ":" + localId;
    }
}
