package org.stackgraphs.storage.api;

/**
 * Graph-independent identity of a node as stored in the path database.
 *
 * @param file    owning file name, or {@code ""} for the root and jump-to nodes
 * @param localId identifier within the file
 */
public record NodeKey(String file, int localId) {

    public static final String GLOBAL_FILE = "";
    public static final NodeKey ROOT = new NodeKey(GLOBAL_FILE, 1);
    public static final NodeKey JUMP_TO = new NodeKey(GLOBAL_FILE, 2);

    public NodeKey {
        if (file == null) {
            throw new IllegalArgumentException("NodeKey file must not be null (use \"\" for global nodes)");
        }
    }

    public boolean isGlobal() {
        return file.isEmpty();
    }

    @Override
    public String toString() {
        return (isGlobal() ? "<global>" : file) + ":" + localId;
    }
}
