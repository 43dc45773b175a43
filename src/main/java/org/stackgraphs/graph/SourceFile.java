package org.stackgraphs.graph;

/**
 * An interned, path-like file name. Every non-global node belongs to exactly one file.
 *
 * @param name the file name as supplied by the caller
 */
public record SourceFile(String name) {

    public SourceFile {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("File name must not be null or empty");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
