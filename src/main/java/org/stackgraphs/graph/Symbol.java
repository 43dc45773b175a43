package org.stackgraphs.graph;

/**
 * An interned identifier. Two symbols of the same graph are equal iff their handles are equal.
 *
 * @param name the identifier text
 */
public record Symbol(String name) {

    public Symbol {
        if (name == null) {
            throw new IllegalArgumentException("Symbol name must not be null");
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
