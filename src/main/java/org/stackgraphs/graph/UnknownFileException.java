package org.stackgraphs.graph;

/**
 * Thrown when a node is added for a file that was not registered with the graph.
 */
public class UnknownFileException extends GraphConstructionException {

    public UnknownFileException(String message) {
        super(message);
    }
}
