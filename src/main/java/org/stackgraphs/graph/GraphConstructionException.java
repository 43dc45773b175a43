package org.stackgraphs.graph;

/**
 * Thrown when the caller of the graph builder API violates its contract.
 * <p>
 * Construction errors are programming errors of the graph producer and are therefore unchecked.
 */
public class GraphConstructionException extends RuntimeException {

    public GraphConstructionException(String message) {
        super(message);
    }

    public GraphConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
