package org.stackgraphs.index;

/**
 * Unchecked wrapper for storage failures raised while a {@link ResolutionQuery} is iterated.
 */
public class ResolutionFailedException extends RuntimeException {

    public ResolutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
