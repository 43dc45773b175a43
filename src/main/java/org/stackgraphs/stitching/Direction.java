package org.stackgraphs.stitching;

/**
 * Which end of the frontier paths a stitcher extends.
 */
public enum Direction {
    /** Extend at the end node: from references towards definitions. */
    FORWARD,
    /** Extend at the start node: from definitions towards references. */
    BACKWARD
}
