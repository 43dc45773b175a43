package org.stackgraphs.graph;

import org.stackgraphs.arena.Handle;

/**
 * Directed edge. Lower precedence values are explored first.
 */
public record Edge(Handle<Node> source, Handle<Node> sink, int precedence) {
}
