package org.stackgraphs.graph;

/**
 * Half-open source range {@code [start, end)}.
 */
public record SourceSpan(Position start, Position end) {

    public SourceSpan {
        if (start.compareTo(end) > 0) {
            throw new IllegalArgumentException("Span start " + start + " is after end " + end);
        }
    }

    public boolean contains(Position position) {
        return start.compareTo(position) <= 0 && position.compareTo(end) < 0;
    }

    /**
     * Whether any line of this span lies within {@code [firstLine, lastLine]} (inclusive).
     */
    public boolean intersectsLines(int firstLine, int lastLine) {
        return start.line() <= lastLine && end.line() >= firstLine;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
