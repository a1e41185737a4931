package org.pragmatica.rollkit.tree;

/**
 * A range in expression text from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    /**
     * True when the other span starts exactly where this one ends.
     */
    public boolean touches(SourceSpan other) {
        return end.offset() == other.start.offset();
    }

    /**
     * Smallest span covering both this span and the other one.
     */
    public SourceSpan to(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
