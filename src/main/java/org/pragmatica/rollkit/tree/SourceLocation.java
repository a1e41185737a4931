package org.pragmatica.rollkit.tree;

/**
 * A position in expression text (line and column are 1-based, offset is 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    /**
     * Location just past the given character; a newline moves to column 1 of the next line.
     */
    public SourceLocation advance(char c) {
        return c == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
