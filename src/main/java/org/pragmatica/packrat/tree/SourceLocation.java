package org.pragmatica.packrat.tree;

/**
 * Line and column (both 1-based) of a document offset. Ordered by offset.
 */
public record SourceLocation(int line, int column, int offset) implements Comparable<SourceLocation> {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    @Override
    public int compareTo(SourceLocation other) {
        return Integer.compare(offset, other.offset);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
