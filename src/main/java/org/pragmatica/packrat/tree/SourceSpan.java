package org.pragmatica.packrat.tree;

/**
 * Text covered by a diagnostic, from start (inclusive) to end (exclusive).
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    /**
     * Span of {@code length} characters starting at {@code offset}, resolved against the index.
     */
    public static SourceSpan of(LineIndex index, int offset, int length) {
        return new SourceSpan(index.location(offset), index.location(offset + Math.max(length, 0)));
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isMultiLine() {
        return end.line() > start.line();
    }

    /**
     * First and last column (1-based, last exclusive) of the span on line {@code line},
     * where {@code lineLength} is the length of that line without its line break.
     */
    public int[] columnsOn(int line, int lineLength) {
        int from = line == start.line() ? start.column() : 1;
        int to = line == end.line() ? end.column() : lineLength + 1;
        return new int[]{from, Math.max(to, from + 1)};
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
