package org.pragmatica.packrat.tree;

import java.util.Arrays;

/**
 * Line-break index of a document, resolving absolute offsets to line and column.
 *
 * <p>One position behind the end of the document is still a valid offset.
 */
public final class LineIndex {
    // -1, the offsets of all '\n', document length
    private final int[] breaks;

    private LineIndex(int[] breaks) {
        this.breaks = breaks;
    }

    public static LineIndex of(CharSequence text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        var breaks = new int[count + 2];
        breaks[0] = -1;
        int k = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                breaks[k++] = i;
            }
        }
        breaks[k] = text.length();
        return new LineIndex(breaks);
    }

    public SourceLocation location(int offset) {
        int clamped = Math.max(0, Math.min(offset, breaks[breaks.length - 1]));
        int idx = Arrays.binarySearch(breaks, clamped);
        int line = idx >= 0 ? idx : -idx - 1;
        if (line == 0) {
            line = 1;
        }
        int column = clamped - breaks[line - 1];
        return SourceLocation.at(line, column, clamped);
    }

    public int lineCount() {
        return breaks.length - 1;
    }
}
