package org.pragmatica.packrat.grammar;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.parser.Parser;
import org.pragmatica.packrat.parser.RegExp;
import org.pragmatica.packrat.tree.Node;
import org.pragmatica.packrat.tree.SourceLocation;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One completed parser call, recorded when history tracking is on.
 *
 * @param callStack The parsers on the call stack when the call returned, innermost last
 * @param node      The resulting node, {@code null} if the parser did not match
 * @param location  Position the parser was called at
 * @param rest      Position behind the match, or the call position
 * @param lineCol   Line and column of the call position
 * @param errors    Errors raised by the call
 */
public record HistoryRecord(
    List<CallItem> callStack,
    Node node,
    int location,
    int rest,
    SourceLocation lineCol,
    List<Diagnostic> errors
) {
    private static final int EXCERPT_LENGTH = 20;

    public enum Status {
        MATCH,
        DROP,
        FAIL,
        ERROR
    }

    /**
     * A parser together with the position it was called at.
     */
    public record CallItem(Parser parser, int location) {}

    public Status status() {
        if (node == null) {
            return Status.FAIL;
        }
        if (!errors.isEmpty()) {
            return Status.ERROR;
        }
        return node == Node.EMPTY ? Status.DROP : Status.MATCH;
    }

    /**
     * The call stack rendered as {@code symbol->:Series->/\d+/}.
     */
    public String stack() {
        return callStack.stream()
                        .map(HistoryRecord::label)
                        .collect(Collectors.joining("->"));
    }

    private static String label(CallItem item) {
        var parser = item.parser();
        if (parser instanceof RegExp) {
            return parser.repr();
        }
        return parser.name().isEmpty() ? parser.ptype() : parser.name();
    }

    /**
     * Beginning of the matched text with control characters escaped.
     */
    public String excerpt() {
        if (node == null) {
            return "";
        }
        var content = node.content();
        var excerpt = content.length() > EXCERPT_LENGTH ? content.substring(0, EXCERPT_LENGTH) : content;
        excerpt = excerpt.replace("\n", "\\n").replace("\t", "\\t").replace("\r", "\\r");
        return content.length() > EXCERPT_LENGTH ? excerpt + "..." : excerpt;
    }

    public static Optional<HistoryRecord> lastMatch(List<HistoryRecord> history) {
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).status() == Status.MATCH) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * The failed call with the largest position; the latest one among equals.
     */
    public static Optional<HistoryRecord> mostAdvancedFail(List<HistoryRecord> history) {
        HistoryRecord result = null;
        for (var record : history) {
            if (record.status() == Status.FAIL && (result == null || record.location() >= result.location())) {
                result = record;
            }
        }
        return Optional.ofNullable(result);
    }

    @Override
    public String toString() {
        return String.format("%4d, %2d:  %s;  %s;  \"%s\"",
                             lineCol.line(), lineCol.column(), stack(), status(), excerpt());
    }
}
