package org.pragmatica.packrat.error;

import org.pragmatica.packrat.tree.LineIndex;
import org.pragmatica.packrat.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnostic message produced while parsing or while analysing a grammar.
 *
 * <p>Positions are absolute document offsets; {@link #span(LineIndex)} resolves them
 * to lines and columns. Rust-style rendering:
 * <pre>
 * error[1010]: '/\d+/' expected by parser 'number', but »x...« found instead!
 *   --> input:1:4
 *    |
 *  1 | 42.x
 *    |    ^
 *    |
 * </pre>
 *
 * @param code    Error code, determines the severity
 * @param message Primary message
 * @param pos     Absolute document position, -1 for diagnostics not tied to a document
 * @param length  Number of characters the diagnostic refers to (at least 1 when rendered)
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(
    ErrorCode code,
    String message,
    int pos,
    int length,
    List<String> notes
) {
    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("notice");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic of(ErrorCode code, String message, int pos) {
        return new Diagnostic(code, message, pos, 1, List.of());
    }

    public static Diagnostic of(ErrorCode code, String message, int pos, int length) {
        return new Diagnostic(code, message, pos, length, List.of());
    }

    public Severity severity() {
        return code.severity();
    }

    public boolean isError() {
        return code.isError();
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, pos, length, List.copyOf(newNotes));
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    public SourceSpan span(LineIndex index) {
        return SourceSpan.of(index, Math.max(pos, 0), length);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var span = span(LineIndex.of(source));

        // Header: error[1010]: message
        sb.append(severity().display())
          .append("[").append(code.code()).append("]")
          .append(": ").append(message).append("\n");

        // Location: --> filename:line:column
        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(loc.line()).append(":").append(loc.column()).append("\n");

        int minLine = span.start().line();
        int maxLine = span.end().line();
        int gutterWidth = String.valueOf(maxLine).length();

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            String lineContent = lines[lineNum - 1];
            String lineNumStr = String.format("%" + gutterWidth + "d", lineNum);

            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ");
            sb.append(underline(span, lineNum, lineContent));
            sb.append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    private static String underline(SourceSpan span, int lineNum, String lineContent) {
        var columns = span.columnsOn(lineNum, lineContent.length());
        return " ".repeat(Math.max(0, columns[0] - 1)) + "^".repeat(columns[1] - columns[0]);
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple(LineIndex index) {
        var loc = index.location(Math.max(pos, 0));
        return String.format("%d:%d: %s (%d): %s",
            loc.line(), loc.column(), severity().display(), code.code(), message);
    }

    @Override
    public String toString() {
        return (pos >= 0 ? pos + ": " : "") + severity().display() + " (" + code.code() + "): " + message;
    }
}
