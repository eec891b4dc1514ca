package org.pragmatica.packrat.grammar;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.tree.Node;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of a parse run: the syntax tree and the diagnostics collected on the way.
 *
 * <p>There always is a tree. When parsing failed, it consists of error nodes
 * ({@code ZOMBIE__}) covering the unparsed text, so that its content still reproduces the
 * document.
 *
 * @param root        The root of the syntax tree
 * @param diagnostics Diagnostics in document order
 * @param source      The parsed document (for formatting diagnostics)
 */
public record ParseResultWithDiagnostics(
    Node root,
    List<Diagnostic> diagnostics,
    String source
) {
    public ParseResultWithDiagnostics {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * True if no diagnostic has error severity. Warnings and notices are allowed.
     */
    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * The diagnostics with error severity.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).collect(Collectors.toList());
    }

    public int errorCount() {
        return count(Diagnostic.Severity.ERROR);
    }

    public int warningCount() {
        return count(Diagnostic.Severity.WARNING);
    }

    private int count(Diagnostic.Severity severity) {
        return (int) diagnostics.stream().filter(d -> d.severity() == severity).count();
    }

    /**
     * All diagnostics in Rust style, each followed by an empty line.
     *
     * @param filename Name shown in the location lines, may be {@code null}
     */
    public String formatDiagnostics(String filename) {
        return diagnostics.stream()
                          .map(diagnostic -> diagnostic.format(source, filename) + "\n")
                          .collect(Collectors.joining());
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}
