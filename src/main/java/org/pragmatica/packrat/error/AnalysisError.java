package org.pragmatica.packrat.error;

import org.pragmatica.packrat.parser.Parser;

/**
 * Configuration problem found by the static analysis of a grammar.
 *
 * @param symbol Name of the grammar symbol the offending parser belongs to
 * @param parser The offending parser
 * @param error  The diagnostic describing the problem
 */
public record AnalysisError(String symbol, Parser parser, Diagnostic error) {

    public boolean isError() {
        return error.isError();
    }

    @Override
    public String toString() {
        return symbol + ": " + error.severity().display() + " (" + error.code().code() + "): " + error.message();
    }
}
