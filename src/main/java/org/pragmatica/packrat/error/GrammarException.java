package org.pragmatica.packrat.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when the static analysis of a grammar reveals errors.
 */
public final class GrammarException extends RuntimeException {
    private final List<AnalysisError> errors;

    public GrammarException(List<AnalysisError> errors) {
        super(errors.stream()
                    .map(AnalysisError::toString)
                    .collect(Collectors.joining("\n", "Grammar analysis failed:\n", "")));
        this.errors = List.copyOf(errors);
    }

    public List<AnalysisError> errors() {
        return errors;
    }
}
