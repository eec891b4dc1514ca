package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Always matches: the child's result if the child matches, nothing otherwise.
 */
public class Option extends UnaryParser {

    public Option(Parser parser) {
        super(parser);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var result = parser.invoke(ctx, location);
        if (result instanceof ParseResult.Match match) {
            return ParseResult.Match.of(returnValue(match.node()), match.rest());
        }
        if (result instanceof ParseResult.NoMatch) {
            return ParseResult.Match.of(returnValue(null), location);
        }
        return result;
    }

    @Override
    public boolean isOptional() {
        return true;
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (parser.isOptional()) {
            errors.add(staticError(grammar,
                                   "Redundant nesting of optional parser in "
                                   + locationInfo(grammar.associatedSymbol(this).name()),
                                   ErrorCode.OPTIONAL_REDUNDANTLY_NESTED_WARNING));
        }
        return errors;
    }

    /**
     * Representation of the child inside brackets; an unnamed alternative loses its parentheses.
     */
    String innerRepr() {
        var repr = parser.repr();
        if (parser instanceof Alternative && parser.name().isEmpty()) {
            return repr.substring(1, repr.length() - 1);
        }
        return repr;
    }

    @Override
    public String describe() {
        return "[" + innerRepr() + "]";
    }
}
