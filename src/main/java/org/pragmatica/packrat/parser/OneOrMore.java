package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the child as often as it matches and moves forward; at least one match is required.
 */
public class OneOrMore extends UnaryParser {

    public OneOrMore(Parser parser) {
        super(parser);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var results = new ArrayList<Node>();
        boolean matched = false;
        int pos = location;
        while (true) {
            var result = parser.invoke(ctx, pos);
            if (result instanceof ParseResult.Failure) {
                return result;
            }
            if (!(result instanceof ParseResult.Match match)) {
                break;
            }
            matched = true;
            var node = match.node();
            if (node.hasResult() || !node.isAnonymous()) {
                results.add(node);
            }
            boolean progressed = match.rest() > pos;
            pos = match.rest();
            if (!progressed) {
                break;
            }
        }
        if (!matched) {
            return ParseResult.NoMatch.at(location);
        }
        return ParseResult.Match.of(returnValues(results), pos);
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (parser.isOptional()) {
            errors.add(staticError(grammar,
                                   "Use ZeroOrMore instead of nesting OneOrMore with an optional parser in "
                                   + locationInfo(grammar.associatedSymbol(this).name()),
                                   ErrorCode.BADLY_NESTED_OPTIONAL_PARSER));
        }
        return errors;
    }

    @Override
    public String describe() {
        var repr = parser.repr();
        if (parser instanceof Alternative && parser.name().isEmpty()) {
            repr = repr.substring(1, repr.length() - 1);
        }
        return "{" + repr + "}+";
    }
}
