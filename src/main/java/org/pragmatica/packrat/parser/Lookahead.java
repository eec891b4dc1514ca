package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches if the child matches at the current position, without consuming any text.
 */
public class Lookahead extends FlowParser {

    public Lookahead(Parser parser) {
        super(parser);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var result = parser.invoke(ctx, location);
        if (result instanceof ParseResult.Failure) {
            return result;
        }
        if (match(ctx, result.isMatch())) {
            return ParseResult.Match.of(isDisposable() ? Node.EMPTY : Node.leaf(nodeName(), ""), location);
        }
        return ParseResult.NoMatch.at(location);
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (parser.isOptional()) {
            errors.add(staticError(grammar,
                                   String.format("Lookahead %s does not make sense with optional parser \"%s\"!",
                                                 repr(), parser),
                                   ErrorCode.LOOKAHEAD_WITH_OPTIONAL_PARSER));
        }
        return errors;
    }

    @Override
    public String describe() {
        return "&" + parser.repr();
    }
}
