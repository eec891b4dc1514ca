package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Pushes the text matched by its child onto the variable stack named after the
 * capture parser. Only named captures are valid.
 */
public class Capture extends ContextSensitive {
    private final boolean zeroLengthWarning;

    public Capture(Parser parser, boolean zeroLengthWarning) {
        super(parser);
        this.zeroLengthWarning = zeroLengthWarning;
    }

    public Capture(Parser parser) {
        this(parser, true);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var result = parser.invoke(ctx, location);
        if (!(result instanceof ParseResult.Match match)) {
            return result;
        }
        var stack = ctx.variable(name());
        stack.add(match.node().content());
        ctx.pushRollback(rollbackLocation(location, match.rest()), () -> stack.remove(stack.size() - 1));
        return ParseResult.Match.of(returnValue(match.node()), match.rest());
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (name().isEmpty()) {
            errors.add(staticError(grammar, "Capture only works as named parser! Error in parser: " + this,
                                   ErrorCode.CAPTURE_WITHOUT_PARSERNAME));
        }
        var label = name().isEmpty() ? toString() : name();
        if (parser.apply(path -> path.get(path.size() - 1).dropsContent())) {
            errors.add(staticError(grammar,
                                   "Captured symbol \"" + label + "\" contains parsers that drop content, "
                                   + "which can lead to unintended results!",
                                   ErrorCode.CAPTURE_DROPPED_CONTENT_WARNING));
        }
        if (zeroLengthWarning && grammar.matchesEmptyDocument(parser)) {
            errors.add(staticError(grammar,
                                   "Variable \"" + label + "\" captures zero length strings, which can lead to "
                                   + "its remaining on the stack after backtracking!",
                                   ErrorCode.ZERO_LENGTH_CAPTURE_POSSIBLE_WARNING));
        }
        return errors;
    }

    @Override
    public String describe() {
        return parser.repr();
    }
}
