package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the child at least {@code min} and at most {@code max} times.
 */
public class Counted extends UnaryParser {
    public static final int INFINITE = 1 << 30;

    private final int min;
    private final int max;

    public Counted(Parser parser, int min, int max) {
        super(parser);
        this.min = min;
        this.max = max;
    }

    public int min() {
        return min;
    }

    public int max() {
        return max;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var results = new ArrayList<Node>();
        int pos = location;
        boolean stalled = false;
        for (int i = 0; i < min && !stalled; i++) {
            var result = parser.invoke(ctx, pos);
            if (result instanceof ParseResult.Failure) {
                return result;
            }
            if (!(result instanceof ParseResult.Match match)) {
                return ParseResult.NoMatch.at(location);
            }
            results.add(match.node());
            stalled = match.rest() == pos;
            pos = match.rest();
        }
        for (int i = 0; i < max - min && !stalled; i++) {
            var result = parser.invoke(ctx, pos);
            if (result instanceof ParseResult.Failure) {
                return result;
            }
            if (!(result instanceof ParseResult.Match match)) {
                break;
            }
            results.add(match.node());
            stalled = match.rest() == pos;
            pos = match.rest();
        }
        return ParseResult.Match.of(returnValues(results), pos);
    }

    @Override
    public boolean isOptional() {
        return min == 0;
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (min < 0 || max < 0 || min > max || min > INFINITE || max > INFINITE) {
            errors.add(staticError(grammar,
                                   String.format("Repetition count [a=%d, b=%d] for parser %s violates requirement "
                                                 + "0 <= a <= b <= infinity = 2^30", min, max, this),
                                   ErrorCode.BAD_REPETITION_COUNT));
        }
        return errors;
    }

    @Override
    protected Object signatureKey() {
        return List.of("Counted", reduction(), parser.signature(), min, max);
    }

    @Override
    public String describe() {
        return parser.repr() + "{" + min + "," + max + "}";
    }
}
