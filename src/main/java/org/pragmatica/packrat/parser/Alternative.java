package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ordered choice: returns the result of the first alternative that matches.
 */
public class Alternative extends NaryParser {

    public Alternative(List<Parser> parsers) {
        super(parsers);
    }

    public Alternative(Parser... parsers) {
        this(List.of(parsers));
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        for (var parser : parsers) {
            var result = parser.invoke(ctx, location);
            if (result instanceof ParseResult.Match match) {
                return ParseResult.Match.of(returnValue(match.node()), match.rest());
            }
            if (result instanceof ParseResult.Failure) {
                return result;
            }
        }
        return ParseResult.NoMatch.at(location);
    }

    @Override
    public boolean isOptional() {
        return parsers.get(parsers.size() - 1).isOptional();
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        var location = locationInfo(grammar.associatedSymbol(this).name());
        var distinct = Collections.newSetFromMap(new IdentityHashMap<Parser, Boolean>());
        distinct.addAll(parsers);
        if (distinct.size() != parsers.size()) {
            errors.add(staticError(grammar, "Duplicate parsers in " + location,
                                   ErrorCode.DUPLICATE_PARSERS_IN_ALTERNATIVE));
        }
        for (int i = 0; i < parsers.size() - 1; i++) {
            if (parsers.get(i).isOptional()) {
                errors.add(staticError(grammar,
                                       "Parser-specification Error in " + location
                                       + "\nOnly the very last alternative may be optional! "
                                       + String.format("Parser \"%s\" at position %d out of %d is optional",
                                                       parsers.get(i).nodeName(), i + 1, parsers.size()),
                                       ErrorCode.BAD_ORDER_OF_ALTERNATIVES));
                break;
            }
        }
        var cache = new IdentityHashMap<Parser, String>();
        for (int i = 2; i < parsers.size(); i++) {
            var fixedStart = startingString(parsers.get(i), cache);
            if (fixedStart.isEmpty()) {
                continue;
            }
            for (int k = 0; k < i; k++) {
                if (grammar.preempts(fixedStart, parsers.get(k))) {
                    errors.add(staticError(grammar,
                                           "Parser-specification Error in " + location
                                           + String.format("\nAlternative %d will never be reached, because its "
                                                           + "starting-string \"%s\" is already captured by earlier "
                                                           + "alternative %d !", i + 1, fixedStart, k + 1),
                                           ErrorCode.BAD_ORDER_OF_ALTERNATIVES));
                }
            }
        }
        return errors;
    }

    /**
     * The fixed string every match of {@code parser} starts with, or the empty string.
     */
    static String startingString(Parser parser, Map<Parser, String> cache) {
        if (parser instanceof NegativeLookahead || parser instanceof Lookbehind) {
            return "";
        }
        var known = cache.get(parser);
        if (known != null) {
            return known;
        }
        cache.put(parser, "");
        String result = "";
        if (parser instanceof Text text) {
            result = text.text();
        } else if (parser instanceof Series || parser instanceof Alternative) {
            result = startingString(((NaryParser) parser).parsers().get(0), cache);
        } else if (parser instanceof Synonym || parser instanceof OneOrMore || parser instanceof Lookahead
                   || parser instanceof Forward) {
            result = startingString(((UnaryParser) parser).parser(), cache);
        } else if (parser instanceof Counted counted) {
            if (!counted.isOptional()) {
                result = startingString(counted.parser(), cache);
            }
        } else if (parser instanceof Interleave interleave) {
            if (interleave.repetitions().get(0).min() >= 1) {
                result = startingString(interleave.parsers().get(0), cache);
            }
        }
        cache.put(parser, result);
        return result;
    }

    @Override
    public String describe() {
        var body = parsers.stream().map(Parser::repr).collect(Collectors.joining(" | "));
        return name().isEmpty() ? "(" + body + ")" : body;
    }
}
