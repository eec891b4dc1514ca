package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Matches if all parsers match in order.
 *
 * <p>A failure of a parser at or behind the mandatory index is a syntax error: the
 * series reports it, tries to continue behind a reentry point found by the skip rules
 * of its symbol and otherwise signals a {@link ParseResult.Failure}.
 */
public class Series extends MandatoryNary {

    public Series(List<Parser> parsers, int mandatory) {
        super(parsers, mandatory);
    }

    public Series(List<Parser> parsers) {
        this(parsers, NO_MANDATORY);
    }

    public Series(Parser... parsers) {
        this(List.of(parsers), NO_MANDATORY);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var results = new ArrayList<Node>(parsers.size());
        int pos = location;
        Diagnostic error = null;
        int reloc = -1;
        for (int i = 0; i < parsers.size(); i++) {
            var parser = parsers.get(i);
            var result = parser.invoke(ctx, pos);
            if (result instanceof ParseResult.Failure) {
                return result;
            }
            Node node;
            if (result instanceof ParseResult.Match match) {
                node = match.node();
                pos = match.rest();
            } else {
                if (i < mandatory) {
                    return ParseResult.NoMatch.at(location);
                }
                var expected = parser instanceof ContextSensitive ? parser.toString() : parser.repr();
                var reentry = reentryPoint(ctx, pos);
                reloc = reentry.offset();
                node = reentry.skipped();
                var violation = mandatoryViolation(ctx, pos, parser instanceof Lookahead, expected, reloc, node);
                error = violation.error();
                pos = violation.continueAt();
                if (reloc < 0) {
                    results.add(node);
                    break;
                }
                var retry = parser.invoke(ctx, pos);
                if (retry instanceof ParseResult.Failure) {
                    return retry;
                }
                if (retry instanceof ParseResult.Match match) {
                    results.add(node);
                    node = match.node();
                    pos = match.rest();
                }
            }
            if (node.hasResult() || !node.isAnonymous()) {
                results.add(node);
            }
        }
        var node = returnValues(results);
        if (error != null && reloc < 0) {
            return new ParseResult.Failure(this, node, pos - location, location, error, true);
        }
        return ParseResult.Match.of(node, pos);
    }

    @Override
    public String describe() {
        var parts = new ArrayList<String>(parsers.size() + 1);
        for (int i = 0; i < parsers.size(); i++) {
            if (i == mandatory) {
                parts.add("§");
            }
            parts.add(parsers.get(i).repr());
        }
        return String.join(" ", parts);
    }
}
