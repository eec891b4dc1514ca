package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;

/**
 * Applies the child as often as it matches and moves forward. Always matches.
 */
public class ZeroOrMore extends Option {

    public ZeroOrMore(Parser parser) {
        super(parser);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var results = new ArrayList<Node>();
        int pos = location;
        while (true) {
            var result = parser.invoke(ctx, pos);
            if (result instanceof ParseResult.Failure) {
                return result;
            }
            if (!(result instanceof ParseResult.Match match)) {
                break;
            }
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
        return ParseResult.Match.of(returnValues(results), pos);
    }

    @Override
    public String describe() {
        return "{" + innerRepr() + "}";
    }
}
