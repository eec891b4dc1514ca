package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Gives the result of another parser a different name.
 *
 * <p>Needed for grammar rules like {@code year = YEAR_NUMBER}, where the node should be
 * named {@code year}. An anonymous child node is renamed, a named one is wrapped.
 */
public class Synonym extends UnaryParser {

    public Synonym(Parser parser) {
        super(parser);
        checkArgument(!parser.dropsContent(), "Synonym of parser %s that drops its content", parser);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var result = parser.invoke(ctx, location);
        if (!(result instanceof ParseResult.Match match)) {
            return result;
        }
        if (dropsContent()) {
            return ParseResult.Match.of(Node.EMPTY, match.rest());
        }
        var node = match.node();
        if (isDisposable()) {
            return match;
        }
        if (node == Node.EMPTY) {
            return ParseResult.Match.of(Node.leaf(nodeName(), ""), match.rest());
        }
        if (node.isAnonymous()) {
            return ParseResult.Match.of(Node.renamed(nodeName(), node), match.rest());
        }
        return ParseResult.Match.of(Node.branch(nodeName(), node), match.rest());
    }

    @Override
    public String describe() {
        return parser.repr();
    }
}
