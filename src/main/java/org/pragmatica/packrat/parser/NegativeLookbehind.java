package org.pragmatica.packrat.parser;

/**
 * Matches if the text before the current position does not end with the child's match.
 */
public class NegativeLookbehind extends Lookbehind {

    public NegativeLookbehind(Parser parser) {
        super(parser);
    }

    @Override
    protected boolean match(ParsingContext ctx, boolean childMatched) {
        return negativeMatch(ctx, childMatched);
    }

    @Override
    public String describe() {
        return "-!" + parser.repr();
    }
}
