package org.pragmatica.packrat.parser;

/**
 * Matches if the child does not match at the current position.
 */
public class NegativeLookahead extends Lookahead {

    public NegativeLookahead(Parser parser) {
        super(parser);
    }

    @Override
    protected boolean match(ParsingContext ctx, boolean childMatched) {
        return negativeMatch(ctx, childMatched);
    }

    @Override
    public String describe() {
        return "!" + parser.repr();
    }
}
