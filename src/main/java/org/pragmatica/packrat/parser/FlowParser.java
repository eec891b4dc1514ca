package org.pragmatica.packrat.parser;

/**
 * Base class of parsers that test the text around the current position without consuming it.
 */
public abstract class FlowParser extends UnaryParser {

    protected FlowParser(Parser parser) {
        super(parser);
    }

    /**
     * Decides whether the flow parser matches, given whether its child matched.
     */
    protected boolean match(ParsingContext ctx, boolean childMatched) {
        return childMatched;
    }

    /**
     * Match decision of the negative variants. A failure that the negation expected must
     * not count as the farthest failure, so its position is inverted.
     */
    static boolean negativeMatch(ParsingContext ctx, boolean childMatched) {
        if (childMatched) {
            return false;
        }
        ctx.invertFarthestFail();
        return true;
    }
}
