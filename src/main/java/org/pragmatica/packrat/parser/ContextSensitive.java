package org.pragmatica.packrat.parser;

/**
 * Base class of parsers that read or change the variable stacks of a parse run.
 *
 * <p>Their results depend on more than the document position, so they are never
 * memoized and do not share memoization tables with other parsers.
 */
public abstract class ContextSensitive extends UnaryParser {

    protected ContextSensitive(Parser parser) {
        super(parser);
    }

    @Override
    boolean isMemoizable() {
        return false;
    }

    @Override
    protected Object signatureKey() {
        return this;
    }

    /**
     * Position at which a variable change is undone when backtracking. A change by a
     * zero-length match is tagged one position earlier, so that the parsers following
     * at the same position do not undo it.
     */
    protected static int rollbackLocation(int location, int rest) {
        return rest == location ? location - 1 : location;
    }
}
