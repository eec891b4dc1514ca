package org.pragmatica.packrat.parser;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Combining parser with exactly one child.
 */
public abstract class UnaryParser extends CombinedParser {
    protected Parser parser;

    protected UnaryParser(Parser parser) {
        this.parser = checkNotNull(parser, "parser");
    }

    /**
     * For parsers whose child is only known after construction.
     */
    protected UnaryParser() {
        this.parser = null;
    }

    public Parser parser() {
        return parser;
    }

    @Override
    public List<Parser> subParsers() {
        return List.of(parser);
    }

    @Override
    protected Object signatureKey() {
        return List.of(getClass().getSimpleName(), reduction(), parser.signature());
    }
}
