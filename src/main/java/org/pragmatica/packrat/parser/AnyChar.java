package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.List;

/**
 * Matches any single character; fails only at the end of the document.
 */
public final class AnyChar extends Parser {

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var document = ctx.document();
        if (location >= document.length()) {
            return ParseResult.NoMatch.at(location);
        }
        int end = Character.isHighSurrogate(document.charAt(location)) && location + 1 < document.length()
                  ? location + 2
                  : location + 1;
        if (dropsContent()) {
            return ParseResult.Match.of(Node.EMPTY, end);
        }
        return ParseResult.Match.of(Node.leaf(nodeName(), document.substring(location, end)), end);
    }

    @Override
    protected Object signatureKey() {
        return List.of("AnyChar");
    }
}
