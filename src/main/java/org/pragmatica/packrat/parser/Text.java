package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches a fixed string.
 */
public final class Text extends Parser {
    private final String text;

    public Text(String text) {
        this.text = checkNotNull(text, "text");
    }

    public String text() {
        return text;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        if (!ctx.document().startsWith(text, location)) {
            return ParseResult.NoMatch.at(location);
        }
        int end = location + text.length();
        if (dropsContent()) {
            return ParseResult.Match.of(Node.EMPTY, end);
        }
        if (!text.isEmpty() || !isDisposable()) {
            return ParseResult.Match.of(Node.leaf(nodeName(), text), end);
        }
        return ParseResult.Match.of(Node.EMPTY, location);
    }

    @Override
    public boolean isOptional() {
        return text.isEmpty();
    }

    @Override
    protected Object signatureKey() {
        return List.of("Text", text);
    }

    @Override
    public String describe() {
        return "`" + Abbreviation.middle(text, 80) + "`";
    }
}
