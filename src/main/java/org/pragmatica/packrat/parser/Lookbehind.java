package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Matches if the text before the current position ends with the child's match.
 *
 * <p>Only {@link Text} and {@link RegExp} children are supported, possibly behind
 * synonyms. A text is compared with the preceding characters as written. A pattern is
 * applied to the reversed preceding text and must therefore be written backwards.
 */
public class Lookbehind extends FlowParser {
    private final String reversedText;
    private final RegExp regExp;

    public Lookbehind(Parser parser) {
        super(parser);
        var p = parser;
        while (p instanceof Synonym synonym) {
            p = synonym.parser();
        }
        checkArgument(p instanceof RegExp || p instanceof Text,
                      "Lookbehind requires a text or regular expression parser, got %s", parser);
        if (p instanceof RegExp re) {
            this.regExp = re;
            this.reversedText = null;
        } else {
            this.regExp = null;
            this.reversedText = new StringBuilder(((Text) p).text()).reverse().toString();
        }
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var backwards = ctx.reversedDocument();
        int start = ctx.documentLength() - location;
        boolean matches = reversedText != null
                          ? backwards.startsWith(reversedText, start)
                          : regExp.matchAt(backwards, start).isMatch();
        if (match(ctx, matches)) {
            return ParseResult.Match.of(dropsContent() ? Node.EMPTY : Node.leaf(nodeName(), ""), location);
        }
        return ParseResult.NoMatch.at(location);
    }

    @Override
    public String describe() {
        return "-&" + parser.repr();
    }
}
