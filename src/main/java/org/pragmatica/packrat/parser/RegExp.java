package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import java.util.List;
import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches a regular expression at the current position.
 *
 * <p>The pattern sees the text before the current position, so lookbehind inside the
 * pattern works, but {@code ^} only matches at line starts in multiline mode.
 */
public class RegExp extends Parser {
    private final Pattern pattern;

    public RegExp(Pattern pattern) {
        this.pattern = checkNotNull(pattern, "pattern");
    }

    public RegExp(String regex) {
        this(Pattern.compile(regex));
    }

    public Pattern pattern() {
        return pattern;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        return matchAt(ctx.document(), location);
    }

    /**
     * Matches against an arbitrary text, which is how lookbehind applies the pattern to the
     * reversed document.
     */
    ParseResult matchAt(String document, int location) {
        var matcher = pattern.matcher(document);
        matcher.region(location, document.length());
        matcher.useTransparentBounds(true);
        matcher.useAnchoringBounds(false);
        if (!matcher.lookingAt()) {
            return ParseResult.NoMatch.at(location);
        }
        int end = matcher.end();
        if (end == location && isDisposable()) {
            return ParseResult.Match.of(Node.EMPTY, location);
        }
        if (dropsContent()) {
            return ParseResult.Match.of(Node.EMPTY, end);
        }
        return ParseResult.Match.of(Node.leaf(nodeName(), matcher.group()), end);
    }

    @Override
    protected Object signatureKey() {
        return List.of("RegExp", pattern.pattern(), pattern.flags());
    }

    @Override
    public String describe() {
        return "/" + Abbreviation.escapeControl(Abbreviation.middle(pattern.pattern(), 118)).replace("/", "\\/") + "/";
    }
}
