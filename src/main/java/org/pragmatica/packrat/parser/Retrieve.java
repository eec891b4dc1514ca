package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.tree.Node;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Matches the text at the current position against the top of a capture's variable
 * stack without removing it.
 *
 * <p>If nothing has been captured yet, the capture parser is invoked once to seed the
 * stack.
 */
public class Retrieve extends ContextSensitive {
    protected final MatchFunction matchFunction;

    /**
     * @param symbol        The capture parser, possibly behind a forward reference
     * @param matchFunction How the stack top is compared with the document
     */
    public Retrieve(Parser symbol, MatchFunction matchFunction) {
        super(symbol);
        checkArgument(symbol instanceof Capture || symbol instanceof Forward,
                      "Retrieve requires a capture parser, got %s", symbol);
        this.matchFunction = checkNotNull(matchFunction, "matchFunction");
    }

    public Retrieve(Parser symbol) {
        this(symbol, MatchFunction.LAST_VALUE);
    }

    public MatchFunction matchFunction() {
        return matchFunction;
    }

    /**
     * Name of the variable, which is the name of the capture parser.
     */
    public String symbolName() {
        if (!parser.name().isEmpty()) {
            return parser.name();
        }
        return parser instanceof Forward forward ? forward.parser().name() : "";
    }

    /**
     * Name of the retrieved nodes: the variable's name, unless this parser carries its
     * own name.
     */
    protected String retrievedNodeName() {
        if (isDisposable() || nodeName().isEmpty()) {
            return symbolName();
        }
        return nodeName();
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        if (ctx.variable(symbolName()).isEmpty()) {
            var seeded = parser.invoke(ctx, location);
            if (!seeded.isMatch()) {
                ctx.pushRollback(rollbackLocation(location, location), () -> {});
                return ParseResult.NoMatch.at(location);
            }
        }
        var result = retrieveAndMatch(ctx, location);
        ctx.pushRollback(rollbackLocation(location, result.rest()), () -> {});
        return result;
    }

    protected ParseResult retrieveAndMatch(ParsingContext ctx, int location) {
        var stack = ctx.variable(symbolName());
        if (stack.isEmpty()) {
            if (matchFunction.isOptional()) {
                return ParseResult.NoMatch.at(location);
            }
            var node = Node.leaf(retrievedNodeName(), "").withPos(location);
            ctx.addError(node, Diagnostic.of(ErrorCode.UNDEFINED_RETRIEVE,
                                             "'" + symbolName() + "' undefined or exhausted.", location));
            return ParseResult.Match.of(node, location);
        }
        var value = matchFunction.apply(ctx.document(), location, stack);
        if (value == null) {
            return ParseResult.NoMatch.at(location);
        }
        int rest = location + value.length();
        if (dropsContent()) {
            return ParseResult.Match.of(Node.EMPTY, rest);
        }
        return ParseResult.Match.of(Node.leaf(retrievedNodeName(), value), rest);
    }

    @Override
    public String describe() {
        return ":" + parser.repr();
    }
}
