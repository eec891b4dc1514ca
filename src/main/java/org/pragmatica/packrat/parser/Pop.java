package org.pragmatica.packrat.parser;

/**
 * Like {@link Retrieve}, but removes the matched value from the variable stack.
 */
public class Pop extends Retrieve {

    public Pop(Parser symbol, MatchFunction matchFunction) {
        super(symbol, matchFunction);
    }

    public Pop(Parser symbol) {
        this(symbol, MatchFunction.LAST_VALUE);
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var result = retrieveAndMatch(ctx, location);
        if (result instanceof ParseResult.Match match && match.node().errors().isEmpty()) {
            var stack = ctx.variable(symbolName());
            var value = stack.remove(stack.size() - 1);
            ctx.pushRollback(rollbackLocation(location, match.rest()), () -> stack.add(value));
        } else {
            ctx.pushRollback(rollbackLocation(location, result.rest()), () -> {});
        }
        return result;
    }

    @Override
    public String describe() {
        return (matchFunction.isOptional() ? ":?" : "::") + parser.repr();
    }
}
