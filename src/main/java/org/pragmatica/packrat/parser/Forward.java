package org.pragmatica.packrat.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Placeholder for a parser that is defined later, needed for recursive grammars.
 *
 * <p>A forward reference never appears in the syntax tree. It handles left recursion
 * by growing a seed: the first recursive call at a position fails, then the target is
 * invoked again and again with one more level of recursion allowed, as long as the
 * match gets longer.
 */
public class Forward extends UnaryParser {
    private static final Logger log = LoggerFactory.getLogger(Forward.class);

    private boolean cycleReached;

    public Forward() {
        super();
    }

    /**
     * Sets the parser the calls are delegated to. May only be called once.
     */
    public Forward set(Parser target) {
        checkNotNull(target, "target");
        checkState(parser == null, "Forward parser is already set to %s", parser);
        this.parser = target;
        return this;
    }

    public boolean isSet() {
        return parser != null;
    }

    @Override
    public Parser named(String newName, boolean isDisposable) {
        checkArgument(newName.isEmpty(), "Forward parsers cannot be named: %s", newName);
        return super.named(newName, isDisposable);
    }

    @Override
    public Parser drop() {
        checkState(parser != null, "Forward parser must be set before dropping content");
        parser.drop();
        return this;
    }

    @Override
    public boolean dropsContent() {
        return parser != null && parser.dropsContent();
    }

    @Override
    public boolean isOptional() {
        return parser != null && guarded(parser::isOptional, false);
    }

    @Override
    public List<Parser> subParsers() {
        return parser == null ? List.of() : List.of(parser);
    }

    /**
     * A forward reference yields the same results as its target and shares the target's
     * memoization table if the target is named.
     */
    @Override
    public Object signature() {
        if (parser != null && !parser.name().isEmpty()) {
            return parser.name();
        }
        return this;
    }

    @Override
    public ParseResult invoke(ParsingContext ctx, int location) {
        if (!ctx.config().leftRecursion()) {
            return parser.invoke(ctx, location);
        }
        if (location <= ctx.lastRollbackLocation()) {
            ctx.rollbackTo(location);
        }
        var memo = ctx.memoTable(this);
        if (memo != null) {
            var memoized = memo.get(location);
            if (memoized != null) {
                return memoized;
            }
        }

        var counter = ctx.recursionCounter(this);
        var depth = counter.get(location);
        if (depth != null) {
            if (depth == 0) {
                ctx.setMemoizationSuspended(true);
                return ParseResult.NoMatch.at(location);
            }
            counter.put(location, depth - 1);
            try {
                return parser.invoke(ctx, location);
            } finally {
                counter.put(location, depth);
            }
        }

        counter.put(location, 0);
        try {
            return growSeed(ctx, location, memo, counter);
        } finally {
            counter.remove(location);
        }
    }

    private ParseResult growSeed(ParsingContext ctx, int location, Map<Integer, ParseResult> memo,
                                 Map<Integer, Integer> counter) {
        boolean saveSuspend = ctx.isMemoizationSuspended();
        ctx.setMemoizationSuspended(false);
        int historyPointer = ctx.historySize();

        var result = parser.invoke(ctx, location);

        if (result instanceof ParseResult.Match) {
            var lastHistoryState = ctx.historySlice(historyPointer);
            int maxIterations = ctx.config().maxLeftRecursionIterations();
            int depth = 1;
            while (true) {
                if (depth > maxIterations) {
                    log.warn("Left recursion of {} at position {} stopped after {} iterations",
                             repr(), location, maxIterations);
                    break;
                }
                counter.put(location, depth);
                ctx.setMemoizationSuspended(false);
                int rollbackSize = ctx.rollbackSize();
                ctx.restoreHistory(historyPointer, List.of());

                var next = parser.invoke(ctx, location);

                if (!(next instanceof ParseResult.Match) || next.rest() <= result.rest()) {
                    ctx.truncateRollback(rollbackSize);
                    ctx.restoreHistory(historyPointer, lastHistoryState);
                    break;
                }
                lastHistoryState = ctx.historySlice(historyPointer);
                result = next;
                depth++;
            }
        }

        ctx.setMemoizationSuspended(saveSuspend);
        if (!saveSuspend && memo != null && !(result instanceof ParseResult.Failure)) {
            memo.put(location, result);
        }
        return result;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        return parser.invoke(ctx, location);
    }

    private <T> T guarded(Supplier<T> func, T onCycle) {
        if (cycleReached) {
            return onCycle;
        }
        cycleReached = true;
        try {
            return func.get();
        } finally {
            cycleReached = false;
        }
    }

    @Override
    public String describe() {
        if (parser == null) {
            return "<unset>";
        }
        return guarded(parser::repr, "...");
    }

    @Override
    public String repr() {
        if (parser != null && !parser.name().isEmpty()) {
            return parser.name();
        }
        return describe();
    }

    @Override
    public String toString() {
        if (parser == null) {
            return describe();
        }
        return guarded(parser::toString, "...");
    }
}
