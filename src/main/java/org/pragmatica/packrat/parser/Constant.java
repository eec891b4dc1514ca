package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.tree.Node;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Leaf that matches the empty string or never matches, depending on a strategy that can
 * be switched between parse runs. This retargets a grammar between dialects without
 * rebuilding the parser graph.
 */
public final class Constant extends Parser {

    public enum Strategy {
        ALWAYS,
        NEVER
    }

    private volatile Strategy strategy;

    public Constant(Strategy strategy) {
        this.strategy = checkNotNull(strategy, "strategy");
    }

    public static Constant always() {
        return new Constant(Strategy.ALWAYS);
    }

    public static Constant never() {
        return new Constant(Strategy.NEVER);
    }

    public Strategy strategy() {
        return strategy;
    }

    /**
     * Switches the strategy. Takes effect with the next parse run.
     */
    public Constant setStrategy(Strategy strategy) {
        this.strategy = checkNotNull(strategy, "strategy");
        return this;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        return switch (strategy) {
            case ALWAYS -> ParseResult.Match.of(isDisposable() ? Node.EMPTY : Node.leaf(nodeName(), ""), location);
            case NEVER -> ParseResult.NoMatch.at(location);
        };
    }

    @Override
    public boolean isOptional() {
        return strategy == Strategy.ALWAYS;
    }

    @Override
    public String describe() {
        return strategy == Strategy.ALWAYS ? ":Always" : ":Never";
    }
}
