package org.pragmatica.packrat.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Static factory methods for building parser graphs in code.
 *
 * <p>Example, a number with an optional fraction where the digits after the dot are
 * mandatory:
 * <pre>{@code
 * import static org.pragmatica.packrat.parser.Parsers.*;
 *
 * var digits = regex("\\d+");
 * var number = series(digits, opt(series(1, text("."), digits))).named("number");
 * }</pre>
 */
public final class Parsers {
    private Parsers() {}

    // === Leaves ===

    public static Text text(String text) {
        return new Text(text);
    }

    public static RegExp regex(String regex) {
        return new RegExp(regex);
    }

    public static RegExp regex(Pattern pattern) {
        return new RegExp(pattern);
    }

    public static AnyChar anyChar() {
        return new AnyChar();
    }

    public static Constant always() {
        return Constant.always();
    }

    public static Constant never() {
        return Constant.never();
    }

    // === Combinators ===

    public static Series series(Parser... parsers) {
        return new Series(parsers);
    }

    /**
     * Series whose parsers from index {@code mandatory} on must match once the
     * parsers before have matched.
     */
    public static Series series(int mandatory, Parser... parsers) {
        return new Series(List.of(parsers), mandatory);
    }

    public static Alternative alt(Parser... parsers) {
        return new Alternative(parsers);
    }

    public static Option opt(Parser parser) {
        return new Option(parser);
    }

    public static ZeroOrMore zeroOrMore(Parser parser) {
        return new ZeroOrMore(parser);
    }

    public static OneOrMore oneOrMore(Parser parser) {
        return new OneOrMore(parser);
    }

    public static Counted counted(Parser parser, int min, int max) {
        return new Counted(parser, min, max);
    }

    public static Interleave interleave(Parser... parsers) {
        return new Interleave(parsers);
    }

    public static Interleave interleave(List<Parser> parsers, int mandatory, List<Interleave.Range> repetitions) {
        return new Interleave(parsers, mandatory, repetitions);
    }

    // === Lookaround ===

    public static Lookahead lookahead(Parser parser) {
        return new Lookahead(parser);
    }

    public static NegativeLookahead negativeLookahead(Parser parser) {
        return new NegativeLookahead(parser);
    }

    public static Lookbehind lookbehind(Parser parser) {
        return new Lookbehind(parser);
    }

    public static NegativeLookbehind negativeLookbehind(Parser parser) {
        return new NegativeLookbehind(parser);
    }

    // === Variables ===

    /**
     * Capture storing its matches in the variable {@code name}.
     */
    public static Capture capture(String name, Parser parser) {
        var capture = new Capture(parser);
        capture.named(name);
        return capture;
    }

    public static Retrieve retrieve(Parser symbol) {
        return new Retrieve(symbol);
    }

    public static Retrieve retrieve(Parser symbol, MatchFunction matchFunction) {
        return new Retrieve(symbol, matchFunction);
    }

    public static Pop pop(Parser symbol) {
        return new Pop(symbol);
    }

    public static Pop pop(Parser symbol, MatchFunction matchFunction) {
        return new Pop(symbol, matchFunction);
    }

    // === Naming ===

    /**
     * Parser producing nodes named {@code name} from the result of {@code parser}.
     */
    public static Synonym synonym(String name, Parser parser) {
        var synonym = new Synonym(parser);
        synonym.named(name);
        return synonym;
    }

    public static Forward forward() {
        return new Forward();
    }

    /**
     * Lets a disposable parser drop its content.
     */
    public static <P extends Parser> P drop(P parser) {
        parser.drop();
        return parser;
    }
}
