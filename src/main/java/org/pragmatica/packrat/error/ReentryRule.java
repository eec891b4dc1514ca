package org.pragmatica.packrat.error;

import org.pragmatica.packrat.parser.Parser;

import java.util.regex.Pattern;

/**
 * Rule locating the point where parsing resumes after a mandatory violation.
 *
 * <p>For literals, patterns and search functions the reentry point is the end of the
 * closest match. A recognizer is tried only at the failure position itself.
 */
public sealed interface ReentryRule {

    static ReentryRule literal(String text) {
        return new Literal(text);
    }

    static ReentryRule regex(String regex) {
        return new Regex(Pattern.compile(regex));
    }

    static ReentryRule recognizer(Parser parser) {
        return new Recognizer(parser);
    }

    static ReentryRule search(SearchFunction function) {
        return new Search(function);
    }

    record Literal(String text) implements ReentryRule {}

    record Regex(Pattern pattern) implements ReentryRule {}

    record Recognizer(Parser parser) implements ReentryRule {}

    record Search(SearchFunction function) implements ReentryRule {}

    /**
     * Custom search in {@code document} between the absolute positions {@code start}
     * (inclusive) and {@code end} (exclusive).
     */
    @FunctionalInterface
    interface SearchFunction {
        Hit search(String document, int start, int end);
    }

    /**
     * Absolute position and length of a hit. A negative position means nothing was found.
     */
    record Hit(int position, int length) {
        public static final Hit NONE = new Hit(-1, 0);
    }
}
