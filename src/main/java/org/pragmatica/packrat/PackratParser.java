package org.pragmatica.packrat;

import org.pragmatica.packrat.error.ErrorMessage;
import org.pragmatica.packrat.error.ReentryRule;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.grammar.GrammarConfig;
import org.pragmatica.packrat.parser.Parser;
import org.pragmatica.packrat.parser.TreeReduction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Entry point for creating packrat parsers from parser graphs.
 *
 * <p>Example usage:
 * <pre>{@code
 * var digits = regex("\\d+");
 * var number = series(digits, opt(series(1, text("."), digits))).named("number");
 *
 * var grammar = PackratParser.fromRoot(number);
 * var result = grammar.parse("3.14");
 * }</pre>
 */
public final class PackratParser {
    private PackratParser() {}

    /**
     * Create a grammar with the default configuration.
     *
     * @throws org.pragmatica.packrat.error.GrammarException if the static analysis finds errors
     */
    public static Grammar fromRoot(Parser root) {
        return fromRoot(root, GrammarConfig.DEFAULT);
    }

    /**
     * Create a grammar with custom configuration.
     */
    public static Grammar fromRoot(Parser root, GrammarConfig config) {
        return new Grammar(root, config);
    }

    /**
     * Create a builder for more complex grammar configuration.
     */
    public static Builder builder(Parser root) {
        return new Builder(root);
    }

    public static final class Builder {
        private final Parser root;
        private GrammarConfig config = GrammarConfig.DEFAULT;
        private TreeReduction reduction;
        private final Map<String, List<ReentryRule>> resumeRules = new LinkedHashMap<>();
        private final Map<String, List<ReentryRule>> skipRules = new LinkedHashMap<>();
        private final Map<String, List<ErrorMessage>> errorMessages = new LinkedHashMap<>();
        private Pattern commentPattern;

        private Builder(Parser root) {
            this.root = root;
        }

        public Builder config(GrammarConfig config) {
            this.config = config;
            return this;
        }

        public Builder leftRecursion(boolean enabled) {
            this.config = config.withLeftRecursion(enabled);
            return this;
        }

        public Builder historyTracking(boolean enabled) {
            this.config = config.withHistoryTracking(enabled);
            return this;
        }

        public Builder resumeNotices(boolean enabled) {
            this.config = config.withResumeNotices(enabled);
            return this;
        }

        public Builder maxParserDropouts(int dropouts) {
            this.config = config.withMaxParserDropouts(dropouts);
            return this;
        }

        public Builder reentrySearchWindow(int window) {
            this.config = config.withReentrySearchWindow(window);
            return this;
        }

        public Builder staticAnalysis(boolean enabled) {
            this.config = config.withStaticAnalysis(enabled);
            return this;
        }

        public Builder sharedMemoization(boolean enabled) {
            this.config = config.withSharedMemoization(enabled);
            return this;
        }

        public Builder maxLeftRecursionIterations(int iterations) {
            this.config = config.withMaxLeftRecursionIterations(iterations);
            return this;
        }

        /**
         * Tree reduction applied to every combining parser of the graph.
         */
        public Builder reduction(TreeReduction reduction) {
            this.reduction = reduction;
            return this;
        }

        /**
         * Where to continue when a mandatory violation leaves a parser of {@code symbol}.
         */
        public Builder resume(String symbol, ReentryRule... rules) {
            resumeRules.computeIfAbsent(symbol, k -> new ArrayList<>()).addAll(List.of(rules));
            return this;
        }

        /**
         * Where sequences of {@code symbol} continue after a mandatory violation.
         */
        public Builder skip(String symbol, ReentryRule... rules) {
            skipRules.computeIfAbsent(symbol, k -> new ArrayList<>()).addAll(List.of(rules));
            return this;
        }

        /**
         * Custom messages for mandatory violations in {@code symbol}. The first message
         * whose condition holds is used.
         */
        public Builder errorMessages(String symbol, ErrorMessage... messages) {
            errorMessages.computeIfAbsent(symbol, k -> new ArrayList<>()).addAll(List.of(messages));
            return this;
        }

        /**
         * Comments that the reentry search skips.
         */
        public Builder comments(String regex) {
            this.commentPattern = Pattern.compile(regex);
            return this;
        }

        public Grammar build() {
            if (reduction != null) {
                reduction.applyTo(root);
            }
            return new Grammar(root, config, copy(resumeRules), copy(skipRules), copy(errorMessages), commentPattern);
        }

        private static <T> Map<String, List<T>> copy(Map<String, List<T>> map) {
            var result = new LinkedHashMap<String, List<T>>();
            map.forEach((key, value) -> result.put(key, List.copyOf(value)));
            return result;
        }
    }
}
