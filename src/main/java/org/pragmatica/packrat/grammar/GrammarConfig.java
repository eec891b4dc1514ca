package org.pragmatica.packrat.grammar;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Grammar configuration options.
 *
 * @param leftRecursion              Grow seeds for left-recursive rules; without it they hit the recursion limit
 * @param historyTracking            Record every completed parser call
 * @param resumeNotices              Emit a notice whenever parsing resumes at a reentry point
 * @param maxParserDropouts          Number of times the driving loop skips a line and tries again
 * @param reentrySearchWindow        Characters searched for a reentry point; negative for the whole rest, 0 disables resumption
 * @param staticAnalysis             Check the grammar for configuration errors on construction
 * @param sharedMemoization          Let structurally identical parsers share one memoization table
 * @param maxLeftRecursionIterations Upper bound of seed-growing iterations per position
 */
public record GrammarConfig(
    boolean leftRecursion,
    boolean historyTracking,
    boolean resumeNotices,
    int maxParserDropouts,
    int reentrySearchWindow,
    boolean staticAnalysis,
    boolean sharedMemoization,
    int maxLeftRecursionIterations
) {
    public static final GrammarConfig DEFAULT = new GrammarConfig(
        true,
        false,
        false,
        3,
        10_000,
        true,
        true,
        10_000
    );

    public GrammarConfig {
        checkArgument(maxParserDropouts >= 1, "maxParserDropouts must be at least 1, got %s", maxParserDropouts);
        checkArgument(maxLeftRecursionIterations >= 1,
                      "maxLeftRecursionIterations must be at least 1, got %s", maxLeftRecursionIterations);
    }

    public GrammarConfig withLeftRecursion(boolean value) {
        return new GrammarConfig(value, historyTracking, resumeNotices, maxParserDropouts, reentrySearchWindow,
                                 staticAnalysis, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withHistoryTracking(boolean value) {
        return new GrammarConfig(leftRecursion, value, resumeNotices, maxParserDropouts, reentrySearchWindow,
                                 staticAnalysis, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withResumeNotices(boolean value) {
        return new GrammarConfig(leftRecursion, historyTracking, value, maxParserDropouts, reentrySearchWindow,
                                 staticAnalysis, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withMaxParserDropouts(int value) {
        return new GrammarConfig(leftRecursion, historyTracking, resumeNotices, value, reentrySearchWindow,
                                 staticAnalysis, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withReentrySearchWindow(int value) {
        return new GrammarConfig(leftRecursion, historyTracking, resumeNotices, maxParserDropouts, value,
                                 staticAnalysis, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withStaticAnalysis(boolean value) {
        return new GrammarConfig(leftRecursion, historyTracking, resumeNotices, maxParserDropouts, reentrySearchWindow,
                                 value, sharedMemoization, maxLeftRecursionIterations);
    }

    public GrammarConfig withSharedMemoization(boolean value) {
        return new GrammarConfig(leftRecursion, historyTracking, resumeNotices, maxParserDropouts, reentrySearchWindow,
                                 staticAnalysis, value, maxLeftRecursionIterations);
    }

    public GrammarConfig withMaxLeftRecursionIterations(int value) {
        return new GrammarConfig(leftRecursion, historyTracking, resumeNotices, maxParserDropouts, reentrySearchWindow,
                                 staticAnalysis, sharedMemoization, value);
    }
}
