package org.pragmatica.packrat.error;

import org.pragmatica.packrat.parser.ParseResult;
import org.pragmatica.packrat.parser.ParsingContext;
import org.pragmatica.packrat.tree.Node;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Search for the point where parsing continues after a mandatory violation.
 *
 * <p>All rules are searched and the closest reentry point wins. Hits of literal, pattern
 * and search-function rules that start or end inside a comment are skipped, so that a
 * reentry point is never chosen inside a comment.
 */
public final class ReentryPointSearch {

    private ReentryPointSearch() {}

    /**
     * Reentry point relative to the search start, or -1 if none was found, together
     * with the node covering the skipped text.
     */
    public record Reentry(int offset, Node skipped) {
        public boolean found() {
            return offset >= 0;
        }
    }

    /**
     * Searches the document from {@code restPos} within the grammar's reentry search window.
     */
    public static Reentry find(ParsingContext ctx, int restPos, List<ReentryRule> rules) {
        var document = ctx.document();
        int restLength = document.length() - restPos;
        int window = ctx.config().reentrySearchWindow();
        if (rules.isEmpty() || window == 0) {
            return new Reentry(-1, Node.zombie(""));
        }
        if (window < 0) {
            window = restLength;
        }
        var comments = ctx.grammar().commentPattern();
        int upperLimit = restLength + 1;
        int closest = upperLimit;
        Node skipNode = null;

        for (var rule : rules) {
            if (rule instanceof ReentryRule.Recognizer recognizer) {
                var hit = recognize(ctx, restPos, recognizer);
                if (hit.isPresent() && hit.get().offset() < closest) {
                    closest = hit.get().offset();
                    skipNode = hit.get().skipped();
                }
            } else {
                int pos = entryPoint(new Searcher(document, restPos, window, rule),
                                     new CommentScanner(document, restPos, comments), upperLimit);
                if (pos < closest) {
                    closest = pos;
                    skipNode = null;
                }
            }
        }

        if (closest == upperLimit) {
            closest = -1;
        }
        if (skipNode == null) {
            skipNode = Node.zombie(document.substring(restPos, restPos + Math.max(closest, 0)));
        }
        return new Reentry(closest, skipNode);
    }

    private static Optional<Reentry> recognize(ParsingContext ctx, int restPos, ReentryRule.Recognizer rule) {
        boolean saveTracking = ctx.historyTracking();
        ctx.setHistoryTracking(false);
        ctx.disableMemoization();
        try {
            var result = rule.parser().invoke(ctx, restPos);
            if (result instanceof ParseResult.Failure failure) {
                ctx.addError(Node.EMPTY, Diagnostic.of(ErrorCode.ERROR_WHILE_RECOVERING_FROM_ERROR,
                                                       "Error while searching re-entry point with parser "
                                                       + rule.parser() + ": " + failure.error().message(),
                                                       restPos));
                return Optional.empty();
            }
            if (result instanceof ParseResult.Match match && match.rest() > restPos) {
                return Optional.of(new Reentry(match.rest() - restPos, match.node()));
            }
            return Optional.empty();
        } finally {
            ctx.enableMemoization();
            ctx.setHistoryTracking(saveTracking);
        }
    }

    /**
     * Returns the end of the first hit that lies outside of comments, relative to the
     * search start, or {@code upperLimit} if there is none.
     */
    private static int entryPoint(Searcher searcher, CommentScanner comments, int upperLimit) {
        int[] comment = comments.next();
        var hit = searcher.search(0);
        int k = hit.position();
        int length = hit.length();
        while (comment[0] < comment[1] && comment[1] <= k + length) {
            comment = comments.next();
        }
        while ((comment[0] < k && k < comment[1]) || (comment[0] < k + length && k + length < comment[1])) {
            hit = searcher.search(comment[1]);
            k = hit.position();
            length = hit.length();
            while (comment[0] < comment[1] && comment[1] <= k) {
                comment = comments.next();
            }
        }
        return k >= 0 ? k + length : upperLimit;
    }

    /**
     * Runs one literal, pattern or function rule. Positions are relative to the search start.
     */
    private static final class Searcher {
        private final String document;
        private final int restPos;
        private final int window;
        private final ReentryRule rule;

        Searcher(String document, int restPos, int window, ReentryRule rule) {
            this.document = document;
            this.restPos = restPos;
            this.window = window;
            this.rule = rule;
        }

        ReentryRule.Hit search(int start) {
            int from = restPos + start;
            int to = (int) Math.min(document.length(), (long) from + window);
            if (from > document.length()) {
                return ReentryRule.Hit.NONE;
            }
            if (rule instanceof ReentryRule.Literal literal) {
                int idx = document.substring(from, to).indexOf(literal.text());
                if (idx < 0) {
                    return ReentryRule.Hit.NONE;
                }
                return new ReentryRule.Hit(from + idx - restPos, literal.text().length());
            }
            if (rule instanceof ReentryRule.Regex regex) {
                var matcher = regex.pattern().matcher(document);
                matcher.region(from, to);
                matcher.useTransparentBounds(true);
                matcher.useAnchoringBounds(false);
                if (matcher.find()) {
                    return new ReentryRule.Hit(matcher.start() - restPos, matcher.end() - matcher.start());
                }
                return ReentryRule.Hit.NONE;
            }
            if (rule instanceof ReentryRule.Search search) {
                var hit = search.function().search(document, from, to);
                if (hit.position() < 0) {
                    return ReentryRule.Hit.NONE;
                }
                return new ReentryRule.Hit(hit.position() - restPos, hit.length());
            }
            throw new IllegalArgumentException("Unsupported reentry rule " + rule);
        }
    }

    /**
     * Iterates over the comments in the rest of the document as [start, end) intervals
     * relative to the search start; (-1, -2) once there are none left.
     */
    private static final class CommentScanner {
        private static final int[] NO_COMMENT = {-1, -2};

        private final Matcher matcher;
        private final int restPos;
        private boolean exhausted;

        CommentScanner(String document, int restPos, Optional<Pattern> pattern) {
            this.restPos = restPos;
            if (pattern.isPresent()) {
                this.matcher = pattern.get().matcher(document);
                this.matcher.region(restPos, document.length());
                this.matcher.useTransparentBounds(true);
                this.matcher.useAnchoringBounds(false);
            } else {
                this.matcher = null;
                this.exhausted = true;
            }
        }

        int[] next() {
            if (!exhausted && matcher.find()) {
                return new int[]{matcher.start() - restPos, matcher.end() - restPos};
            }
            exhausted = true;
            return NO_COMMENT;
        }
    }
}
