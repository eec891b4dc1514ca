package org.pragmatica.packrat.grammar;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.error.ErrorMessage;
import org.pragmatica.packrat.error.GrammarException;
import org.pragmatica.packrat.error.ReentryRule;
import org.pragmatica.packrat.parser.Capture;
import org.pragmatica.packrat.parser.CombinedParser;
import org.pragmatica.packrat.parser.Forward;
import org.pragmatica.packrat.parser.Lookahead;
import org.pragmatica.packrat.parser.ParseResult;
import org.pragmatica.packrat.parser.Parser;
import org.pragmatica.packrat.parser.ParsingContext;
import org.pragmatica.packrat.parser.Retrieve;
import org.pragmatica.packrat.parser.Synonym;
import org.pragmatica.packrat.parser.UnaryParser;
import org.pragmatica.packrat.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Owner of a parser graph.
 *
 * <p>On construction the grammar collects all parsers reachable from the root, assigns
 * the equivalence classes that decide which parsers share a memoization table, finds the
 * symbol each parser belongs to and runs the static analysis. It holds the per-symbol
 * recovery settings and runs the driving loop: every call of {@link #parse(String)} gets
 * its own {@link ParsingContext}, so a grammar can be reused for any number of parses,
 * one at a time.
 */
public final class Grammar {
    private static final Logger log = LoggerFactory.getLogger(Grammar.class);

    public static final String ROOT_NAME = "root";

    private final Parser root;
    private final GrammarConfig config;
    private final Map<String, List<ReentryRule>> resumeRules;
    private final Map<String, List<ReentryRule>> skipRules;
    private final Map<String, List<ErrorMessage>> errorMessages;
    private final Pattern commentPattern;

    private final List<Parser> allParsers = new ArrayList<>();
    private final Map<String, Parser> symbols = new LinkedHashMap<>();
    private final Map<Parser, Integer> eqClasses = new IdentityHashMap<>();
    private final Map<Object, Integer> signatures = new HashMap<>();
    private final Map<Parser, Parser> associatedSymbols = new IdentityHashMap<>();
    private final List<AnalysisError> analysisErrors;
    private final boolean dropsContent;

    public Grammar(Parser root) {
        this(root, GrammarConfig.DEFAULT);
    }

    public Grammar(Parser root, GrammarConfig config) {
        this(root, config, Map.of(), Map.of(), Map.of(), null);
    }

    /**
     * @param root           The root parser; named {@value #ROOT_NAME} if it has no name
     * @param config         Configuration options
     * @param resumeRules    Reentry rules per symbol, used when a violation leaves a parser of the symbol
     * @param skipRules      Reentry rules per symbol, used by sequences of the symbol to continue in place
     * @param errorMessages  Custom messages for mandatory violations per symbol
     * @param commentPattern Comments the reentry search skips, may be {@code null}
     * @throws GrammarException if the static analysis finds errors
     */
    public Grammar(Parser root,
                   GrammarConfig config,
                   Map<String, List<ReentryRule>> resumeRules,
                   Map<String, List<ReentryRule>> skipRules,
                   Map<String, List<ErrorMessage>> errorMessages,
                   Pattern commentPattern) {
        this.root = checkNotNull(root, "root");
        this.config = checkNotNull(config, "config");
        this.resumeRules = Map.copyOf(resumeRules);
        this.skipRules = Map.copyOf(skipRules);
        this.errorMessages = Map.copyOf(errorMessages);
        this.commentPattern = commentPattern;
        if (root.name().isEmpty() && !(root instanceof Forward)) {
            root.named(ROOT_NAME);
        }

        collectParsers();
        assignEqClasses();
        assignSymbols();
        this.dropsContent = allParsers.stream().anyMatch(Parser::dropsContent);
        log.debug("Grammar with root {}: {} parsers, {} symbols, {} memoization classes",
                  root.name(), allParsers.size(), symbols.size(),
                  config.sharedMemoization() ? signatures.size() : eqClasses.size());

        if (config.staticAnalysis()) {
            this.analysisErrors = List.copyOf(staticAnalysis());
            for (var error : analysisErrors) {
                if (!error.isError()) {
                    log.warn("Grammar warning in {}: {}", error.symbol(), error.error().message());
                }
            }
            if (analysisErrors.stream().anyMatch(AnalysisError::isError)) {
                throw new GrammarException(analysisErrors);
            }
        } else {
            this.analysisErrors = List.of();
        }
    }

    // === Construction ===

    private void collectParsers() {
        var roots = new ArrayList<Parser>();
        roots.add(root);
        resumeRules.values().forEach(rules -> addRecognizers(rules, roots));
        skipRules.values().forEach(rules -> addRecognizers(rules, roots));
        var seen = Collections.newSetFromMap(new IdentityHashMap<Parser, Boolean>());
        for (var start : roots) {
            for (var path : start.descendants()) {
                var parser = path.get(path.size() - 1);
                if (!seen.add(parser)) {
                    continue;
                }
                if (parser instanceof Forward forward) {
                    checkState(forward.isSet(), "Forward parser in %s has not been set", path.get(0).repr());
                }
                allParsers.add(parser);
                if (!parser.name().isEmpty()) {
                    var previous = symbols.putIfAbsent(parser.name(), parser);
                    checkArgument(previous == null || previous == parser,
                                  "Two different parsers are named \"%s\"", parser.name());
                }
            }
        }
    }

    private static void addRecognizers(List<ReentryRule> rules, List<Parser> roots) {
        for (var rule : rules) {
            if (rule instanceof ReentryRule.Recognizer recognizer) {
                roots.add(recognizer.parser());
            }
        }
    }

    private void assignEqClasses() {
        for (var parser : allParsers) {
            eqClass(parser);
        }
    }

    private void assignSymbols() {
        for (var parser : allParsers) {
            if (parser instanceof Forward forward && !forward.parser().name().isEmpty()) {
                associatedSymbols.put(parser, forward.parser());
                addAnonymousDescendants(forward.parser(), forward.parser());
            } else if (!parser.name().isEmpty()) {
                addAnonymousDescendants(parser, parser);
            }
        }
    }

    private void addAnonymousDescendants(Parser parser, Parser symbol) {
        if (associatedSymbols.putIfAbsent(parser, symbol) != null && parser != symbol) {
            return;
        }
        for (var sub : parser.subParsers()) {
            boolean named = !sub.name().isEmpty()
                            || sub instanceof Forward forward && !forward.parser().name().isEmpty();
            if (!named && !associatedSymbols.containsKey(sub)) {
                addAnonymousDescendants(sub, symbol);
            }
        }
    }

    // === Static analysis ===

    private List<AnalysisError> staticAnalysis() {
        var errors = new ArrayList<AnalysisError>();
        var leafState = new IdentityHashMap<Parser, Boolean>();
        for (var parser : allParsers) {
            errors.addAll(parser.staticAnalysis(this));
            if (!parser.name().isEmpty() && !touchesDocument(parser, leafState)) {
                var location = parser instanceof CombinedParser combined
                               ? combined.locationInfo(parser.name())
                               : parser.toString();
                errors.add(new AnalysisError(parser.name(), parser,
                                             Diagnostic.of(ErrorCode.PARSER_NEVER_TOUCHES_DOCUMENT,
                                                           "Parser " + location + " is entirely cyclical and, "
                                                           + "therefore, cannot even touch the parsed document",
                                                           0)));
            }
        }
        return errors;
    }

    /**
     * True if a leaf parser can be reached from {@code parser}. Only positive results are
     * cached, a negative one may depend on the parsers visited before.
     */
    private static boolean touchesDocument(Parser parser, Map<Parser, Boolean> touching) {
        return touchesDocument(parser, touching, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static boolean touchesDocument(Parser parser, Map<Parser, Boolean> touching, Set<Parser> visited) {
        if (touching.containsKey(parser)) {
            return true;
        }
        if (!visited.add(parser)) {
            return false;
        }
        var subs = parser.subParsers();
        boolean result = subs.isEmpty();
        for (var sub : subs) {
            if (touchesDocument(sub, touching, visited)) {
                result = true;
                break;
            }
        }
        if (result) {
            touching.put(parser, true);
        }
        return result;
    }

    /**
     * All problems found by the static analysis, including warnings.
     */
    public List<AnalysisError> analysisErrors() {
        return analysisErrors;
    }

    // === Accessors ===

    public Parser root() {
        return root;
    }

    public GrammarConfig config() {
        return config;
    }

    /**
     * The named parser with the given name.
     */
    public Optional<Parser> parser(String name) {
        return Optional.ofNullable(symbols.get(name));
    }

    public List<String> symbolNames() {
        return List.copyOf(symbols.keySet());
    }

    /**
     * Index of the memoization table of {@code parser}. Parsers not reachable from the
     * root are assigned one on first request.
     */
    public int eqClass(Parser parser) {
        var known = eqClasses.get(parser);
        if (known != null) {
            return known;
        }
        int eqClass = config.sharedMemoization()
                      ? signatures.computeIfAbsent(parser.signature(), k -> signatures.size())
                      : eqClasses.size();
        eqClasses.put(parser, eqClass);
        return eqClass;
    }

    /**
     * The closest named parser containing {@code parser}, or {@code parser} itself if it
     * is named or not part of the grammar.
     */
    public Parser associatedSymbol(Parser parser) {
        var symbol = associatedSymbols.get(parser);
        return symbol != null ? symbol : parser;
    }

    public List<ReentryRule> resumeRules(String symbol) {
        return resumeRules.getOrDefault(symbol, List.of());
    }

    public List<ReentryRule> skipRules(String symbol) {
        return skipRules.getOrDefault(symbol, List.of());
    }

    public List<ErrorMessage> errorMessages(String symbol) {
        return errorMessages.getOrDefault(symbol, List.of());
    }

    public Optional<Pattern> commentPattern() {
        return Optional.ofNullable(commentPattern);
    }

    // === Parsing ===

    public ParseResultWithDiagnostics parse(String document) {
        return parse(document, root, true);
    }

    public ParseResultWithDiagnostics parse(String document, String startParser) {
        return parse(document, startParser, true);
    }

    public ParseResultWithDiagnostics parse(String document, String startParser, boolean completeMatch) {
        var parser = parser(startParser)
            .orElseThrow(() -> new IllegalArgumentException("Unknown parser \"" + startParser + "\""));
        return parse(document, parser, completeMatch);
    }

    /**
     * Parses {@code document} starting with {@code startParser}.
     *
     * @param completeMatch If true, text the start parser leaves over is reported and
     *                      parsing is retried behind the next line break
     */
    public ParseResultWithDiagnostics parse(String document, Parser startParser, boolean completeMatch) {
        checkNotNull(document, "document");
        checkNotNull(startParser, "startParser");
        log.debug("Parsing {} characters with parser {}", document.length(), startParser.repr());
        var run = new Run(ParsingContext.create(this, document, startParser), completeMatch);
        var tree = run.execute();
        var diagnostics = run.ctx.errors().stream()
                                 .sorted(Comparator.comparingInt(Diagnostic::pos))
                                 .collect(Collectors.toList());
        log.debug("Parsed {} characters: {} diagnostics", document.length(), diagnostics.size());
        return new ParseResultWithDiagnostics(tree, diagnostics, document);
    }

    /**
     * The text {@code parser} matches at the start of {@code text}, if it matches without errors.
     */
    public Optional<String> match(Parser parser, String text) {
        var result = parse(text, parser, false);
        return result.isSuccess() ? Optional.of(result.root().content()) : Optional.empty();
    }

    /**
     * The text, if {@code parser} matches all of it without errors.
     */
    public Optional<String> fullMatch(Parser parser, String text) {
        var result = parse(text, parser, true);
        return result.isSuccess() ? Optional.of(result.root().content()) : Optional.empty();
    }

    /**
     * True if {@code parser} matches at least one character at the start of {@code text}
     * without errors. Used to check the order of alternatives.
     */
    public boolean preempts(String text, Parser parser) {
        var ctx = ParsingContext.create(this, text, parser);
        var result = parser.invoke(ctx, 0);
        return result instanceof ParseResult.Match match
               && match.rest() >= 1
               && ctx.errors().stream().noneMatch(Diagnostic::isError);
    }

    /**
     * True if {@code parser} matches the empty document.
     */
    public boolean matchesEmptyDocument(Parser parser) {
        var ctx = ParsingContext.create(this, "", parser);
        return parser.invoke(ctx, 0).isMatch();
    }

    /**
     * The named parsers in grammar notation. Long expressions are abbreviated.
     */
    public String asEbnf() {
        var lines = new ArrayList<String>();
        lines.add("# Named parsers only; long expressions may be abbreviated (\"...\")");
        lines.add("");
        symbols.values().forEach(parser -> lines.add(parser.toString()));
        lines.add("");
        return String.join("\n", lines);
    }

    @Override
    public String toString() {
        return "Grammar(" + root.name() + ")";
    }

    // === Driving loop ===

    /**
     * State of one run of the driving loop.
     */
    private final class Run {
        private static final int FOUND_LENGTH = 10;
        private static final int DID_NOT_MATCH_LENGTH = 20;

        private final ParsingContext ctx;
        private final boolean completeMatch;
        private final String document;
        private final Parser startParser;
        private final List<Node> stitches = new ArrayList<>();

        Run(ParsingContext ctx, boolean completeMatch) {
            this.ctx = ctx;
            this.completeMatch = completeMatch;
            this.document = ctx.document();
            this.startParser = ctx.startParser();
        }

        Node execute() {
            Node result = null;
            int rest = 0;
            int docLength = document.length();

            if (docLength == 0) {
                result = nodeOf(startParser.invoke(ctx, 0), 0);
                if (result == null) {
                    result = Node.zombie("").withPos(0);
                    if (lookaheadFailureOnly()) {
                        ctx.addError(result, ErrorCode.PARSER_LOOKAHEAD_FAILURE_ONLY,
                                     "Parser \"" + startParser.repr()
                                     + "\" only did not match empty document because of lookahead", 0);
                    } else {
                        ctx.addError(result, ErrorCode.PARSER_STOPPED_BEFORE_END,
                                     "Parser \"" + startParser.repr() + "\" did not match empty document.", 0);
                    }
                }
            }

            int maxDropouts = config.maxParserDropouts();
            while (rest < docLength && stitches.size() < maxDropouts) {
                int start = rest;
                var parseResult = startParser.invoke(ctx, start);
                if (parseResult instanceof ParseResult.Failure failure) {
                    result = absorb(failure, start);
                    rest = failure.resumeFrom();
                } else {
                    result = nodeOf(parseResult, start);
                    rest = parseResult.rest();
                }

                if (rest >= docLength || !completeMatch) {
                    break;
                }
                int newline = document.indexOf('\n', rest);
                int skipEnd = newline < 0 ? docLength : newline + 1;
                var skip = document.substring(rest, skipEnd);

                String message;
                ErrorCode code;
                int errPos;
                if (result == null || result.isZombie() && result.length() == 0) {
                    errPos = ctx.farthestFailPos() >= 0 ? ctx.farthestFailPos() : start;
                    var text = excerpt(errPos, DID_NOT_MATCH_LENGTH, " ...");
                    var failed = farthestFailName();
                    if (lookaheadFailureOnly()) {
                        message = "Parser \"" + failed + "\" did not match: »" + text + "« - but only because of lookahead.";
                        code = ErrorCode.PARSER_LOOKAHEAD_FAILURE_ONLY;
                    } else {
                        message = "Parser \"" + failed + "\" did not match: »" + text + "«";
                        code = ErrorCode.PARSER_STOPPED_BEFORE_END;
                    }
                    if (ctx.historyTracking()) {
                        message += "\n    Most advanced fail: "
                                   + HistoryRecord.mostAdvancedFail(ctx.history()).map(Object::toString).orElse("-")
                                   + "\n    Last match:    "
                                   + HistoryRecord.lastMatch(ctx.history()).map(Object::toString).orElse("-") + ";";
                    }
                } else {
                    stitches.add(result);
                    var lookaheadMatch = lookaheadMatchOnly();
                    if (lookaheadMatch.isPresent()) {
                        errPos = lookaheadMatch.get();
                        message = "Parser stopped before end, but matched with lookahead.";
                        code = ErrorCode.PARSER_LOOKAHEAD_MATCH_ONLY;
                        maxDropouts = -1;
                    } else {
                        errPos = ctx.farthestFailPos() >= 0 ? ctx.farthestFailPos() : tailPos();
                        var found = excerpt(errPos, FOUND_LENGTH, "...");
                        message = "Parser \"" + associatedSymbol(startParser).name() + "\" stopped before end, at: »"
                                  + found + "« " + continuation();
                        code = ErrorCode.PARSER_STOPPED_BEFORE_END;
                    }
                }

                var stitch = Node.zombie(skip).withPos(rest);
                stitches.add(stitch);
                if (stitch.pos() > 0) {
                    if (ctx.farthestFailPos() > errPos) {
                        message = "Farthest Fail at " + ctx.lineIndex().location(ctx.farthestFailPos()) + ", " + message;
                    }
                    errPos = Math.max(errPos, stitch.pos());
                }
                if (stitches.size() > 2) {
                    message = "Error after " + (stitches.size() - 2) + ". reentry: " + message;
                    code = ErrorCode.PARSER_STOPPED_ON_RETRY;
                    errPos = stitch.pos();
                }
                if (code == ErrorCode.PARSER_LOOKAHEAD_MATCH_ONLY || code == ErrorCode.PARSER_LOOKAHEAD_FAILURE_ONLY
                    || !ctx.hasErrorAt(errPos)) {
                    var error = Diagnostic.of(code, message, errPos);
                    ctx.addError(stitch, error);
                    if (ctx.historyTracking()) {
                        ctx.appendHistory(stitchRecord(stitch, error));
                        ctx.setHistoryTracking(false);
                    }
                }
                rest = skipEnd;
                result = null;
            }

            if (!stitches.isEmpty()) {
                if (result != null) {
                    stitches.add(result);
                }
                if (rest < docLength) {
                    stitches.add(Node.zombie(document.substring(rest)).withPos(rest));
                }
                result = Node.branch(Node.ZOMBIE_TAG, stitches).withPos(0);
            } else if (result == null) {
                result = Node.zombie("").withPos(0);
                ctx.addError(result, ErrorCode.PARSER_STOPPED_BEFORE_END,
                             "Parser \"" + startParser.repr() + "\" did not match: »"
                             + excerpt(0, DID_NOT_MATCH_LENGTH, " ...") + "«", 0);
            }

            reportVariables(result);
            verifyRoundTrip(result);
            return result;
        }

        /**
         * The node of a parse result, {@code null} for no match. The shared empty node is
         * never handed out.
         */
        private Node nodeOf(ParseResult result, int location) {
            Node node;
            if (result instanceof ParseResult.Match match) {
                node = match.node();
            } else if (result instanceof ParseResult.Failure failure) {
                node = failure.node();
            } else {
                return null;
            }
            return node == Node.EMPTY ? Node.leaf(Node.EMPTY_TAG, "").withPos(location) : node.ensurePos(location);
        }

        /**
         * Turns a violation that was not resumed on the way up into a zombie node covering
         * the text from {@code start} to the end of the partial result.
         */
        private Node absorb(ParseResult.Failure failure, int start) {
            var children = new ArrayList<Node>(2);
            if (failure.rest() > start) {
                children.add(Node.zombie(document.substring(start, failure.rest())).withPos(start));
            }
            if (failure.node() != Node.EMPTY) {
                children.add(failure.node().ensurePos(failure.rest()));
            }
            return Node.branch(Node.ZOMBIE_TAG, children).withPos(start);
        }

        private int tailPos() {
            if (stitches.isEmpty()) {
                return 0;
            }
            var last = stitches.get(stitches.size() - 1);
            return last.pos() + last.length();
        }

        private String excerpt(int pos, int length, String ellipsis) {
            int from = Math.max(0, Math.min(pos, document.length()));
            var text = document.substring(from, Math.min(document.length(), from + length)).replace("\n", "\\n");
            return from + length < document.length() - 1 ? text + ellipsis : text;
        }

        private String farthestFailName() {
            var failed = ctx.farthestFailParser();
            var symbol = associatedSymbol(failed);
            if (symbol != failed) {
                return symbol.name() + "->" + failed.repr();
            }
            return failed.repr();
        }

        private String continuation() {
            if (stitches.size() + 1 < config.maxParserDropouts()) {
                return ctx.historyTracking()
                       ? "Trying to recover but stopping history recording at this point."
                       : "Trying to recover...";
            }
            return config.maxParserDropouts() > 1 ? "Too many errors, terminating parser." : "Terminating parser.";
        }

        /**
         * True if the start parser only failed because a lookahead at the end of the
         * document did not match. Needs the call history.
         */
        private boolean lookaheadFailureOnly() {
            var history = ctx.history();
            if (history.size() < 2 || startParser == root) {
                return false;
            }
            for (var record : history.subList(0, history.size() - 1)) {
                if (record.status() == HistoryRecord.Status.MATCH) {
                    for (var item : record.callStack()) {
                        if (item.parser() instanceof Lookahead && item.location() >= document.length()) {
                            return true;
                        }
                    }
                }
            }
            return false;
        }

        /**
         * Position of a match of a lookahead reaching the end of the document, if the last
         * such match in the history does. Needs the call history.
         */
        private Optional<Integer> lookaheadMatchOnly() {
            var history = ctx.history();
            for (int i = history.size() - 1; i >= 0; i--) {
                var record = history.get(i);
                if (record.node() == null
                    || Node.EMPTY_TAG.equals(record.node().name()) && !record.node().hasResult()) {
                    continue;
                }
                boolean inLookahead = record.callStack().stream().anyMatch(item -> item.parser() instanceof Lookahead);
                if (!inLookahead) {
                    continue;
                }
                var status = record.status();
                if ((status == HistoryRecord.Status.MATCH || status == HistoryRecord.Status.DROP)
                    && record.node().pos() + record.node().length() == document.length()) {
                    return Optional.of(record.node().pos());
                }
                return Optional.empty();
            }
            return Optional.empty();
        }

        private HistoryRecord stitchRecord(Node stitch, Diagnostic error) {
            return new HistoryRecord(List.of(), stitch, error.pos(), error.pos(),
                                     ctx.lineIndex().location(error.pos()), List.of(error));
        }

        /**
         * Reports variables that still hold values after the end of parsing.
         */
        private void reportVariables(Node result) {
            var variables = ctx.nonEmptyVariables();
            if (variables.isEmpty()) {
                return;
            }
            var message = "Capture-stack not empty after end of parsing: "
                          + variables.entrySet().stream()
                                     .map(e -> e.getKey() + " " + e.getValue().size()
                                               + (e.getValue().size() > 1 ? " items" : " item"))
                                     .collect(Collectors.joining(", "));
            ErrorCode code;
            if (startParser.apply(Grammar::hasNonAutocapturedSymbol)) {
                if (variables.keySet().stream().allMatch(this::canCaptureZeroLength)) {
                    code = ErrorCode.CAPTURE_STACK_NOT_EMPTY_WARNING;
                } else {
                    code = startParser == root ? ErrorCode.CAPTURE_STACK_NOT_EMPTY
                                               : ErrorCode.CAPTURE_STACK_NOT_EMPTY_NON_ROOT_ONLY;
                }
            } else {
                code = startParser == root ? ErrorCode.AUTOCAPTURED_SYMBOL_NOT_CLEARED
                                           : ErrorCode.AUTOCAPTURED_SYMBOL_NOT_CLEARED_NON_ROOT;
            }
            if (result.isLeaf()) {
                ctx.addError(result, Diagnostic.of(code, message, result.pos() + result.length()));
            } else {
                int end = result.pos() + result.length();
                var errorNode = Node.zombie("").withPos(end);
                ctx.addError(errorNode, Diagnostic.of(code, message, end));
                var children = new ArrayList<>(result.children());
                children.add(errorNode);
                result.setChildren(children);
            }
        }

        private boolean canCaptureZeroLength(String variable) {
            return parser(variable).filter(Capture.class::isInstance)
                                   .map(capture -> matchesEmptyDocument(((Capture) capture).parser()))
                                   .orElse(false);
        }

        private void verifyRoundTrip(Node result) {
            if (dropsContent) {
                return;
            }
            var content = result.content();
            boolean consistent = completeMatch ? content.equals(document) : document.startsWith(content);
            if (!consistent) {
                log.error("Syntax tree of parser {} does not reproduce the document", startParser.repr());
            }
        }
    }

    /**
     * True if the path contains a capture that does not belong to a retrieve, i.e. whose
     * values are not only captured automatically on first retrieval.
     */
    private static boolean hasNonAutocapturedSymbol(List<Parser> path) {
        for (var parser : path) {
            if (parser instanceof Retrieve) {
                return false;
            }
            if (parser instanceof Capture capture) {
                Parser p = capture.parser();
                while (p instanceof Synonym || p instanceof Forward) {
                    p = ((UnaryParser) p).parser();
                }
                if (!(p instanceof Retrieve)) {
                    return true;
                }
            }
        }
        return false;
    }
}
