package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.grammar.GrammarConfig;
import org.pragmatica.packrat.grammar.HistoryRecord;
import org.pragmatica.packrat.tree.LineIndex;
import org.pragmatica.packrat.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable run-state of one top-level parse.
 *
 * <p>Holds the memoization tables, the variable stacks of context-sensitive parsers
 * together with their rollback log, the recursion counters of forward references,
 * farthest-failure tracking, the collected diagnostics and the call history. It is
 * passed explicitly down the parser call chain and is owned by exactly one parse run.
 */
public final class ParsingContext {
    private static final Logger log = LoggerFactory.getLogger(ParsingContext.class);

    private final Grammar grammar;
    private final GrammarConfig config;
    private final String document;
    private final Parser startParser;

    // Packrat memoization, one table per equivalence class
    private final Map<Integer, Map<Integer, ParseResult>> memoization;
    private boolean suspendMemoization;
    private int memoizationDisabled;

    // Variables of context-sensitive parsers and the log to undo their changes
    private final Map<String, List<String>> variables;
    private final List<RollbackEntry> rollback;
    private int lastRollbackLocation;

    // Left recursion bookkeeping
    private final Map<Forward, Map<Integer, Integer>> recursionCounters;

    // Farthest failure
    private int farthestFailPos;
    private Parser farthestFailParser;

    // Diagnostics
    private final List<Diagnostic> errors;
    private final Set<ErrorKey> errorKeys;

    // History tracking
    private boolean historyTracking;
    private final List<HistoryRecord.CallItem> callStack;
    private List<HistoryRecord> history;

    private String reversed;
    private LineIndex lineIndex;

    private ParsingContext(Grammar grammar, String document, Parser startParser) {
        this.grammar = grammar;
        this.config = grammar.config();
        this.document = document;
        this.startParser = startParser;
        this.memoization = new HashMap<>();
        this.variables = new LinkedHashMap<>();
        this.rollback = new ArrayList<>();
        this.lastRollbackLocation = -2;
        this.recursionCounters = new IdentityHashMap<>();
        this.farthestFailPos = -1;
        this.farthestFailParser = grammar.root();
        this.errors = new ArrayList<>();
        this.errorKeys = new HashSet<>();
        this.historyTracking = config.historyTracking();
        this.callStack = new ArrayList<>();
        this.history = new ArrayList<>();
    }

    public static ParsingContext create(Grammar grammar, String document, Parser startParser) {
        return new ParsingContext(grammar, document, startParser);
    }

    // === Document ===

    public String document() {
        return document;
    }

    public int documentLength() {
        return document.length();
    }

    public String text(int from, int to) {
        return document.substring(from, Math.min(to, document.length()));
    }

    /**
     * The document reversed, computed on first use.
     */
    public String reversedDocument() {
        if (reversed == null) {
            reversed = new StringBuilder(document).reverse().toString();
        }
        return reversed;
    }

    public LineIndex lineIndex() {
        if (lineIndex == null) {
            lineIndex = LineIndex.of(document);
        }
        return lineIndex;
    }

    // === Grammar ===

    public Grammar grammar() {
        return grammar;
    }

    public GrammarConfig config() {
        return config;
    }

    public Parser startParser() {
        return startParser;
    }

    /**
     * True if {@code parser} is the start parser or the parser a forward reference at the
     * start leads to. Failures reaching this parser are absorbed.
     */
    public boolean isStartParser(Parser parser) {
        var seen = Collections.newSetFromMap(new IdentityHashMap<Parser, Boolean>());
        var start = startParser;
        while (start != parser && start instanceof Forward && seen.add(start)) {
            start = ((Forward) start).parser();
        }
        return start == parser;
    }

    /**
     * Name of the closest named parser containing {@code parser}.
     */
    public String symbolOf(Parser parser) {
        return grammar.associatedSymbol(parser).name();
    }

    // === Memoization ===

    /**
     * Memoization table of the parser's equivalence class, or {@code null} if the
     * parser must not be memoized.
     */
    Map<Integer, ParseResult> memoTable(Parser parser) {
        if (memoizationDisabled > 0 || !parser.isMemoizable()) {
            return null;
        }
        return memoization.computeIfAbsent(grammar.eqClass(parser), k -> new HashMap<>());
    }

    public boolean isMemoizationSuspended() {
        return suspendMemoization;
    }

    public void setMemoizationSuspended(boolean value) {
        suspendMemoization = value;
    }

    public void disableMemoization() {
        memoizationDisabled++;
    }

    public void enableMemoization() {
        memoizationDisabled--;
    }

    // === Variables and rollback ===

    /**
     * The stack of captured values for {@code symbol}, created on demand.
     */
    public List<String> variable(String symbol) {
        return variables.computeIfAbsent(symbol, k -> new ArrayList<>());
    }

    /**
     * Snapshot of all non-empty variable stacks.
     */
    public Map<String, List<String>> nonEmptyVariables() {
        var result = new LinkedHashMap<String, List<String>>();
        variables.forEach((name, stack) -> {
            if (!stack.isEmpty()) {
                result.put(name, List.copyOf(stack));
            }
        });
        return result;
    }

    /**
     * Registers an undo action for a variable change at {@code location}. Memoization
     * stays suspended until the calling parser has returned.
     */
    public void pushRollback(int location, Runnable undo) {
        rollback.add(new RollbackEntry(location, undo));
        lastRollbackLocation = location;
        suspendMemoization = true;
    }

    /**
     * Undoes all variable changes registered at or after {@code location}, latest first.
     */
    public void rollbackTo(int location) {
        while (!rollback.isEmpty() && rollback.get(rollback.size() - 1).location() >= location) {
            rollback.remove(rollback.size() - 1).undo().run();
        }
        updateLastRollbackLocation();
    }

    public int lastRollbackLocation() {
        return lastRollbackLocation;
    }

    int rollbackSize() {
        return rollback.size();
    }

    /**
     * Undoes the most recent entries until only {@code size} entries are left.
     */
    void truncateRollback(int size) {
        while (rollback.size() > size) {
            rollback.remove(rollback.size() - 1).undo().run();
        }
        updateLastRollbackLocation();
    }

    private void updateLastRollbackLocation() {
        lastRollbackLocation = rollback.isEmpty() ? -2 : rollback.get(rollback.size() - 1).location();
    }

    private record RollbackEntry(int location, Runnable undo) {}

    // === Left recursion ===

    Map<Integer, Integer> recursionCounter(Forward forward) {
        return recursionCounters.computeIfAbsent(forward, k -> new HashMap<>());
    }

    // === Farthest failure ===

    void recordFailure(int location, Parser parser) {
        if (location > farthestFailPos) {
            farthestFailPos = location;
            farthestFailParser = parser;
        }
    }

    /**
     * Negates the farthest-failure position: a failure that a negative lookaround
     * expected must not count as the most advanced failure.
     */
    void invertFarthestFail() {
        if (farthestFailPos > 0) {
            farthestFailPos = -farthestFailPos;
        }
    }

    public int farthestFailPos() {
        return farthestFailPos;
    }

    public Parser farthestFailParser() {
        return farthestFailParser;
    }

    // === Diagnostics ===

    /**
     * Attaches a diagnostic to {@code node} and records it for the run. Diagnostics
     * that were already reported at the same position with the same code and message
     * are ignored.
     */
    public void addError(Node node, Diagnostic diagnostic) {
        if (!errorKeys.add(new ErrorKey(diagnostic.pos(), diagnostic.code(), diagnostic.message()))) {
            return;
        }
        if (node != Node.EMPTY) {
            node.addError(diagnostic);
        }
        errors.add(diagnostic);
    }

    public void addError(Node node, ErrorCode code, String message, int pos) {
        addError(node, Diagnostic.of(code, message, pos));
    }

    public List<Diagnostic> errors() {
        return Collections.unmodifiableList(errors);
    }

    public boolean hasErrorAt(int pos) {
        for (var error : errors) {
            if (error.pos() == pos) {
                return true;
            }
        }
        return false;
    }

    public Diagnostic lastError() {
        return errors.isEmpty() ? null : errors.get(errors.size() - 1);
    }

    private record ErrorKey(int pos, ErrorCode code, String message) {}

    // === History tracking ===

    public boolean historyTracking() {
        return historyTracking;
    }

    public void setHistoryTracking(boolean value) {
        historyTracking = value;
    }

    int callDepth() {
        return callStack.size();
    }

    void enterCall(Parser parser, int location) {
        callStack.add(new HistoryRecord.CallItem(parser, location));
    }

    void exitCall(int location, ParseResult result) {
        var node = result instanceof ParseResult.Match match ? match.node()
                   : result instanceof ParseResult.Failure failure ? failure.node() : null;
        var recordErrors = result instanceof ParseResult.Failure failure
                           ? List.of(failure.error()) : List.<Diagnostic>of();
        history.add(new HistoryRecord(List.copyOf(callStack), node, location, result.rest(),
                                      lineIndex().location(location), recordErrors));
        callStack.remove(callStack.size() - 1);
    }

    void unwindCalls(int depth) {
        while (callStack.size() > depth) {
            callStack.remove(callStack.size() - 1);
        }
    }

    public void appendHistory(HistoryRecord record) {
        history.add(record);
    }

    public List<HistoryRecord> history() {
        return Collections.unmodifiableList(history);
    }

    int historySize() {
        return history.size();
    }

    List<HistoryRecord> historySlice(int from) {
        return new ArrayList<>(history.subList(from, history.size()));
    }

    void restoreHistory(int from, List<HistoryRecord> tail) {
        var restored = new ArrayList<>(history.subList(0, Math.min(from, history.size())));
        restored.addAll(tail);
        history = restored;
    }

    // === Recursion overflow ===

    /**
     * Result for a parser call that exhausted the host call stack: a zombie node covering
     * the rest of the document, carrying a recursion-depth error.
     */
    ParseResult recursionOverflow(Parser parser, int location) {
        var node = Node.zombie(document.substring(location)).withPos(location);
        var error = Diagnostic.of(ErrorCode.RECURSION_DEPTH_LIMIT_HIT,
                                  "maximum recursion depth of parser reached; potentially due to too many "
                                  + "errors or left recursion!", location);
        if (!errorKeys.contains(new ErrorKey(location, error.code(), error.message()))) {
            log.warn("Call stack exhausted in parser {} at position {}", parser.repr(), location);
        }
        addError(node, error);
        return ParseResult.Match.of(node, document.length());
    }
}
