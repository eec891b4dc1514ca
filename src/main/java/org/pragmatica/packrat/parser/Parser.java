package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.error.ReentryPointSearch;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Base class of all parsers.
 *
 * <p>A parser is invoked with the shared {@link ParsingContext} and an absolute document
 * position. {@link #invoke(ParsingContext, int)} is the guard common to all parsers:
 * it rolls back variable changes when backtracking, consults and fills the memoization
 * table, catches mandatory-violation signals to resume at a reentry point, records the
 * call history and converts host stack exhaustion into an error node. The actual work is
 * done by {@link #parse(ParsingContext, int)}.
 *
 * <p>Parsers without a name are disposable: their nodes are named {@code :ClassName}
 * and may be flattened into the parent's result.
 */
public abstract class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private String name = "";
    private boolean disposable = true;
    private boolean dropContent = false;
    private String nodeName;

    protected Parser() {
        this.nodeName = ptype();
    }

    // === Guard ===

    /**
     * Applies the parser at {@code location}. A {@link ParseResult.Failure} is only
     * returned if no reentry point could be found at this level.
     */
    public ParseResult invoke(ParsingContext ctx, int location) {
        int callDepth = ctx.callDepth();
        boolean saveSuspend = ctx.isMemoizationSuspended();
        try {
            if (location <= ctx.lastRollbackLocation()) {
                ctx.rollbackTo(location);
            }
            // Suspension only blocks writes. Entries never depend on variables, and a
            // growing left-recursive seed is read back from here.
            var memo = ctx.memoTable(this);
            if (memo != null) {
                var memoized = memo.get(location);
                if (memoized != null) {
                    return memoized;
                }
            }
            ctx.setMemoizationSuspended(false);
            boolean tracking = ctx.historyTracking();
            if (tracking) {
                ctx.enterCall(this, location);
            }

            var result = parse(ctx, location);
            if (result instanceof ParseResult.Failure failure) {
                result = resume(ctx, location, failure);
            }

            if (tracking) {
                ctx.exitCall(location, result);
            }
            if (result instanceof ParseResult.Match match) {
                match.node().ensurePos(location);
            } else if (result instanceof ParseResult.NoMatch) {
                ctx.recordFailure(location, this);
            }
            if (!ctx.isMemoizationSuspended()) {
                if (memo != null && !(result instanceof ParseResult.Failure)) {
                    memo.put(location, result);
                }
                ctx.setMemoizationSuspended(saveSuspend);
            }
            return result;
        } catch (StackOverflowError e) {
            ctx.unwindCalls(callDepth);
            ctx.setMemoizationSuspended(saveSuspend);
            return ctx.recursionOverflow(this, location);
        }
    }

    /**
     * Does the actual parsing. Must return {@link ParseResult.NoMatch} at
     * {@code location} if the parser does not match.
     */
    protected abstract ParseResult parse(ParsingContext ctx, int location);

    /**
     * Catches a mandatory-violation signal. Either a reentry point is found (or this is
     * the start parser) and parsing continues behind it, or the signal is passed on to
     * the caller with the skipped text prepended.
     */
    private ParseResult resume(ParsingContext ctx, int location, ParseResult.Failure failure) {
        var document = ctx.document();
        int gap = failure.rest() - location;
        int restPos = failure.resumeFrom();
        var rules = ctx.grammar().resumeRules(ctx.symbolOf(this));
        var reentry = ReentryPointSearch.find(ctx, restPos, rules);
        int i = reentry.offset();

        if (i >= 0 || ctx.isStartParser(this)) {
            i = Math.max(i, 0);
            var failureNode = failure.node();
            var zombie = failureNode.pick(Node.ZOMBIE_TAG);
            var tail = new ArrayList<Node>(1);
            if (zombie.isPresent() && !zombie.get().hasResult()) {
                zombie.get().setText(document.substring(restPos, restPos + i));
                if (failureNode != Node.EMPTY) {
                    failureNode.setChildren(failureNode.children());
                }
            } else {
                tail.add(reentry.skipped());
            }
            Node node;
            if (failure.firstThrow()) {
                if (failureNode == Node.EMPTY || failureNode.isLeaf() && failureNode.hasResult()) {
                    var children = new ArrayList<Node>();
                    if (failureNode != Node.EMPTY) {
                        children.add(failureNode);
                    }
                    children.addAll(tail);
                    node = Node.branch(nodeName, children);
                } else {
                    var children = new ArrayList<>(failureNode.children());
                    children.addAll(tail);
                    failureNode.setChildren(children);
                    node = failureNode;
                }
            } else {
                var children = new ArrayList<Node>();
                children.add(Node.zombie(document.substring(location, failure.rest())).withPos(location));
                if (failureNode != Node.EMPTY) {
                    children.add(failureNode);
                }
                children.addAll(tail);
                node = Node.branch(nodeName, children);
            }
            node.withPos(node.hasPos() ? node.pos() : location);
            if (ctx.config().resumeNotices()) {
                ctx.addError(node, Diagnostic.of(ErrorCode.RESUME_NOTICE,
                                                 "Resuming from parser \"" + repr() + "\" at position "
                                                 + ctx.lineIndex().location(restPos + i)
                                                 + " with parser \"" + ctx.symbolOf(this) + "\"",
                                                 restPos + i, 0));
            }
            log.debug("Resuming parser {} at position {}", repr(), restPos + i);
            return ParseResult.Match.of(node, restPos + i);
        }
        if (failure.firstThrow()) {
            return failure.withFirstThrow(false);
        }
        var lastError = ctx.lastError();
        if (lastError != null
            && (lastError.code() == ErrorCode.MANDATORY_CONTINUATION_AT_EOF
                || lastError.code() == ErrorCode.MANDATORY_CONTINUATION_AT_EOF_NON_ROOT)) {
            var node = failure.node() == Node.EMPTY
                       ? Node.leaf(nodeName, "")
                       : Node.branch(nodeName, failure.node());
            return ParseResult.Match.of(node.withPos(location), restPos);
        }
        var children = new ArrayList<Node>(2);
        if (gap > 0) {
            children.add(Node.zombie(document.substring(location, failure.rest())).withPos(location));
        }
        if (failure.node() != Node.EMPTY) {
            children.add(failure.node());
        }
        var node = Node.branch(nodeName, children).withPos(location);
        return failure.relocated(node, failure.nodeOrigLen() + gap, location);
    }

    // === Naming ===

    /**
     * Sets the parser's name. A named parser that is still marked as disposable produces
     * anonymous nodes named {@code :name}.
     */
    public Parser named(String newName, boolean isDisposable) {
        checkNotNull(newName, "name");
        this.name = newName;
        this.disposable = isDisposable;
        if (isDisposable) {
            this.nodeName = newName.isEmpty() ? ptype() : ":" + newName;
        } else {
            this.nodeName = newName.isEmpty() ? ptype() : newName;
        }
        return this;
    }

    public Parser named(String newName) {
        return named(newName, false);
    }

    /**
     * Lets the parser return the shared empty node instead of its result. Only disposable
     * parsers may drop their content.
     */
    public Parser drop() {
        checkArgument(disposable, "Parser %s must be disposable to drop its content", name);
        this.dropContent = true;
        return this;
    }

    public String name() {
        return name;
    }

    public boolean isDisposable() {
        return disposable;
    }

    public boolean dropsContent() {
        return dropContent;
    }

    /**
     * Name of the nodes this parser creates.
     */
    public String nodeName() {
        return nodeName;
    }

    /**
     * Type name of the parser: the class name prefixed with a colon.
     */
    public String ptype() {
        return ":" + getClass().getSimpleName();
    }

    // === Structure ===

    public List<Parser> subParsers() {
        return List.of();
    }

    /**
     * True if the parser can never fail to match.
     */
    public boolean isOptional() {
        return false;
    }

    boolean isMemoizable() {
        return true;
    }

    /**
     * Key that is equal for two parsers yielding the same result on the same document
     * position. Identity by default, which disables sharing of memoization tables.
     */
    protected Object signatureKey() {
        return this;
    }

    /**
     * Signature used to group parsers into equivalence classes sharing one memoization
     * table. Named parsers are identified by their name.
     */
    public Object signature() {
        if (!name.isEmpty()) {
            return name;
        }
        return List.of(nodeName, dropContent, signatureKey());
    }

    /**
     * All parsers reachable from this one, each given as the path from this parser.
     * Every parser is visited once, cycles are not followed.
     */
    public List<List<Parser>> descendants() {
        var result = new ArrayList<List<Parser>>();
        var visited = Collections.newSetFromMap(new IdentityHashMap<Parser, Boolean>());
        collectDescendants(this, List.of(), visited, result);
        return result;
    }

    private static void collectDescendants(Parser parser, List<Parser> path, Set<Parser> visited,
                                           List<List<Parser>> result) {
        if (!visited.add(parser)) {
            return;
        }
        var context = new ArrayList<>(path);
        context.add(parser);
        var frozen = List.copyOf(context);
        result.add(frozen);
        for (var sub : parser.subParsers()) {
            collectDescendants(sub, frozen, visited, result);
        }
    }

    /**
     * Applies {@code func} to the paths of all descendants in pre-order until it returns true.
     *
     * @return true if {@code func} stopped the traversal
     */
    public boolean apply(Predicate<List<Parser>> func) {
        for (var context : descendants()) {
            if (func.test(context)) {
                return true;
            }
        }
        return false;
    }

    // === Static analysis ===

    /**
     * Checks the parser for configuration errors once the grammar is assembled.
     */
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        return List.of();
    }

    protected AnalysisError staticError(Grammar grammar, String message, ErrorCode code) {
        return new AnalysisError(grammar.associatedSymbol(this).name(), this,
                                 Diagnostic.of(code, message, 0));
    }

    // === Rendering ===

    /**
     * Grammar-like rendering of the parser's structure.
     */
    public String describe() {
        return name + ptype();
    }

    /**
     * The name if the parser is named, otherwise its structure.
     */
    public String repr() {
        return name.isEmpty() ? describe() : name;
    }

    @Override
    public String toString() {
        return name + (name.isEmpty() ? "" : " = ") + describe();
    }
}
