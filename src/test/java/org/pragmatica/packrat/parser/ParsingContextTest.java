package org.pragmatica.packrat.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.packrat.parser.Parsers.*;

/**
 * Tests for ParsingContext, focusing on memoization, variable rollback
 * and diagnostics bookkeeping.
 */
class ParsingContextTest {

    private static ParsingContext context(Parser root, String document) {
        var grammar = new Grammar(root);
        return ParsingContext.create(grammar, document, grammar.root());
    }

    // === Memoization ===

    @Test
    void memoTable_sameSignature_isShared() {
        var first = text("a");
        var second = text("a");
        var ctx = context(series(first, second).named("root"), "aa");

        assertSame(ctx.memoTable(first), ctx.memoTable(second));
    }

    @Test
    void memoTable_contextSensitiveParser_isNotMemoized() {
        var capture = capture("x", text("a"));
        var ctx = context(series(capture, pop(capture)).named("root"), "aa");

        assertNull(ctx.memoTable(capture));
    }

    @Test
    void memoTable_disabled_returnsNull() {
        var parser = text("a");
        var ctx = context(parser, "a");

        ctx.disableMemoization();
        assertNull(ctx.memoTable(parser));
        ctx.enableMemoization();
        assertNotNull(ctx.memoTable(parser));
    }

    @Test
    void invoke_storesResultInMemoTable() {
        var parser = text("a");
        var ctx = context(parser, "a");

        var result = parser.invoke(ctx, 0);

        assertSame(result, ctx.memoTable(parser).get(0));
        assertSame(result, parser.invoke(ctx, 0));
    }

    @Test
    void invoke_noMatch_doesNotAdvance() {
        var parser = text("x");
        var ctx = context(parser, "abc");

        var result = parser.invoke(ctx, 1);

        assertFalse(result.isMatch());
        assertEquals(1, result.rest());
        assertEquals(1, ctx.farthestFailPos());
        assertSame(parser, ctx.farthestFailParser());
    }

    // === Rollback ===

    @Test
    void rollbackTo_undoesEntriesAtOrAfterLocation() {
        var ctx = context(text("a"), "a");
        var log = new ArrayList<String>();
        ctx.pushRollback(1, () -> log.add("one"));
        ctx.pushRollback(3, () -> log.add("three"));

        ctx.rollbackTo(4);
        assertTrue(log.isEmpty());
        assertEquals(3, ctx.lastRollbackLocation());

        ctx.rollbackTo(2);
        assertEquals(List.of("three"), log);
        assertEquals(1, ctx.lastRollbackLocation());

        ctx.rollbackTo(0);
        assertEquals(List.of("three", "one"), log);
        assertEquals(-2, ctx.lastRollbackLocation());
    }

    @Test
    void pushRollback_suspendsMemoization() {
        var ctx = context(text("a"), "a");

        ctx.pushRollback(0, () -> {});

        assertTrue(ctx.isMemoizationSuspended());
    }

    @Test
    void variables_onlyNonEmptyStacksAreReported() {
        var ctx = context(text("a"), "a");
        ctx.variable("empty");
        ctx.variable("full").add("value");

        assertEquals(Map.of("full", List.of("value")), ctx.nonEmptyVariables());
    }

    // === Diagnostics ===

    @Test
    void addError_duplicateIsIgnored() {
        var ctx = context(text("a"), "a");
        var node = Node.leaf("x", "a");

        ctx.addError(node, ErrorCode.MANDATORY_CONTINUATION, "same", 0);
        ctx.addError(node, ErrorCode.MANDATORY_CONTINUATION, "same", 0);
        ctx.addError(node, Diagnostic.of(ErrorCode.MANDATORY_CONTINUATION, "other", 0));

        assertEquals(2, ctx.errors().size());
        assertEquals(2, node.errors().size());
        assertTrue(ctx.hasErrorAt(0));
        assertFalse(ctx.hasErrorAt(1));
        assertEquals("other", ctx.lastError().message());
    }

    @Test
    void reversedDocument_isComputedOnce() {
        var ctx = context(text("a"), "abc");

        assertEquals("cba", ctx.reversedDocument());
        assertSame(ctx.reversedDocument(), ctx.reversedDocument());
    }
}
