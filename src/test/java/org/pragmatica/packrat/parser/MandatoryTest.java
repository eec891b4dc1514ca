package org.pragmatica.packrat.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.packrat.parser.Parsers.*;

/**
 * Series with mandatory continuation: once the elements before the marker matched,
 * a failing element is reported instead of letting the series fail silently.
 */
class MandatoryTest {

    private static Grammar numberGrammar() {
        var digits = regex("\\d+");
        return new Grammar(series(digits, opt(series(1, text("."), digits))).named("number"));
    }

    @Test
    void number_withoutFraction_isSingleLeaf() {
        var result = numberGrammar().parse("42");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().asSxpr()).isEqualTo("(number \"42\")");
    }

    @Test
    void number_withFraction_keepsAllParts() {
        var result = numberGrammar().parse("3.14");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().asSxpr()).isEqualTo("(number (:RegExp \"3\") (:Text \".\") (:RegExp \"14\"))");
    }

    @Test
    void number_missingDigitsAfterDot_reportsMandatoryViolation() {
        var result = numberGrammar().parse("42.");

        assertThat(result.diagnostics()).hasSize(1);
        var error = result.diagnostics().get(0);
        assertThat(error.code()).isEqualTo(ErrorCode.MANDATORY_CONTINUATION);
        assertThat(error.pos()).isEqualTo(3);
        assertThat(error.message()).isEqualTo("'/\\d+/' expected by parser 'number', but »...« found instead!");
        assertThat(result.root().name()).isEqualTo("number");
        assertThat(result.root().content()).isEqualTo("42.");
    }

    @Test
    void series_failureBeforeMarker_isPlainNoMatch() {
        var root = alt(series(1, text("a"), text("b")), text("c")).named("root");

        var result = new Grammar(root).parse("c");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().asSxpr()).isEqualTo("(root \"c\")");
    }

    @Test
    void series_failureAfterMarker_isNotBacktracked() {
        var root = alt(series(1, text("a"), text("b")), series(text("a"), text("c"))).named("root");

        var result = new Grammar(root).parse("ac");

        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(ErrorCode.MANDATORY_CONTINUATION);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(1);
        assertThat(result.root().content()).isEqualTo("ac");
    }

    @Test
    void negativeMarkerIndex_countsFromEnd() {
        var series = series(-1, text("a"), text("b"), text("c"));

        assertThat(series.mandatory()).isEqualTo(2);
    }

    @Test
    void lookaheadAtEndOfDocument_isReportedAsEofViolation() {
        var root = series(1, text("a"), lookahead(text("b"))).named("root");

        var result = new Grammar(root).parse("a");

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                         .containsExactly(ErrorCode.MANDATORY_CONTINUATION_AT_EOF);
    }

    @Test
    void violationFromNestedParser_isReportedOnce() {
        var item = series(1, text("("), regex("\\w+"), text(")")).named("item");
        var root = oneOrMore(item).named("list");

        var result = new Grammar(root).parse("(a)(b(c)");

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(5);
        assertThat(result.root().content()).isEqualTo("(a)(b(c)");
    }
}
