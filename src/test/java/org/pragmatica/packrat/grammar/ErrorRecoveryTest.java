package org.pragmatica.packrat.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.PackratParser;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.error.ErrorMessage;
import org.pragmatica.packrat.error.ReentryRule;
import org.pragmatica.packrat.parser.Parser;
import org.pragmatica.packrat.tree.Node;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.packrat.parser.Parsers.*;

/**
 * Recovery from mandatory violations: resume and skip rules, comments, custom messages
 * and the retries of the driving loop.
 */
class ErrorRecoveryTest {

    private static final String STATEMENTS = "a=1;b=;c=3;";

    /**
     * root = { stmt }+, stmt = /[a-z]+/ § "=" /\d+/ ";"
     */
    private static Parser statements() {
        var stmt = series(1, regex("[a-z]+"), text("="), regex("\\d+"), text(";")).named("stmt");
        return oneOrMore(stmt).named("root");
    }

    private static long countChildren(Node node, String name) {
        return node.children().stream().filter(child -> child.name().equals(name)).count();
    }

    // === Resume rules ===

    @Test
    void withoutRules_errorIsReportedAndDocumentKept() {
        var result = new Grammar(statements()).parse(STATEMENTS);

        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(ErrorCode.MANDATORY_CONTINUATION);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(6);
        assertThat(result.diagnostics().get(0).message())
            .isEqualTo("'/\\d+/' expected by parser 'stmt', but »;c=3;...« found instead!");
        assertThat(result.root().content()).isEqualTo(STATEMENTS);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.formatDiagnostics("stmts.txt")).startsWith("error[1010]: ").contains("--> stmts.txt:1:7");
    }

    @Test
    void resumeLiteral_continuesBehindSemicolon() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(6);
        assertThat(result.root().name()).isEqualTo("root");
        assertThat(countChildren(result.root(), "stmt")).isEqualTo(3);
        assertThat(result.root().content()).isEqualTo(STATEMENTS);
    }

    @Test
    void resumeRecognizer_behavesLikeLiteral() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.recognizer(regex("[^;]*;")))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(countChildren(result.root(), "stmt")).isEqualTo(3);
        assertThat(result.root().content()).isEqualTo(STATEMENTS);
    }

    @Test
    void resumeSearchFunction_isUsed() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.search((document, start, end) -> {
                                       int idx = document.indexOf(';', start);
                                       return idx >= 0 && idx < end ? new ReentryRule.Hit(idx, 1)
                                                                    : ReentryRule.Hit.NONE;
                                   }))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(countChildren(result.root(), "stmt")).isEqualTo(3);
    }

    @Test
    void resumeSearch_disabledByZeroWindow() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .reentrySearchWindow(0)
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.root().isZombie()).isTrue();
        assertThat(result.root().content()).isEqualTo(STATEMENTS);
    }

    @Test
    void resumeLiteral_beyondWindow_isNotFound() {
        var document = "a=1;b=xx;c=3;";

        var narrow = PackratParser.builder(statements())
                                  .resume("stmt", ReentryRule.literal(";"))
                                  .reentrySearchWindow(2)
                                  .build()
                                  .parse(document);
        var wide = PackratParser.builder(statements())
                                .resume("stmt", ReentryRule.literal(";"))
                                .reentrySearchWindow(3)
                                .build()
                                .parse(document);

        assertThat(narrow.root().isZombie()).isTrue();
        assertThat(narrow.root().content()).isEqualTo(document);
        assertThat(countChildren(wide.root(), "stmt")).isEqualTo(3);
        assertThat(wide.root().content()).isEqualTo(document);
    }

    @Test
    void reentryPoint_insideComment_isSkipped() {
        var document = "a=1;b=/*;*/;c=3;";
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .comments("/\\*.*?\\*/")
                                   .build();

        var result = grammar.parse(document);

        assertThat(result.errorCount()).isEqualTo(1);
        assertThat(countChildren(result.root(), "stmt")).isEqualTo(3);
        assertThat(result.root().content()).isEqualTo(document);
    }

    // === Forward reference as root ===

    private static ParseResultWithDiagnostics parseWithForwardRoot(boolean leftRecursion) {
        var root = forward();
        root.set(series(1, text("a"), text("b"), text("c")).named("s"));
        var config = GrammarConfig.DEFAULT.withLeftRecursion(leftRecursion);
        return new Grammar(root, config).parse("axyz\nabc");
    }

    private static void assertViolationKeepsDocument(ParseResultWithDiagnostics result) {
        assertThat(result.diagnostics()).extracting(Diagnostic::code).containsExactly(ErrorCode.MANDATORY_CONTINUATION);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(1);
        assertThat(result.root().content()).isEqualTo("axyz\nabc");

        var children = result.root().children();
        assertThat(children.get(children.size() - 1).name()).isEqualTo("s");
        assertThat(children.get(children.size() - 1).content()).isEqualTo("abc");
    }

    @Test
    void forwardRoot_violationIsAbsorbedByTarget() {
        assertViolationKeepsDocument(parseWithForwardRoot(true));
    }

    @Test
    void forwardRoot_withoutLeftRecursion_violationIsAbsorbedByTarget() {
        assertViolationKeepsDocument(parseWithForwardRoot(false));
    }

    // === Skip rules ===

    @Test
    void skipRule_continuesInsideSeries() {
        var grammar = PackratParser.builder(statements())
                                   .skip("stmt", ReentryRule.regex("(?=;)"))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.errorCount()).isEqualTo(1);
        var statements = result.root().children();
        assertThat(statements).hasSize(3);
        assertThat(statements.get(1).pick(Node.ZOMBIE_TAG)).isPresent();
        assertThat(statements.get(1).content()).isEqualTo("b=;");
    }

    // === Messages ===

    @Test
    void customErrorMessage_replacesDefault() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .errorMessages("stmt",
                                                  ErrorMessage.whenStartsWith("x", "never used"),
                                                  ErrorMessage.whenStartsWith(";", "{expected} needed before semicolon"))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("/\\d+/ needed before semicolon");
    }

    @Test
    void malformedErrorMessage_isReportedAlongWithDefault() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .errorMessages("stmt", ErrorMessage.always("{oops"))
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                         .containsExactly(ErrorCode.MALFORMED_ERROR_STRING,
                                                          ErrorCode.MANDATORY_CONTINUATION);
        assertThat(result.diagnostics().get(1).message()).startsWith("'/\\d+/' expected by parser 'stmt'");
    }

    @Test
    void resumeNotices_areAdded() {
        var grammar = PackratParser.builder(statements())
                                   .resume("stmt", ReentryRule.literal(";"))
                                   .resumeNotices(true)
                                   .build();

        var result = grammar.parse(STATEMENTS);

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                         .containsExactly(ErrorCode.MANDATORY_CONTINUATION, ErrorCode.RESUME_NOTICE);
        assertThat(result.diagnostics().get(1).pos()).isEqualTo(7);
        assertThat(result.diagnostics().get(1).severity()).isEqualTo(Diagnostic.Severity.INFO);
        assertThat(result.errorCount()).isEqualTo(1);
    }

    // === Retries of the driving loop ===

    /**
     * root = { /[a-z]+/ "=" /\d+/ ";" /\n?/ }
     */
    private static Parser lines() {
        return zeroOrMore(series(regex("[a-z]+"), text("="), regex("\\d+"), text(";"), regex("\\n?")))
            .named("root");
    }

    private static final String LINES = "a=1;\nxx\nyy\nzz\nb=2;\n";

    @Test
    void stoppedBeforeEnd_isRetriedBehindNextLineBreak() {
        var result = new Grammar(lines()).parse(LINES);

        assertThat(result.diagnostics()).extracting(Diagnostic::code)
                                         .containsExactly(ErrorCode.PARSER_STOPPED_BEFORE_END,
                                                          ErrorCode.PARSER_STOPPED_ON_RETRY);
        assertThat(result.diagnostics().get(0).pos()).isEqualTo(7);
        assertThat(result.diagnostics().get(0).message())
            .startsWith("Parser \"root\" stopped before end, at: »")
            .endsWith("Trying to recover...");
        assertThat(result.diagnostics().get(1).pos()).isEqualTo(8);
        assertThat(result.diagnostics().get(1).message()).startsWith("Error after ");
        assertThat(result.root().isZombie()).isTrue();
        assertThat(result.root().content()).isEqualTo(LINES);
    }

    @Test
    void singleDropout_terminatesAfterFirstError() {
        var grammar = PackratParser.builder(lines()).maxParserDropouts(1).build();

        var result = grammar.parse(LINES);

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).message()).endsWith("Terminating parser.");
        assertThat(result.root().content()).isEqualTo(LINES);
    }

    @Test
    void exhaustedDropouts_lastDiagnosticTerminates() {
        var document = "ab\nab\nab\nab\n";
        var root = oneOrMore(text("a")).named("root");

        var twoDropouts = PackratParser.builder(root).maxParserDropouts(2).build().parse(document);

        assertThat(twoDropouts.diagnostics()).hasSize(1);
        assertThat(twoDropouts.diagnostics().get(0).message()).endsWith("Too many errors, terminating parser.");
        assertThat(twoDropouts.root().content()).isEqualTo(document);

        var fourDropouts = PackratParser.builder(oneOrMore(text("a")).named("root"))
                                        .maxParserDropouts(4)
                                        .build()
                                        .parse(document);

        assertThat(fourDropouts.diagnostics()).hasSize(2);
        assertThat(fourDropouts.diagnostics().get(0).message()).endsWith("Trying to recover...");
        assertThat(fourDropouts.diagnostics().get(1).message())
            .startsWith("Error after ")
            .endsWith("Too many errors, terminating parser.");
        assertThat(fourDropouts.root().content()).isEqualTo(document);
    }
}
