package org.pragmatica.packrat.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.error.GrammarException;
import org.pragmatica.packrat.parser.Capture;
import org.pragmatica.packrat.parser.Parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.pragmatica.packrat.parser.Parsers.*;

class GrammarTest {

    private static Parser numberParser() {
        var digits = regex("\\d+").named("digits");
        return series(digits, opt(series(1, text("."), digits))).named("number");
    }

    /**
     * value = number | list, list = "[" [value {"," value}] "]"
     */
    private static Parser listParser() {
        var value = forward();
        var number = regex("\\d+").named("number");
        var ws = regex("\\s*");
        var list = series(text("["), ws,
                          opt(series(value, zeroOrMore(series(ws, text(","), ws, value)))),
                          ws, text("]")).named("list");
        value.set(alt(number, list).named("value"));
        return value;
    }

    private static ErrorCode[] analysisCodes(Parser root) {
        var exception = assertThrows(GrammarException.class, () -> new Grammar(root));
        return exception.errors().stream()
                        .map(AnalysisError::error)
                        .map(Diagnostic::code)
                        .toArray(ErrorCode[]::new);
    }

    // === Static analysis ===

    @Test
    void lookaheadWithOptionalParser_isRejected() {
        var root = series(text("x"), lookahead(opt(text("a")))).named("root");

        assertThat(analysisCodes(root)).contains(ErrorCode.LOOKAHEAD_WITH_OPTIONAL_PARSER);
    }

    @Test
    void optionalAlternativeBeforeLast_isRejected() {
        var root = alt(opt(text("a")), text("b")).named("root");

        assertThat(analysisCodes(root)).contains(ErrorCode.BAD_ORDER_OF_ALTERNATIVES);
    }

    @Test
    void alternativePreemptedByEarlierOne_isRejected() {
        var root = alt(text("a"), text("b"), text("ab")).named("root");

        var exception = assertThrows(GrammarException.class, () -> new Grammar(root));

        assertThat(exception.errors()).hasSize(1);
        assertThat(exception.errors().get(0).error().message())
            .contains("Alternative 3 will never be reached")
            .contains("alternative 1");
    }

    @Test
    void duplicateAlternatives_areRejected() {
        var a = text("a");

        assertThat(analysisCodes(alt(a, a).named("root"))).contains(ErrorCode.DUPLICATE_PARSERS_IN_ALTERNATIVE);
    }

    @Test
    void mandatoryIndexOutOfRange_isRejected() {
        assertThat(analysisCodes(series(3, text("a")).named("root"))).contains(ErrorCode.BAD_MANDATORY_SETUP);
    }

    @Test
    void invalidRepetitionCount_isRejected() {
        assertThat(analysisCodes(counted(text("a"), 3, 2).named("root"))).contains(ErrorCode.BAD_REPETITION_COUNT);
    }

    @Test
    void oneOrMoreOfOptional_isRejected() {
        assertThat(analysisCodes(oneOrMore(opt(text("a"))).named("root")))
            .contains(ErrorCode.BADLY_NESTED_OPTIONAL_PARSER);
    }

    @Test
    void unnamedCapture_isRejected() {
        var capture = new Capture(text("a"));

        assertThat(analysisCodes(series(capture, text("b")).named("root")))
            .contains(ErrorCode.CAPTURE_WITHOUT_PARSERNAME);
    }

    @Test
    void parserThatNeverTouchesDocument_isRejected() {
        var forward = forward();
        var cycle = synonym("cycle", forward);
        forward.set(cycle);

        assertThat(analysisCodes(cycle)).containsExactly(ErrorCode.PARSER_NEVER_TOUCHES_DOCUMENT);
    }

    @Test
    void warnings_doNotPreventConstruction() {
        var x = capture("x", regex("a*"));
        var root = series(x, opt(opt(text("b"))), pop(x)).named("root");

        var grammar = new Grammar(root);

        assertThat(grammar.analysisErrors()).extracting(e -> e.error().code())
                                            .containsExactlyInAnyOrder(ErrorCode.OPTIONAL_REDUNDANTLY_NESTED_WARNING,
                                                                       ErrorCode.ZERO_LENGTH_CAPTURE_POSSIBLE_WARNING);
        assertThat(grammar.analysisErrors()).noneMatch(AnalysisError::isError);
    }

    @Test
    void staticAnalysisDisabled_acceptsFaultyGrammar() {
        var root = alt(opt(text("a")), text("b")).named("root");

        var grammar = new Grammar(root, GrammarConfig.DEFAULT.withStaticAnalysis(false));

        assertThat(grammar.analysisErrors()).isEmpty();
    }

    @Test
    void parsersWithSameName_areRejected() {
        var root = series(text("a").named("x"), text("b").named("x")).named("root");

        assertThrows(IllegalArgumentException.class, () -> new Grammar(root));
    }

    // === Symbols and memoization classes ===

    @Test
    void symbols_areCollectedByName() {
        var grammar = new Grammar(numberParser());

        assertThat(grammar.symbolNames()).containsExactlyInAnyOrder("number", "digits");
        assertThat(grammar.parser("digits")).isPresent();
        assertThat(grammar.parser("missing")).isEmpty();
    }

    @Test
    void associatedSymbol_isClosestNamedAncestor() {
        var dot = text(".");
        var digits = regex("\\d+").named("digits");
        var root = series(digits, opt(series(1, dot, digits))).named("number");

        var grammar = new Grammar(root);

        assertThat(grammar.associatedSymbol(dot)).isSameAs(root);
        assertThat(grammar.associatedSymbol(digits)).isSameAs(digits);
    }

    @Test
    void equalSignatures_shareMemoizationClass() {
        var first = text("a");
        var second = text("a");
        var shared = new Grammar(series(first, second).named("root"));

        assertThat(shared.eqClass(first)).isEqualTo(shared.eqClass(second));

        var third = text("a");
        var fourth = text("a");
        var separate = new Grammar(series(third, fourth).named("root"),
                                   GrammarConfig.DEFAULT.withSharedMemoization(false));

        assertThat(separate.eqClass(third)).isNotEqualTo(separate.eqClass(fourth));
    }

    // === Parsing ===

    @Test
    void parse_namedStartParser() {
        var grammar = new Grammar(numberParser());

        var result = grammar.parse("42", "digits");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().asSxpr()).isEqualTo("(digits \"42\")");
    }

    @Test
    void parse_unknownStartParser_throws() {
        var grammar = new Grammar(numberParser());

        assertThrows(IllegalArgumentException.class, () -> grammar.parse("42", "nope"));
    }

    @Test
    void parse_prefixOnly_whenCompleteMatchIsNotRequired() {
        var grammar = new Grammar(numberParser());

        var result = grammar.parse("42abc", "number", false);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().content()).isEqualTo("42");
    }

    @Test
    void parse_nonMatchingDocument_yieldsZombieWithError() {
        var grammar = new Grammar(text("a").named("root"));

        var result = grammar.parse("b");

        assertThat(result.root().isZombie()).isTrue();
        assertThat(result.root().content()).isEqualTo("b");
        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).code()).isEqualTo(ErrorCode.PARSER_STOPPED_BEFORE_END);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("Parser \"root\" did not match: »b«");
    }

    @Test
    void parse_emptyDocument_notMatched() {
        var result = new Grammar(text("a").named("root")).parse("");

        assertThat(result.diagnostics()).hasSize(1);
        assertThat(result.diagnostics().get(0).message()).isEqualTo("Parser \"root\" did not match empty document.");
    }

    @Test
    void parse_nestedStructure_reproducesDocument() {
        var grammar = new Grammar(listParser());
        var document = "[1, [2, 3], []]";

        var result = grammar.parse(document);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.root().content()).isEqualTo(document);
        assertThat(result.root().name()).isEqualTo("value");
        assertThat(result.root().descendants()).filteredOn(node -> node.name().equals("number"))
                                               .extracting(node -> node.content())
                                               .containsExactly("1", "2", "3");
    }

    @Test
    void parse_positionsMatchDocumentOffsets() {
        var document = "[10, [2]]";
        var result = new Grammar(listParser()).parse(document);

        for (var node : result.root().descendants()) {
            assertThat(node.hasPos()).isTrue();
            assertThat(document.substring(node.pos(), node.pos() + node.length())).isEqualTo(node.content());
        }
    }

    @Test
    void parse_isDeterministic() {
        var grammar = new Grammar(listParser());
        var document = "[1, [2, x], 3]";

        var first = grammar.parse(document);
        var second = grammar.parse(document);

        assertThat(second.root().asSxpr()).isEqualTo(first.root().asSxpr());
        assertThat(second.diagnostics()).isEqualTo(first.diagnostics());
    }

    @Test
    void parse_memoizationDoesNotChangeResult() {
        var document = "[1, [2, [3, 4]], [], 5]";

        var shared = new Grammar(listParser()).parse(document);
        var separate = new Grammar(listParser(), GrammarConfig.DEFAULT.withSharedMemoization(false)).parse(document);

        assertThat(separate.root().asSxpr()).isEqualTo(shared.root().asSxpr());
        assertThat(separate.diagnostics()).isEqualTo(shared.diagnostics());
    }

    @Test
    void match_andFullMatch() {
        var grammar = new Grammar(numberParser());
        var digits = grammar.parser("digits").orElseThrow();

        assertThat(grammar.match(digits, "12ab")).contains("12");
        assertThat(grammar.fullMatch(digits, "12ab")).isEmpty();
        assertThat(grammar.fullMatch(digits, "12")).contains("12");
    }

    @Test
    void matchesEmptyDocument_forOptionalParsers() {
        var grammar = new Grammar(numberParser());

        assertThat(grammar.matchesEmptyDocument(opt(text("x")))).isTrue();
        assertThat(grammar.matchesEmptyDocument(text("x"))).isFalse();
    }

    @Test
    void asEbnf_listsNamedParsers() {
        var ebnf = new Grammar(numberParser()).asEbnf();

        assertThat(ebnf).contains("number = digits [`.` § digits]");
        assertThat(ebnf).contains("digits = /\\d+/");
    }
}
