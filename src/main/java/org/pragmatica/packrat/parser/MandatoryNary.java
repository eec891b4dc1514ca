package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.error.ReentryPointSearch;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * N-ary parser that reports a syntax error instead of a non-match once all parsers before
 * the mandatory index have matched and a later one fails.
 *
 * <pre>
 * fraction = `.` § /[0-9]+/      "3."  -> '/[0-9]+/' expected by parser 'fraction', but »...« found instead!
 * </pre>
 */
public abstract class MandatoryNary extends NaryParser {
    public static final int NO_MANDATORY = 1 << 30;

    protected final int mandatory;

    protected MandatoryNary(List<Parser> parsers, int mandatory) {
        super(parsers);
        this.mandatory = mandatory < 0 ? mandatory + parsers.size() : mandatory;
    }

    public int mandatory() {
        return mandatory;
    }

    /**
     * Outcome of a mandatory violation: the reported error and the position where
     * parsing continues.
     */
    protected record Violation(Diagnostic error, int continueAt) {}

    /**
     * Searches the skip rules of the associated symbol for a point where this parser
     * may continue. Without skip rules nothing is found.
     */
    protected ReentryPointSearch.Reentry reentryPoint(ParsingContext ctx, int location) {
        var rules = ctx.grammar().skipRules(ctx.symbolOf(this));
        if (rules.isEmpty()) {
            return new ReentryPointSearch.Reentry(-1, Node.zombie(""));
        }
        return ReentryPointSearch.find(ctx, location, rules);
    }

    /**
     * Reports a mandatory violation at {@code location}, attaching the error to {@code errNode}.
     *
     * @param failedOnLookahead True if the failing parser was a lookahead
     * @param expected          Description of what was expected
     * @param reloc             Reentry offset relative to {@code location}, negative if none was found
     */
    protected Violation mandatoryViolation(ParsingContext ctx, int location, boolean failedOnLookahead,
                                           String expected, int reloc, Node errNode) {
        var document = ctx.document();
        errNode.ensurePos(location);
        var found = Abbreviation.head(document, location, 10);
        var symbol = ctx.symbolOf(this);
        String message = null;
        for (var errorMessage : ctx.grammar().errorMessages(symbol)) {
            if (errorMessage.applies(document, location)) {
                try {
                    message = errorMessage.format(expected, found);
                    break;
                } catch (IllegalArgumentException e) {
                    ctx.addError(errNode, Diagnostic.of(ErrorCode.MALFORMED_ERROR_STRING,
                                                        "Malformed error format string »" + errorMessage.template()
                                                        + "« leads to »" + e.getMessage() + "«",
                                                        location));
                }
            }
        }
        if (message == null) {
            message = String.format("'%s' expected by parser '%s', but »%s« found instead!", expected, symbol, found);
        }
        ErrorCode code;
        if (failedOnLookahead && location >= document.length()) {
            code = ctx.startParser() == ctx.grammar().root()
                   ? ErrorCode.MANDATORY_CONTINUATION_AT_EOF
                   : ErrorCode.MANDATORY_CONTINUATION_AT_EOF_NON_ROOT;
        } else {
            code = ErrorCode.MANDATORY_CONTINUATION;
        }
        var error = Diagnostic.of(code, message, location, Math.max(ctx.farthestFailPos() - location, 1));
        ctx.addError(errNode, error);
        return new Violation(error, location + Math.max(reloc, 0));
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        var messages = new ArrayList<String>();
        int length = parsers.size();
        if (length >= NO_MANDATORY) {
            messages.add(String.format("Number of elements %d of series exceeds maximum length of %d",
                                       length, NO_MANDATORY));
        } else if (!(0 <= mandatory && mandatory < length || mandatory == NO_MANDATORY)) {
            messages.add(String.format("Illegal value %d for mandatory-parameter in a parser with %d elements!",
                                       mandatory, length));
        }
        if (!messages.isEmpty()) {
            messages.add(0, "Illegal configuration of mandatory Nary-parser "
                            + locationInfo(grammar.associatedSymbol(this).name()));
            errors.add(staticError(grammar, String.join("\n", messages), ErrorCode.BAD_MANDATORY_SETUP));
        }
        return errors;
    }

    @Override
    protected Object signatureKey() {
        return List.of(super.signatureKey(), mandatory);
    }
}
