package org.pragmatica.packrat.parser;

import com.google.common.collect.ImmutableList;
import org.pragmatica.packrat.error.AnalysisError;
import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.error.ErrorCode;
import org.pragmatica.packrat.grammar.Grammar;
import org.pragmatica.packrat.tree.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Matches its parsers in any order, each between its minimum and maximum number of times.
 *
 * <p>Parsers before the mandatory index must all be satisfied; if they are but a later
 * parser is not, a mandatory violation is reported like in {@link Series}.
 */
public class Interleave extends MandatoryNary {

    /**
     * Repetition bounds of one element.
     */
    public record Range(int min, int max) {
        public static final Range ONCE = new Range(1, 1);
    }

    private final List<Range> repetitions;
    private final Set<Parser> nonMandatory;

    public Interleave(List<Parser> parsers, int mandatory, List<Range> repetitions) {
        super(parsers, mandatory);
        if (repetitions.isEmpty()) {
            this.repetitions = Collections.nCopies(parsers.size(), Range.ONCE);
        } else {
            checkArgument(repetitions.size() == parsers.size(),
                          "Number of repetition ranges unequal number of sub-parsers!");
            this.repetitions = ImmutableList.copyOf(repetitions);
        }
        this.nonMandatory = Collections.newSetFromMap(new IdentityHashMap<>());
        for (int i = 0; i < Math.min(this.mandatory, parsers.size()); i++) {
            nonMandatory.add(parsers.get(i));
        }
    }

    public Interleave(List<Parser> parsers) {
        this(parsers, NO_MANDATORY, List.of());
    }

    public Interleave(Parser... parsers) {
        this(List.of(parsers));
    }

    public List<Range> repetitions() {
        return repetitions;
    }

    @Override
    protected ParseResult parse(ParsingContext ctx, int location) {
        var results = new ArrayList<Node>();
        int pos = location;
        var counter = new int[parsers.size()];
        var consumed = Collections.newSetFromMap(new IdentityHashMap<Parser, Boolean>());
        Diagnostic error = null;
        int reloc = -1;
        while (true) {
            int before = pos;
            boolean matched = false;
            for (int i = 0; i < parsers.size(); i++) {
                var parser = parsers.get(i);
                if (consumed.contains(parser)) {
                    continue;
                }
                var result = parser.invoke(ctx, pos);
                if (result instanceof ParseResult.Failure) {
                    return result;
                }
                if (result instanceof ParseResult.Match match) {
                    var node = match.node();
                    if (node.hasResult() || !node.isAnonymous()) {
                        results.add(node);
                    }
                    pos = match.rest();
                    counter[i]++;
                    if (counter[i] >= repetitions.get(i).max()) {
                        consumed.add(parser);
                    }
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                for (int i = 0; i < parsers.size(); i++) {
                    if (counter[i] >= repetitions.get(i).min()) {
                        consumed.add(parsers.get(i));
                    }
                }
                if (!consumed.containsAll(nonMandatory)) {
                    return ParseResult.NoMatch.at(location);
                }
                if (consumed.size() == parsers.size()) {
                    break;
                }
                var reentry = reentryPoint(ctx, pos);
                reloc = reentry.offset();
                var errNode = reentry.skipped();
                var expected = parsers.stream().map(Parser::repr).collect(Collectors.joining(" ° "));
                var violation = mandatoryViolation(ctx, pos, false, expected, reloc, errNode);
                error = violation.error();
                pos = violation.continueAt();
                results.add(errNode);
                if (reloc < 0) {
                    break;
                }
            }
            if (pos == before) {
                break;
            }
        }
        var node = returnValues(results);
        if (error != null && reloc < 0) {
            return new ParseResult.Failure(this, node, pos - location, location, error, true);
        }
        return ParseResult.Match.of(node, pos);
    }

    @Override
    public boolean isOptional() {
        return repetitions.stream().allMatch(r -> r.min() == 0);
    }

    @Override
    public List<AnalysisError> staticAnalysis(Grammar grammar) {
        var errors = new ArrayList<>(super.staticAnalysis(grammar));
        if (parsers.stream().anyMatch(p -> p.isOptional() || p instanceof FlowParser)) {
            errors.add(staticError(grammar,
                                   "Flow-operators and optional parsers are neither allowed nor needed in an "
                                   + "interleave-parser " + locationInfo(grammar.associatedSymbol(this).name()),
                                   ErrorCode.BADLY_NESTED_OPTIONAL_PARSER));
        }
        for (int i = 0; i < parsers.size(); i++) {
            var range = repetitions.get(i);
            int a = range.min();
            int b = range.max();
            if (a < 0 || b < 0 || a > b || a > Counted.INFINITE || b > Counted.INFINITE) {
                errors.add(staticError(grammar,
                                       String.format("Repetition count [a=%d, b=%d] for parser %s violates "
                                                     + "requirement 0 <= a <= b <= infinity = 2^30",
                                                     a, b, parsers.get(i)),
                                       ErrorCode.BAD_REPETITION_COUNT));
            }
        }
        return errors;
    }

    @Override
    protected Object signatureKey() {
        return List.of(super.signatureKey(), repetitions);
    }

    @Override
    public String describe() {
        return parsers.stream()
                      .map(p -> p instanceof Series || p instanceof Alternative ? "(" + p.repr() + ")" : p.repr())
                      .collect(Collectors.joining(" ° "));
    }
}
