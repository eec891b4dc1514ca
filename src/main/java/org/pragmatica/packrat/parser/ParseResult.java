package org.pragmatica.packrat.parser;

import org.pragmatica.packrat.error.Diagnostic;
import org.pragmatica.packrat.tree.Node;

/**
 * Result of invoking a parser at a document position.
 *
 * <p>{@link #rest()} is the absolute position where the remaining text starts. A
 * {@link NoMatch} always carries the position the parser was invoked at.
 */
public sealed interface ParseResult {

    int rest();

    default boolean isMatch() {
        return this instanceof Match;
    }

    /**
     * Successful parse, possibly of zero length.
     */
    record Match(Node node, int rest) implements ParseResult {
        public static Match of(Node node, int rest) {
            return new Match(node, rest);
        }
    }

    /**
     * The parser did not match; the position has not advanced.
     */
    record NoMatch(int rest) implements ParseResult {
        public static NoMatch at(int location) {
            return new NoMatch(location);
        }
    }

    /**
     * A mandatory element of a sequence-like parser failed after the non-mandatory part
     * had already matched.
     *
     * <p>The signal travels up through the enclosing parsers until a parser guard finds a
     * reentry point or the driving loop takes over. It never reaches the caller.
     *
     * @param parser      The parser that raised the signal
     * @param node        Partial result including an error node
     * @param nodeOrigLen Number of characters the partial result covers, counted from {@code rest}
     * @param rest        Position where the signalling parser (or the one that re-signalled) started
     * @param error       The mandatory-violation diagnostic
     * @param firstThrow  True until the signal passes the guard of the parser that raised it
     */
    record Failure(
        Parser parser,
        Node node,
        int nodeOrigLen,
        int rest,
        Diagnostic error,
        boolean firstThrow
    ) implements ParseResult {

        public Failure withFirstThrow(boolean value) {
            return new Failure(parser, node, nodeOrigLen, rest, error, value);
        }

        public Failure relocated(Node newNode, int newNodeOrigLen, int newRest) {
            return new Failure(parser, newNode, newNodeOrigLen, newRest, error, false);
        }

        /**
         * Position right behind the partial result.
         */
        public int resumeFrom() {
            return rest + nodeOrigLen;
        }
    }
}
