package org.pragmatica.packrat.parser;

import java.util.List;

/**
 * Compares the text at the current position with the top of a variable stack.
 */
public enum MatchFunction {
    /**
     * Matches the most recently captured value.
     */
    LAST_VALUE {
        @Override
        String match(String document, int location, String value) {
            return document.startsWith(value, location) ? value : null;
        }
    },
    /**
     * Matches the most recently captured value or, failing that, the empty string.
     */
    OPTIONAL_LAST_VALUE {
        @Override
        String match(String document, int location, String value) {
            return document.startsWith(value, location) ? value : "";
        }
    },
    /**
     * Matches the closing brackets for the opening brackets captured last, e.g.
     * {@code "]}"} for a captured {@code "[{"}.
     */
    MATCHING_BRACKET {
        @Override
        String match(String document, int location, String value) {
            var closing = value.replace('(', ')')
                               .replace('[', ']')
                               .replace('{', '}')
                               .replace('<', '>');
            return document.startsWith(closing, location) ? closing : null;
        }
    };

    /**
     * Returns the matched text, or {@code null} if there is no match.
     */
    abstract String match(String document, int location, String value);

    /**
     * Applies the function to the top of a non-empty stack.
     */
    String apply(String document, int location, List<String> stack) {
        return match(document, location, stack.get(stack.size() - 1));
    }

    /**
     * True if the function never fails once a value is available.
     */
    public boolean isOptional() {
        return this == OPTIONAL_LAST_VALUE;
    }
}
