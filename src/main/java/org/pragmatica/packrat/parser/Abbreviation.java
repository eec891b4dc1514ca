package org.pragmatica.packrat.parser;

/**
 * Shortening of long strings in parser descriptions and error messages.
 */
final class Abbreviation {
    private Abbreviation() {}

    /**
     * Cuts out the middle of {@code s} if it is longer than {@code limit}.
     */
    static String middle(String s, int limit) {
        if (s.length() <= limit) {
            return s;
        }
        int half = limit / 2;
        return s.substring(0, half - 2) + " ... " + s.substring(s.length() - half + 3);
    }

    /**
     * The first {@code n} characters with line breaks made visible, followed by "...".
     */
    static String head(String document, int location, int n) {
        var head = document.substring(location, Math.min(document.length(), location + n));
        return head.replace("\n", "\\n") + "...";
    }

    static String escapeControl(String s) {
        return s.replace("\n", "\\n").replace("\t", "\\t").replace("\r", "\\r");
    }
}
