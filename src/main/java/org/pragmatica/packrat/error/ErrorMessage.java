package org.pragmatica.packrat.error;

import java.util.regex.Pattern;

/**
 * Custom message for a mandatory violation, chosen when its condition holds at the
 * failure position.
 *
 * <p>The template may refer to the expected parser and the text found instead, either
 * by name ({@code {expected}}, {@code {found}}), by index ({@code {0}}, {@code {1}}) or
 * automatically numbered ({@code {}}). Literal braces are written doubled.
 *
 * @param condition Condition on the text at the failure position
 * @param template  Message template
 */
public record ErrorMessage(Condition condition, String template) {

    @FunctionalInterface
    public interface Condition {
        boolean test(String document, int location);
    }

    public static ErrorMessage whenStartsWith(String prefix, String template) {
        return new ErrorMessage((document, location) -> document.startsWith(prefix, location), template);
    }

    public static ErrorMessage whenMatches(String regex, String template) {
        var pattern = Pattern.compile(regex);
        return new ErrorMessage((document, location) -> {
            var matcher = pattern.matcher(document);
            matcher.region(location, document.length());
            matcher.useTransparentBounds(true);
            matcher.useAnchoringBounds(false);
            return matcher.lookingAt();
        }, template);
    }

    public static ErrorMessage always(String template) {
        return new ErrorMessage((document, location) -> true, template);
    }

    public boolean applies(String document, int location) {
        return condition.test(document, location);
    }

    /**
     * Fills in the template.
     *
     * @throws IllegalArgumentException if the template is malformed
     */
    public String format(String expected, String found) {
        var sb = new StringBuilder(template.length() + expected.length() + found.length());
        int autoIndex = 0;
        boolean manualNumbering = false;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    sb.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("Single '}' encountered in format string");
            }
            if (c != '{') {
                sb.append(c);
                i++;
                continue;
            }
            if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                sb.append('{');
                i += 2;
                continue;
            }
            int close = template.indexOf('}', i);
            if (close < 0) {
                throw new IllegalArgumentException("Single '{' encountered in format string");
            }
            var field = template.substring(i + 1, close);
            switch (field) {
                case "" -> {
                    if (manualNumbering) {
                        throw new IllegalArgumentException(
                            "cannot switch from manual field specification to automatic field numbering");
                    }
                    sb.append(argument(autoIndex++, expected, found));
                }
                case "0", "1" -> {
                    if (autoIndex > 0) {
                        throw new IllegalArgumentException(
                            "cannot switch from automatic field numbering to manual field specification");
                    }
                    manualNumbering = true;
                    sb.append(argument(Integer.parseInt(field), expected, found));
                }
                case "expected" -> sb.append(expected);
                case "found" -> sb.append(found);
                default -> throw new IllegalArgumentException("Unknown placeholder '" + field + "'");
            }
            i = close + 1;
        }
        return sb.toString();
    }

    private static String argument(int index, String expected, String found) {
        return switch (index) {
            case 0 -> expected;
            case 1 -> found;
            default -> throw new IllegalArgumentException("Replacement index " + index + " out of range");
        };
    }
}
