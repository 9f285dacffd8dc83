package org.pragmatica.calculator.parser;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Rewrites raw input into the canonical form consumed by {@link TreeBuilder}.
 *
 * <p>The rewrite is a fixed sequence of text substitutions:
 * <ol>
 *   <li>lower-case, whitespace removed;</li>
 *   <li>{@code pi} replaced by the constant symbol {@code p};</li>
 *   <li>digits right after {@code ln}/{@code lg} parenthesized: {@code lg100 -> lg(100)};</li>
 *   <li>function names shortened to codes: {@code sin -> s}, {@code cos -> c}, {@code tan -> t},
 *       {@code ctg -> ct}, {@code ln -> le}, {@code lg -> l10}, {@code log -> l}; the inverse
 *       prefix {@code a} and hyperbolic suffix {@code h} are kept as is;</li>
 *   <li>{@code *} inserted between a constant and an adjacent digit;</li>
 *   <li>a minus right after an operator or a function code is wrapped together with the
 *       following number, constant or group: {@code 2^-3 -> 2^(-3)}.</li>
 * </ol>
 * The rewrites are repeated until nothing changes, so normalizing an already normalized
 * string returns it unchanged.
 */
public final class Normalizer {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LOGARITHM_DIGITS = Pattern.compile("(l[ng])(\\d+)");
    private static final Pattern DIGIT_BEFORE_CONSTANT = Pattern.compile("(\\d)([ep])");
    private static final Pattern CONSTANT_BEFORE_DIGIT = Pattern.compile("([ep])(\\d)");

    // log goes first: shortening it may produce "ln" or "lg"
    private static final List<Map.Entry<String, String>> FUNCTION_CODES = List.of(
        Map.entry("log", "l"),
        Map.entry("ln", "le"),
        Map.entry("lg", "l10"),
        Map.entry("sin", "s"),
        Map.entry("cos", "c"),
        Map.entry("tan", "t"),
        Map.entry("ctg", "ct"));

    private static final String SIGN_MARKERS = "+-*/^scth";

    private Normalizer() {}

    public static String normalize(String source) {
        var current = source;
        while (true) {
            var next = rewrite(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    /**
     * One pass of all rewrites. A pass may join letters into a new name ({@code pii -> pi}),
     * so passes repeat until the text is stable.
     */
    private static String rewrite(String source) {
        var text = WHITESPACE.matcher(source.toLowerCase(Locale.ROOT))
                             .replaceAll("")
                             .replace("pi", "p");
        text = LOGARITHM_DIGITS.matcher(text)
                               .replaceAll("$1($2)");
        for (var entry : FUNCTION_CODES) {
            text = text.replace(entry.getKey(), entry.getValue());
        }
        text = DIGIT_BEFORE_CONSTANT.matcher(text)
                                    .replaceAll("$1*$2");
        text = CONSTANT_BEFORE_DIGIT.matcher(text)
                                    .replaceAll("$1*$2");
        return wrapSigns(text);
    }

    /**
     * Repeats sign wrapping until nothing changes. Every wrap removes one marker-minus pair
     * and creates none, so the loop terminates.
     */
    private static String wrapSigns(String text) {
        var current = text;
        while (true) {
            var next = wrapSignsOnce(current);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private static String wrapSignsOnce(String text) {
        var sb = new StringBuilder(text.length() + 8);
        int pos = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            sb.append(c);
            pos++;
            if (SIGN_MARKERS.indexOf(c) < 0 || pos >= text.length() || text.charAt(pos) != '-') {
                continue;
            }
            int end = operandEnd(text, pos + 1);
            if (end > pos + 1) {
                sb.append('(')
                  .append(text, pos, end)
                  .append(')');
                pos = end;
            }
        }
        return sb.toString();
    }

    /**
     * End (exclusive) of the number literal, constant or balanced group starting at {@code start},
     * or {@code start} itself if there is none.
     */
    private static int operandEnd(String text, int start) {
        if (start >= text.length()) {
            return start;
        }
        char c = text.charAt(start);
        if (TreeBuilder.isDigit(c) || c == '.') {
            int end = start;
            while (end < text.length() && (TreeBuilder.isDigit(text.charAt(end)) || text.charAt(end) == '.')) {
                end++;
            }
            return end;
        }
        if (c == 'e' || c == 'p') {
            return start + 1;
        }
        if (c == '(') {
            int depth = 0;
            for (int end = start; end < text.length(); end++) {
                switch (text.charAt(end)) {
                    case '(' -> depth++;
                    case ')' -> depth--;
                    default -> {}
                }
                if (depth == 0) {
                    return end + 1;
                }
            }
        }
        return start;
    }
}
