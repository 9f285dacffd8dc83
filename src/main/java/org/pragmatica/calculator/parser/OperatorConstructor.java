package org.pragmatica.calculator.parser;

import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;
import org.pragmatica.calculator.tree.Node;
import org.pragmatica.calculator.tree.OperatorKind;

import java.util.Set;

/**
 * Parser state while a function name is being read.
 *
 * <p>Normalized function codes share prefixes ({@code c}, {@code ct}, {@code cth}), so the
 * operator is decided only when a character arrives which does not extend the name.
 *
 * @param previous tree the function will be appended to
 * @param name     function code accumulated so far
 */
public record OperatorConstructor(Node previous, String name) {
    private static final Set<String> PREFIXES = Set.of(
        "a", "s", "c", "t",
        "as", "ac", "at", "act",
        "sh", "ch", "th", "ct", "cth");

    /**
     * Whether the character may start a function name.
     */
    public static boolean starts(char c) {
        return PREFIXES.contains(String.valueOf(c));
    }

    public static OperatorConstructor start(Node previous, char c) {
        return new OperatorConstructor(previous, String.valueOf(c));
    }

    /**
     * Whether the character continues the name read so far.
     */
    public boolean accepts(char c) {
        return PREFIXES.contains(name + c);
    }

    public OperatorConstructor extend(char c) {
        return new OperatorConstructor(previous, name + c);
    }

    /**
     * Decide the function and append it to the previous tree.
     * An incomplete name, such as a lone {@code a}, is a misplaced method.
     */
    public CalculationResult<Node> resolve() {
        return OperatorKind.function(name)
                           .map(kind -> TreeBuilder.appendValue(previous, Node.Operator.function(kind)))
                           .orElseGet(CalculationError.INCORRECT_METHOD_SEQUENCE::result);
    }
}
