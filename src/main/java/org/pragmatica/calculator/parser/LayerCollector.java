package org.pragmatica.calculator.parser;

import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;

/**
 * Extracts the text enclosed by one pair of parentheses.
 */
public final class LayerCollector {

    /**
     * Text between an opening parenthesis and its matching closing one, plus the text after it.
     */
    public record Layer(String content, String tail) {}

    private LayerCollector() {}

    /**
     * Collect the layer from input which starts right after an opening parenthesis.
     * The layer ends at the first closing parenthesis at nesting depth zero.
     */
    public static CalculationResult<Layer> collect(CharSequence source) {
        int depth = 0;
        for (int pos = 0; pos < source.length(); pos++) {
            switch (source.charAt(pos)) {
                case '(' -> depth++;
                case ')' -> {
                    if (depth == 0) {
                        return CalculationResult.success(new Layer(source.subSequence(0, pos)
                                                                         .toString(),
                                                                   source.subSequence(pos + 1, source.length())
                                                                         .toString()));
                    }
                    depth--;
                }
                default -> {}
            }
        }
        return CalculationError.INCORRECT_PARENTHESES_SEQUENCE.result();
    }
}
