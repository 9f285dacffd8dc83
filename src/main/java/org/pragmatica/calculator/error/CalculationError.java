package org.pragmatica.calculator.error;

/**
 * Closed set of failures reported by parsing and evaluation.
 * Every kind carries a fixed human-readable message.
 */
public enum CalculationError {
    /**
     * Input contains a character outside the recognized alphabet.
     */
    UNKNOWN_CHARACTER("Unknown character in the input."),

    /**
     * Unmatched opening or closing parenthesis.
     */
    INCORRECT_PARENTHESES_SEQUENCE("Incorrect parentheses sequence."),

    /**
     * Operator appears where an operand is expected, or an operand is missing at the end.
     */
    INCORRECT_METHOD_SEQUENCE("Incorrect method sequence."),

    /**
     * Second decimal point within one number.
     */
    INCORRECT_POINT_PLACEMENT("Incorrect point placement."),

    EMPTY_INPUT("Empty input."),

    DIVISION_BY_ZERO("Division by zero."),

    ILLEGAL_FACTORIAL("Illegal factorial parameter."),

    ILLEGAL_LOGARITHM("Illegal logarithm parameters."),

    ILLEGAL_TANGENT("Illegal tangent parameter."),

    ILLEGAL_COTANGENT("Illegal cotangent parameter."),

    ILLEGAL_ASIN("Illegal arcsine parameter."),

    ILLEGAL_ACOS("Illegal arccosine parameter."),

    /**
     * Numeric method failed although its domain check passed. Indicates an internal defect.
     */
    FAILED_TO_PROCESS("Failed to process the expression."),

    /**
     * Default error of operators without a domain restriction. Never reported for valid wiring.
     */
    UNKNOWN_ERROR("Unknown error: true = false.");

    private final String message;

    CalculationError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }

    public <T> CalculationResult<T> result() {
        return CalculationResult.failure(this);
    }

    @Override
    public String toString() {
        return message;
    }
}
