package org.pragmatica.calculator.tree;

import org.pragmatica.calculator.error.CalculationError;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operator variants of the expression tree.
 *
 * <p>Each kind carries its display code, its binding rank and the error reported when
 * its domain check fails. Higher rank binds tighter: an operator of higher rank appended
 * after a lower-rank one falls into the right operand of the latter.
 */
public enum OperatorKind {
    ADDITION("+", Arity.BINARY, Rank.ADDITIVE, CalculationError.UNKNOWN_ERROR),
    SUBTRACTION("-", Arity.BINARY, Rank.ADDITIVE, CalculationError.UNKNOWN_ERROR),
    PRODUCT("*", Arity.BINARY, Rank.MULTIPLICATIVE, CalculationError.UNKNOWN_ERROR),
    DIVISION("/", Arity.BINARY, Rank.MULTIPLICATIVE, CalculationError.DIVISION_BY_ZERO),
    POWER("^", Arity.BINARY, Rank.POWER, CalculationError.UNKNOWN_ERROR),
    FACTORIAL("!", Arity.POSTFIX, Rank.POSTFIX, CalculationError.ILLEGAL_FACTORIAL),
    LOGARITHM("l", Arity.LOGARITHM, Rank.CALL, CalculationError.ILLEGAL_LOGARITHM),

    SIN("s", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),
    COS("c", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),
    TAN("t", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_TANGENT),
    COT("ct", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_COTANGENT),

    ASIN("as", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_ASIN),
    ACOS("ac", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_ACOS),
    ATAN("at", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),
    ACOT("act", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),

    SINH("sh", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),
    COSH("ch", Arity.FUNCTION, Rank.FUNCTION, CalculationError.UNKNOWN_ERROR),
    TANH("th", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_TANGENT),
    COTH("cth", Arity.FUNCTION, Rank.FUNCTION, CalculationError.ILLEGAL_COTANGENT);

    /**
     * Shape of the operands an operator takes.
     */
    public enum Arity {
        /** Two operands, written between them. */
        BINARY,
        /** Single operand on the right, written before it; left is always zero. */
        FUNCTION,
        /** Single operand on the right, written after it; left is always zero. */
        POSTFIX,
        /** Base on the left, built first, argument on the right. */
        LOGARITHM
    }

    /**
     * Binding ranks, weakest first.
     */
    static final class Rank {
        static final int ADDITIVE = 1;
        static final int MULTIPLICATIVE = 2;
        static final int FUNCTION = 3;
        static final int POWER = 4;
        static final int POSTFIX = 5;
        static final int CALL = 6;

        private Rank() {}
    }

    private final String code;
    private final Arity arity;
    private final int rank;
    private final CalculationError error;

    OperatorKind(String code, Arity arity, int rank, CalculationError error) {
        this.code = code;
        this.arity = arity;
        this.rank = rank;
        this.error = error;
    }

    public String code() {
        return code;
    }

    public Arity arity() {
        return arity;
    }

    public CalculationError error() {
        return error;
    }

    public boolean isFunction() {
        return arity == Arity.FUNCTION;
    }

    public boolean isAdditive() {
        return rank == Rank.ADDITIVE;
    }

    /**
     * Whether an operator of this kind, appended after an {@code existing} operator, must
     * fall into the right operand of the existing one instead of wrapping it.
     * Power falls into power, which makes it right-associative.
     */
    public boolean fallsInto(OperatorKind existing) {
        return rank > existing.rank || (this == POWER && existing == POWER);
    }

    /**
     * Operator written with a single symbol character: {@code + - * / ^ !}.
     */
    public static Optional<OperatorKind> symbol(char c) {
        return switch (c) {
            case '+' -> Optional.of(ADDITION);
            case '-' -> Optional.of(SUBTRACTION);
            case '*' -> Optional.of(PRODUCT);
            case '/' -> Optional.of(DIVISION);
            case '^' -> Optional.of(POWER);
            case '!' -> Optional.of(FACTORIAL);
            default -> Optional.empty();
        };
    }

    /**
     * Unary function with the given normalized code, e.g. {@code "s"} or {@code "act"}.
     */
    public static Optional<OperatorKind> function(String code) {
        return Arrays.stream(values())
                     .filter(OperatorKind::isFunction)
                     .filter(kind -> kind.code.equals(code))
                     .findFirst();
    }
}
