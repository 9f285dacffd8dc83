package org.pragmatica.calculator.tree;

import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;

import java.math.BigDecimal;

/**
 * Expression tree node. Nodes are immutable; every structural edit builds new nodes
 * around the moved-in children, so subtrees are never shared.
 */
public sealed interface Node {

    /**
     * Placeholder for an operand that has not arrived yet.
     */
    Node EMPTY = new Empty();

    /**
     * Left operand of unary functions and factorial.
     */
    Number ZERO = new Number("0", false, false);

    /**
     * Human-readable form using normalized operator codes.
     */
    String display();

    /**
     * Whether this node ends with an operator still waiting for its operand.
     */
    boolean awaitsOperand();

    record Empty() implements Node {
        @Override
        public String display() {
            return "";
        }

        @Override
        public boolean awaitsOperand() {
            return true;
        }
    }

    /**
     * Numeric leaf. While {@code open}, digits and one point may still be appended;
     * {@code fractional} is set once the point has been seen.
     */
    record Number(String text, boolean fractional, boolean open) implements Node {

        /**
         * New open number started by a digit or a point.
         */
        public static Number of(char c) {
            return c == '.'
                   ? new Number("0.", true, true)
                   : new Number(String.valueOf(c), false, true);
        }

        /**
         * Closed number which does not accept further digits.
         */
        public static Number constant(String text) {
            return new Number(text, text.indexOf('.') >= 0, false);
        }

        public CalculationResult<Number> append(char c) {
            if (c != '.') {
                return CalculationResult.success(new Number(text + c, fractional, open));
            }
            if (fractional) {
                return CalculationError.INCORRECT_POINT_PLACEMENT.result();
            }
            return CalculationResult.success(new Number(text + c, true, open));
        }

        /**
         * Same number with no further digits accepted.
         */
        public Number close() {
            return open
                   ? new Number(text, fractional, false)
                   : this;
        }

        public BigDecimal value() {
            return new BigDecimal(text);
        }

        @Override
        public String display() {
            return text;
        }

        @Override
        public boolean awaitsOperand() {
            return false;
        }
    }

    /**
     * Subtree collected from one matched pair of parentheses.
     */
    record Parenthesized(Node content) implements Node {
        @Override
        public String display() {
            return "(" + content.display() + ")";
        }

        @Override
        public boolean awaitsOperand() {
            return false;
        }
    }

    /**
     * Operator node. Unary functions and factorial keep their operand on the right and
     * {@link #ZERO} on the left; the logarithm keeps its base on the left.
     */
    record Operator(OperatorKind kind, Node left, Node right) implements Node {

        /**
         * Binary operator awaiting its right operand.
         */
        public static Operator binary(OperatorKind kind, Node left) {
            return new Operator(kind, left, EMPTY);
        }

        /**
         * Unary function awaiting its argument.
         */
        public static Operator function(OperatorKind kind) {
            return new Operator(kind, ZERO, EMPTY);
        }

        /**
         * Logarithm awaiting its base and argument.
         */
        public static Operator logarithm() {
            return new Operator(OperatorKind.LOGARITHM, EMPTY, EMPTY);
        }

        public static Operator factorial(Node operand) {
            return new Operator(OperatorKind.FACTORIAL, ZERO, operand);
        }

        public Operator withLeft(Node left) {
            return new Operator(kind, left, right);
        }

        public Operator withRight(Node right) {
            return new Operator(kind, left, right);
        }

        /**
         * Leading {@code +} or {@code -} which has no left operand.
         */
        public boolean isSign() {
            return kind.isAdditive() && left instanceof Empty;
        }

        /**
         * Operator whose operands are all in place and which no following operator enters.
         */
        public boolean isComplete() {
            return switch (kind.arity()) {
                case POSTFIX -> true;
                case LOGARITHM -> !(right instanceof Empty);
                case BINARY, FUNCTION -> false;
            };
        }

        @Override
        public String display() {
            return switch (kind.arity()) {
                case BINARY -> left.display() + kind.code() + right.display();
                case FUNCTION -> kind.code() + argument(right);
                case POSTFIX -> right.display() + kind.code();
                case LOGARITHM -> kind.code() + left.display() + argument(right);
            };
        }

        private static String argument(Node node) {
            return node instanceof Parenthesized
                   ? node.display()
                   : "(" + node.display() + ")";
        }

        @Override
        public boolean awaitsOperand() {
            return switch (kind.arity()) {
                case POSTFIX -> false;
                case LOGARITHM -> left.awaitsOperand() || right instanceof Empty;
                case BINARY, FUNCTION -> right.awaitsOperand();
            };
        }
    }
}
