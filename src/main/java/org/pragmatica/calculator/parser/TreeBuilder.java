package org.pragmatica.calculator.parser;

import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;
import org.pragmatica.calculator.tree.Constants;
import org.pragmatica.calculator.tree.Node;
import org.pragmatica.calculator.tree.OperatorKind;

/**
 * Builds an expression tree from normalized input, one character at a time.
 *
 * <p>There is no token stream and no grammar. The builder keeps a single tree and reshapes
 * it after every character:
 * <ul>
 *   <li>digits and points extend the rightmost open number;</li>
 *   <li>a value following a completed value is multiplied with it;</li>
 *   <li>an operator symbol first <em>pushes</em> the tree (checks that no operand is
 *       missing) and then lets the new operator <em>fall</em> down the right edge past every
 *       operator it binds tighter than, so {@code 1+2*3} becomes {@code 1+(2*3)};</li>
 *   <li>a parenthesized layer is built by an independent builder and appended as a value.</li>
 * </ul>
 * The first error stops processing; the remaining input is ignored.
 */
public final class TreeBuilder {

    private sealed interface State permits Building, Naming {}

    private record Building(Node tree) implements State {}

    private record Naming(OperatorConstructor constructor) implements State {}

    private TreeBuilder() {}

    public static CalculationResult<Node> build(CharSequence source) {
        CalculationResult<State> state = CalculationResult.success(new Building(Node.EMPTY));
        int pos = 0;
        while (pos < source.length() && state.isSuccess()) {
            char c = source.charAt(pos++);
            if (c == '(') {
                var layer = LayerCollector.collect(source.subSequence(pos, source.length()));
                pos = layer.fold(error -> source.length(), found -> source.length() - found.tail().length());
                state = state.flatMap(TreeBuilder::settle)
                             .flatMap(tree -> layer.flatMap(found -> build(found.content()))
                                                   .flatMap(content -> appendValue(tree, new Node.Parenthesized(content))))
                             .map(Building::new);
            } else {
                state = state.flatMap(current -> step(current, c));
            }
        }
        return state.flatMap(TreeBuilder::settle)
                    .flatMap(TreeBuilder::finish);
    }

    private static CalculationResult<State> step(State state, char c) {
        if (state instanceof Naming naming) {
            var constructor = naming.constructor();
            if (constructor.accepts(c)) {
                return CalculationResult.success(new Naming(constructor.extend(c)));
            }
            return constructor.resolve()
                              .flatMap(tree -> step(tree, c));
        }
        return step(((Building) state).tree(), c);
    }

    private static CalculationResult<State> step(Node tree, char c) {
        if (isDigit(c) || c == '.') {
            return appendCharacter(tree, c).map(Building::new);
        }
        if (c == ')') {
            return CalculationError.INCORRECT_PARENTHESES_SEQUENCE.result();
        }
        var constant = Constants.forSymbol(c);
        if (constant.isPresent()) {
            return appendValue(tree, constant.get()).map(Building::new);
        }
        if (c == 'l') {
            return appendValue(tree, Node.Operator.logarithm()).map(Building::new);
        }
        if (OperatorConstructor.starts(c)) {
            return CalculationResult.success(new Naming(OperatorConstructor.start(tree, c)));
        }
        var kind = OperatorKind.symbol(c);
        if (kind.isEmpty()) {
            return CalculationError.UNKNOWN_CHARACTER.result();
        }
        return push(tree, kind.get()).map(Building::new);
    }

    private static CalculationResult<Node> settle(State state) {
        if (state instanceof Naming naming) {
            return naming.constructor()
                         .resolve();
        }
        return CalculationResult.success(((Building) state).tree());
    }

    /**
     * Append a digit or a point to the rightmost open number. Closed values get a new
     * number multiplied with them.
     */
    static CalculationResult<Node> appendCharacter(Node tree, char c) {
        if (tree instanceof Node.Number number && number.open()) {
            return CalculationResult.widen(number.append(c));
        }
        if (tree instanceof Node.Operator operator && !operator.isComplete()) {
            if (operator.kind() == OperatorKind.LOGARITHM) {
                return appendCharacter(operator.left(), c).map(operator::withLeft);
            }
            return appendCharacter(operator.right(), c).map(operator::withRight);
        }
        return appendValue(tree, Node.Number.of(c));
    }

    /**
     * Put a value into the rightmost empty operand, or multiply it with the rightmost
     * completed value.
     *
     * <p>The logarithm takes values into its base until the base is complete and a group
     * arrives; that group is its argument.
     */
    static CalculationResult<Node> appendValue(Node tree, Node value) {
        if (tree instanceof Node.Empty) {
            return CalculationResult.success(value);
        }
        if (tree instanceof Node.Operator operator && !operator.isComplete()) {
            if (operator.kind() == OperatorKind.LOGARITHM) {
                if (operator.left().awaitsOperand() || !(value instanceof Node.Parenthesized)) {
                    return appendValue(operator.left(), value).map(operator::withLeft);
                }
                return CalculationResult.success(new Node.Operator(OperatorKind.LOGARITHM, close(operator.left()), value));
            }
            // -sin1 and -lg100 need parentheses: -(sin1)
            if (operator.isSign() && operator.right() instanceof Node.Empty && isCall(value)) {
                return CalculationError.INCORRECT_METHOD_SEQUENCE.result();
            }
            return appendValue(operator.right(), value).map(operator::withRight);
        }
        return CalculationResult.success(new Node.Operator(OperatorKind.PRODUCT, close(tree), value));
    }

    /**
     * Attach an operator symbol to the tree. A leading {@code +} or {@code -} becomes a sign.
     */
    static CalculationResult<Node> push(Node tree, OperatorKind kind) {
        if (tree instanceof Node.Empty) {
            return kind.isAdditive()
                   ? CalculationResult.success(Node.Operator.binary(kind, Node.EMPTY))
                   : CalculationError.INCORRECT_METHOD_SEQUENCE.result();
        }
        if (tree.awaitsOperand()) {
            return CalculationError.INCORRECT_METHOD_SEQUENCE.result();
        }
        return CalculationResult.success(fall(tree, kind));
    }

    /**
     * Descend the right edge while the new operator binds tighter than the operator met,
     * then graft it onto the subtree found there.
     */
    static Node fall(Node tree, OperatorKind kind) {
        if (tree instanceof Node.Operator operator && !operator.isComplete() && kind.fallsInto(operator.kind())) {
            return operator.withRight(fall(operator.right(), kind));
        }
        return kind == OperatorKind.FACTORIAL
               ? Node.Operator.factorial(close(tree))
               : Node.Operator.binary(kind, close(tree));
    }

    /**
     * Close the rightmost number of a subtree which is about to become an operand.
     */
    static Node close(Node tree) {
        if (tree instanceof Node.Number number) {
            return number.close();
        }
        if (tree instanceof Node.Operator operator && !(operator.right() instanceof Node.Empty)) {
            return operator.withRight(close(operator.right()));
        }
        return tree;
    }

    private static CalculationResult<Node> finish(Node tree) {
        if (tree instanceof Node.Empty) {
            return CalculationError.EMPTY_INPUT.result();
        }
        if (tree.awaitsOperand()) {
            return CalculationError.INCORRECT_METHOD_SEQUENCE.result();
        }
        return CalculationResult.success(seal(tree));
    }

    /**
     * Give signs their zero left operand and close every number.
     */
    private static Node seal(Node tree) {
        if (tree instanceof Node.Number number) {
            return number.close();
        }
        if (tree instanceof Node.Operator operator) {
            var left = operator.isSign()
                       ? Node.ZERO
                       : seal(operator.left());
            return new Node.Operator(operator.kind(), left, seal(operator.right()));
        }
        return tree;
    }

    private static boolean isCall(Node value) {
        return value instanceof Node.Operator operator
               && (operator.kind().isFunction() || operator.kind() == OperatorKind.LOGARITHM);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
