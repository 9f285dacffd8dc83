package org.pragmatica.calculator.eval;

import ch.obermuhlner.math.big.BigDecimalMath;
import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;
import org.pragmatica.calculator.tree.Node;
import org.pragmatica.calculator.tree.OperatorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Evaluates an expression tree bottom-up on a worker pool.
 *
 * <p>Sibling subtrees are evaluated independently and combined by continuations, so no
 * pool thread ever waits for another task. The first error wins: a failed left operand
 * completes the parent immediately, a failed right operand as soon as the left one is
 * known to be fine. The reported error is therefore always the leftmost one.
 *
 * <p>Addition, subtraction and multiplication are exact; division is rounded to the
 * configured context. Transcendental functions are computed with guard digits and then
 * rounded to the configured context.
 */
public final class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);
    private static final int GUARD_DIGITS = 10;

    private final Executor executor;
    private final int parallelism;
    private final long factorialLimit;
    private final MathContext mathContext;
    private final MathContext workingContext;

    private record Operands(BigDecimal left, BigDecimal right) {}

    private Evaluator(Executor executor, int parallelism, long factorialLimit, MathContext mathContext) {
        this.executor = executor;
        this.parallelism = parallelism;
        this.factorialLimit = factorialLimit;
        this.mathContext = mathContext;
        this.workingContext = new MathContext(mathContext.getPrecision() + GUARD_DIGITS,
                                              mathContext.getRoundingMode());
    }

    public static Evaluator create(Executor executor, int parallelism, long factorialLimit, MathContext mathContext) {
        return new Evaluator(executor, parallelism, factorialLimit, mathContext);
    }

    public CompletableFuture<CalculationResult<BigDecimal>> evaluate(Node node) {
        if (node instanceof Node.Number number) {
            return completed(CalculationResult.success(number.value()));
        }
        if (node instanceof Node.Parenthesized group) {
            return evaluate(group.content());
        }
        if (node instanceof Node.Operator operator) {
            var kind = operator.kind();
            return both(evaluate(operator.left()), evaluate(operator.right()))
                .thenCompose(operands -> dispatch(kind, operands));
        }
        return completed(CalculationError.EMPTY_INPUT.result());
    }

    private CompletableFuture<CalculationResult<BigDecimal>> dispatch(OperatorKind kind,
                                                                     CalculationResult<Operands> operands) {
        if (operands.isFailure()) {
            return completed(operands.error().result());
        }
        var values = operands.unwrap();
        if (kind == OperatorKind.FACTORIAL) {
            return factorial(values.right());
        }
        return CompletableFuture.supplyAsync(() -> apply(kind, values.left(), values.right()), executor);
    }

    private CompletableFuture<CalculationResult<BigDecimal>> factorial(BigDecimal value) {
        if (!admits(OperatorKind.FACTORIAL, BigDecimal.ZERO, value)) {
            return completed(OperatorKind.FACTORIAL.error().result());
        }
        return Factorials.parallel(value.longValueExact(), parallelism, executor)
                         .thenApply(product -> CalculationResult.success(new BigDecimal(product)));
    }

    /**
     * Check the domain of the operator, then compute it.
     */
    CalculationResult<BigDecimal> apply(OperatorKind kind, BigDecimal left, BigDecimal right) {
        try {
            if (!admits(kind, left, right)) {
                return kind.error().result();
            }
            return CalculationResult.success(compute(kind, left, right));
        } catch (ArithmeticException e) {
            log.warn("Unable to compute {} with operands {} and {}", kind, left, right, e);
            return CalculationError.FAILED_TO_PROCESS.result();
        }
    }

    boolean admits(OperatorKind kind, BigDecimal left, BigDecimal right) {
        return switch (kind) {
            case ADDITION, SUBTRACTION, PRODUCT, POWER, SIN, COS, ATAN, ACOT, SINH, COSH -> true;
            case DIVISION -> right.signum() != 0;
            case LOGARITHM -> left.signum() > 0 && left.compareTo(BigDecimal.ONE) != 0 && right.signum() > 0;
            case ASIN, ACOS -> right.abs().compareTo(BigDecimal.ONE) <= 0;
            case TAN -> BigDecimalMath.cos(right, workingContext).signum() != 0;
            case COT -> BigDecimalMath.sin(right, workingContext).signum() != 0;
            case TANH -> BigDecimalMath.cosh(right, workingContext).signum() != 0;
            case COTH -> BigDecimalMath.sinh(right, workingContext).signum() != 0;
            case FACTORIAL -> isWhole(right)
                              && right.signum() >= 0
                              && right.compareTo(BigDecimal.valueOf(factorialLimit)) <= 0;
        };
    }

    private BigDecimal compute(OperatorKind kind, BigDecimal left, BigDecimal right) {
        return switch (kind) {
            case ADDITION -> left.add(right);
            case SUBTRACTION -> left.subtract(right);
            case PRODUCT -> left.multiply(right);
            case DIVISION -> left.divide(right, mathContext);
            case POWER -> round(BigDecimalMath.pow(left, right, workingContext));
            case FACTORIAL -> new BigDecimal(Factorials.sequential(right.longValueExact()));
            case LOGARITHM -> round(BigDecimalMath.log(right, workingContext)
                                                  .divide(BigDecimalMath.log(left, workingContext), workingContext));
            case SIN -> round(BigDecimalMath.sin(right, workingContext));
            case COS -> round(BigDecimalMath.cos(right, workingContext));
            case TAN -> round(BigDecimalMath.tan(right, workingContext));
            case COT -> round(BigDecimalMath.cot(right, workingContext));
            case ASIN -> round(BigDecimalMath.asin(right, workingContext));
            case ACOS -> round(BigDecimalMath.acos(right, workingContext));
            case ATAN -> round(BigDecimalMath.atan(right, workingContext));
            case ACOT -> round(BigDecimalMath.acot(right, workingContext));
            case SINH -> round(BigDecimalMath.sinh(right, workingContext));
            case COSH -> round(BigDecimalMath.cosh(right, workingContext));
            case TANH -> round(BigDecimalMath.tanh(right, workingContext));
            case COTH -> round(BigDecimalMath.coth(right, workingContext));
        };
    }

    private BigDecimal round(BigDecimal value) {
        return value.round(mathContext);
    }

    private static boolean isWhole(BigDecimal value) {
        return value.signum() == 0 || value.stripTrailingZeros().scale() <= 0;
    }

    /**
     * Combine two operand evaluations, preferring the left error over the right one.
     */
    private static CompletableFuture<CalculationResult<Operands>> both(CompletableFuture<CalculationResult<BigDecimal>> left,
                                                                       CompletableFuture<CalculationResult<BigDecimal>> right) {
        var combined = new CompletableFuture<CalculationResult<Operands>>();

        left.whenComplete((value, failure) -> {
            if (failure != null) {
                combined.completeExceptionally(failure);
            } else if (value.isFailure()) {
                combined.complete(value.error().result());
            }
        });
        left.thenCombine(right, Evaluator::pair)
            .whenComplete((value, failure) -> {
                if (failure != null) {
                    combined.completeExceptionally(failure);
                } else {
                    combined.complete(value);
                }
            });
        return combined;
    }

    private static CalculationResult<Operands> pair(CalculationResult<BigDecimal> left, CalculationResult<BigDecimal> right) {
        return left.flatMap(leftValue -> right.map(rightValue -> new Operands(leftValue, rightValue)));
    }

    private static CompletableFuture<CalculationResult<BigDecimal>> completed(CalculationResult<BigDecimal> result) {
        return CompletableFuture.completedFuture(result);
    }
}
