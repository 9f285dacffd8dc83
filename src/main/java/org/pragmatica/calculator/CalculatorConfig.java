package org.pragmatica.calculator;

import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * Calculator configuration options.
 *
 * @param parallelism    fixed number of worker threads
 * @param factorialLimit largest accepted factorial argument
 * @param maxInputLength longest accepted normalized input; bounds the depth of the tree
 * @param mathContext    precision and rounding of inexact results
 * @param timeout        upper bound for waiting on one evaluation, unbounded if empty
 */
public record CalculatorConfig(
    int parallelism,
    long factorialLimit,
    int maxInputLength,
    MathContext mathContext,
    Optional<Duration> timeout
) {
    public static final long DEFAULT_FACTORIAL_LIMIT = 268_500_000L;
    public static final int DEFAULT_MAX_INPUT_LENGTH = 2000;
    public static final MathContext DEFAULT_MATH_CONTEXT = new MathContext(100, RoundingMode.HALF_UP);

    public static final CalculatorConfig DEFAULT = new CalculatorConfig(
        Runtime.getRuntime().availableProcessors(),
        DEFAULT_FACTORIAL_LIMIT,
        DEFAULT_MAX_INPUT_LENGTH,
        DEFAULT_MATH_CONTEXT,
        Optional.empty()
    );

    public CalculatorConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
        }
        if (factorialLimit < 0) {
            throw new IllegalArgumentException("Factorial limit must not be negative, got " + factorialLimit);
        }
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("Maximum input length must be positive, got " + maxInputLength);
        }
        if (mathContext.getPrecision() < 1) {
            throw new IllegalArgumentException("Precision must be positive, got " + mathContext.getPrecision());
        }
        if (timeout.isPresent() && (timeout.get().isNegative() || timeout.get().isZero())) {
            throw new IllegalArgumentException("Timeout must be positive, got " + timeout.get());
        }
    }
}
