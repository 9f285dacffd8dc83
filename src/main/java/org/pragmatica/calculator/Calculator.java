package org.pragmatica.calculator;

import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.error.CalculationResult;
import org.pragmatica.calculator.eval.Evaluator;
import org.pragmatica.calculator.parser.Normalizer;
import org.pragmatica.calculator.parser.TreeBuilder;
import org.pragmatica.calculator.tree.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for evaluating arithmetic expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * try (var calculator = Calculator.create()) {
 *     var result = calculator.calculate("2^3^2 + sin(pi/2)");
 *     // Success[value=513]
 * }
 * }</pre>
 *
 * <p>Input is normalized, built into an expression tree and evaluated on a fixed pool of
 * worker threads owned by the calculator. Errors are returned as data; no exception
 * escapes the public methods.
 */
public final class Calculator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Calculator.class);
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

    private final CalculatorConfig config;
    private final ExecutorService executor;
    private final Evaluator evaluator;

    private Calculator(CalculatorConfig config) {
        this.config = config;
        this.executor = Executors.newFixedThreadPool(config.parallelism(), workerFactory());
        this.evaluator = Evaluator.create(executor, config.parallelism(), config.factorialLimit(), config.mathContext());
        log.debug("Calculator started with {}", config);
    }

    /**
     * Create a calculator with default configuration.
     */
    public static Calculator create() {
        return create(CalculatorConfig.DEFAULT);
    }

    /**
     * Create a calculator with custom configuration.
     */
    public static Calculator create(CalculatorConfig config) {
        return new Calculator(config);
    }

    /**
     * Create a builder for more complex calculator configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public CalculatorConfig config() {
        return config;
    }

    /**
     * Normalize input and build its expression tree without evaluating it.
     * Input longer than {@link CalculatorConfig#maxInputLength()} after normalization is
     * rejected with {@link CalculationError#FAILED_TO_PROCESS}.
     */
    public CalculationResult<Node> parse(String input) {
        var normalized = Normalizer.normalize(input);
        log.debug("Normalized '{}' to '{}'", input, normalized);

        if (normalized.length() > config.maxInputLength()) {
            log.warn("Input of {} characters exceeds the limit of {}", normalized.length(), config.maxInputLength());
            return CalculationError.FAILED_TO_PROCESS.result();
        }
        try {
            return TreeBuilder.build(normalized);
        } catch (StackOverflowError e) {
            log.error("Input of {} characters is nested too deeply", normalized.length());
            return CalculationError.FAILED_TO_PROCESS.result();
        }
    }

    /**
     * Evaluate input to a decimal. Blocks until the result is known.
     */
    public CalculationResult<BigDecimal> evaluate(String input) {
        return parse(input).flatMap(tree -> await(input, tree));
    }

    /**
     * Evaluate input and render the result in plain notation without trailing zeros.
     */
    public CalculationResult<String> calculate(String input) {
        return evaluate(input).map(Calculator::render);
    }

    public static String render(BigDecimal value) {
        return value.stripTrailingZeros()
                    .toPlainString();
    }

    private CalculationResult<BigDecimal> await(String input, Node tree) {
        if (log.isDebugEnabled()) {
            log.debug("Evaluating {}", tree.display());
        }
        try {
            var future = evaluator.evaluate(tree);
            if (config.timeout().isPresent()) {
                return future.get(config.timeout().get().toNanos(), TimeUnit.NANOSECONDS);
            }
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while evaluating '{}'", input);
            return CalculationError.FAILED_TO_PROCESS.result();
        } catch (ExecutionException e) {
            log.error("Evaluation of '{}' failed", input, e.getCause());
            return CalculationError.FAILED_TO_PROCESS.result();
        } catch (TimeoutException e) {
            log.warn("Evaluation of '{}' did not finish within {}", input, config.timeout().get());
            return CalculationError.FAILED_TO_PROCESS.result();
        } catch (StackOverflowError e) {
            log.error("Expression '{}' is nested too deeply to evaluate", input);
            return CalculationError.FAILED_TO_PROCESS.result();
        }
    }

    /**
     * Stop the worker pool. Evaluations still running are allowed to finish.
     */
    @Override
    public void close() {
        executor.shutdown();
        log.debug("Calculator stopped");
    }

    private static ThreadFactory workerFactory() {
        var pool = POOL_COUNTER.incrementAndGet();
        var worker = new AtomicInteger();
        return task -> {
            var thread = new Thread(task, "calculator-" + pool + "-worker-" + worker.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Builder {
        private int parallelism = CalculatorConfig.DEFAULT.parallelism();
        private long factorialLimit = CalculatorConfig.DEFAULT_FACTORIAL_LIMIT;
        private int maxInputLength = CalculatorConfig.DEFAULT_MAX_INPUT_LENGTH;
        private MathContext mathContext = CalculatorConfig.DEFAULT_MATH_CONTEXT;
        private Optional<Duration> timeout = Optional.empty();

        private Builder() {}

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder factorialLimit(long limit) {
            this.factorialLimit = limit;
            return this;
        }

        public Builder maxInputLength(int length) {
            this.maxInputLength = length;
            return this;
        }

        public Builder precision(int digits) {
            this.mathContext = new MathContext(digits, mathContext.getRoundingMode());
            return this;
        }

        public Builder mathContext(MathContext mathContext) {
            this.mathContext = mathContext;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Optional.of(timeout);
            return this;
        }

        public CalculatorConfig config() {
            return new CalculatorConfig(parallelism, factorialLimit, maxInputLength, mathContext, timeout);
        }

        public Calculator build() {
            return create(config());
        }
    }
}
