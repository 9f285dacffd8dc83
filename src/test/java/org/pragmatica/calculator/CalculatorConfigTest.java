package org.pragmatica.calculator;

import org.junit.jupiter.api.Test;

import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalculatorConfigTest {

    @Test
    void defaults() {
        var config = CalculatorConfig.DEFAULT;

        assertThat(config.parallelism()).isEqualTo(Runtime.getRuntime().availableProcessors());
        assertThat(config.factorialLimit()).isEqualTo(268_500_000L);
        assertThat(config.maxInputLength()).isEqualTo(2000);
        assertThat(config.mathContext()).isEqualTo(new MathContext(100, RoundingMode.HALF_UP));
        assertThat(config.timeout()).isEmpty();
    }

    @Test
    void builder_collectsOptions() {
        var config = Calculator.builder()
                               .parallelism(3)
                               .factorialLimit(1000)
                               .maxInputLength(50)
                               .precision(20)
                               .timeout(Duration.ofSeconds(5))
                               .config();

        assertThat(config.parallelism()).isEqualTo(3);
        assertThat(config.factorialLimit()).isEqualTo(1000);
        assertThat(config.maxInputLength()).isEqualTo(50);
        assertThat(config.mathContext()).isEqualTo(new MathContext(20, RoundingMode.HALF_UP));
        assertThat(config.timeout()).contains(Duration.ofSeconds(5));
    }

    @Test
    void invalidValues_areRejected() {
        var context = CalculatorConfig.DEFAULT_MATH_CONTEXT;

        assertThatThrownBy(() -> new CalculatorConfig(0, 10, 100, context, Optional.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CalculatorConfig(1, -1, 100, context, Optional.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CalculatorConfig(1, 10, 100, MathContext.UNLIMITED, Optional.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CalculatorConfig(1, 10, 0, context, Optional.empty()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Calculator.builder().timeout(Duration.ZERO).config())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
