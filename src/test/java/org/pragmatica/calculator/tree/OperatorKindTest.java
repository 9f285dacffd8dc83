package org.pragmatica.calculator.tree;

import org.junit.jupiter.api.Test;
import org.pragmatica.calculator.error.CalculationError;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorKindTest {

    @Test
    void multiplicative_fallsIntoAdditive() {
        assertThat(OperatorKind.PRODUCT.fallsInto(OperatorKind.ADDITION)).isTrue();
        assertThat(OperatorKind.DIVISION.fallsInto(OperatorKind.SUBTRACTION)).isTrue();
        assertThat(OperatorKind.ADDITION.fallsInto(OperatorKind.PRODUCT)).isFalse();
    }

    @Test
    void sameRank_isLeftAssociative() {
        assertThat(OperatorKind.SUBTRACTION.fallsInto(OperatorKind.SUBTRACTION)).isFalse();
        assertThat(OperatorKind.DIVISION.fallsInto(OperatorKind.PRODUCT)).isFalse();
    }

    @Test
    void power_isRightAssociative() {
        assertThat(OperatorKind.POWER.fallsInto(OperatorKind.POWER)).isTrue();
    }

    @Test
    void power_fallsIntoFunction_productDoesNot() {
        assertThat(OperatorKind.POWER.fallsInto(OperatorKind.SIN)).isTrue();
        assertThat(OperatorKind.PRODUCT.fallsInto(OperatorKind.SIN)).isFalse();
        assertThat(OperatorKind.FACTORIAL.fallsInto(OperatorKind.POWER)).isTrue();
        assertThat(OperatorKind.FACTORIAL.fallsInto(OperatorKind.FACTORIAL)).isFalse();
    }

    @Test
    void symbol_resolvesOperatorCharacters() {
        assertThat(OperatorKind.symbol('^')).contains(OperatorKind.POWER);
        assertThat(OperatorKind.symbol('!')).contains(OperatorKind.FACTORIAL);
        assertThat(OperatorKind.symbol('%')).isEmpty();
    }

    @Test
    void function_resolvesOnlyFunctionCodes() {
        assertThat(OperatorKind.function("cth")).contains(OperatorKind.COTH);
        assertThat(OperatorKind.function("act")).contains(OperatorKind.ACOT);
        assertThat(OperatorKind.function("ach")).isEmpty();
        assertThat(OperatorKind.function("l")).isEmpty();
    }

    @Test
    void unrestrictedKinds_carryUnknownError() {
        assertThat(OperatorKind.ADDITION.error()).isEqualTo(CalculationError.UNKNOWN_ERROR);
        assertThat(OperatorKind.DIVISION.error()).isEqualTo(CalculationError.DIVISION_BY_ZERO);
        assertThat(OperatorKind.TANH.error()).isEqualTo(CalculationError.ILLEGAL_TANGENT);
        assertThat(OperatorKind.COTH.error()).isEqualTo(CalculationError.ILLEGAL_COTANGENT);
    }
}
