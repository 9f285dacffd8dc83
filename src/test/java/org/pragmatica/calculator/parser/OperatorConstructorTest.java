package org.pragmatica.calculator.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.calculator.error.CalculationError;
import org.pragmatica.calculator.tree.Node;
import org.pragmatica.calculator.tree.OperatorKind;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorConstructorTest {

    @Test
    void starts_onlyOnFunctionInitials() {
        assertThat(OperatorConstructor.starts('s')).isTrue();
        assertThat(OperatorConstructor.starts('a')).isTrue();
        assertThat(OperatorConstructor.starts('h')).isFalse();
        assertThat(OperatorConstructor.starts('l')).isFalse();
    }

    @Test
    void accepts_sharedPrefixes() {
        var c = OperatorConstructor.start(Node.EMPTY, 'c');

        assertThat(c.accepts('t')).isTrue();
        assertThat(c.accepts('h')).isTrue();
        assertThat(c.extend('t').accepts('h')).isTrue();
        assertThat(c.extend('t').extend('h').accepts('h')).isFalse();
        assertThat(OperatorConstructor.start(Node.EMPTY, 'a').extend('c').accepts('h')).isFalse();
    }

    @Test
    void resolve_completeName_appendsFunction() {
        var tree = OperatorConstructor.start(Node.EMPTY, 'a')
                                      .extend('s')
                                      .resolve()
                                      .unwrap();

        assertThat(tree).isEqualTo(Node.Operator.function(OperatorKind.ASIN));
    }

    @Test
    void resolve_afterValue_multiplies() {
        var two = Node.Number.constant("2");
        var tree = OperatorConstructor.start(two, 's')
                                      .resolve()
                                      .unwrap();

        assertThat(tree).isEqualTo(new Node.Operator(OperatorKind.PRODUCT, two, Node.Operator.function(OperatorKind.SIN)));
    }

    @Test
    void resolve_incompleteName_fails() {
        var result = OperatorConstructor.start(Node.EMPTY, 'a').resolve();

        assertThat(result.error()).isEqualTo(CalculationError.INCORRECT_METHOD_SEQUENCE);
    }
}
