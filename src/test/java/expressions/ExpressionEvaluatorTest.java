/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import dashboard.DiagnosticKind;

public class ExpressionEvaluatorTest {

    private static final VariableBinding XY = VariableBinding.of(List.of("x", "y"));

    @Test
    void evaluatesWithNamedValues() {
        assertThat(ExpressionEvaluator.evaluate("x + 2*y", Map.of("x", 1.0, "y", 3.0))).isEqualTo(7.0);
    }

    @ParameterizedTest
    @CsvSource({ "'-x**2', -9", "'2**-1', 0.5", "'2**3**2', 512", "'(1 + x)*y', 16", "'x/y - .5', 0.25", "'5. + 1e-3', 5.001",
            "'+x - -y', 7", "'x*y/2', 6" })
    @DisplayName("operator precedence and associativity")
    void precedence(String text, double expected) {
        Term t = ExpressionEvaluator.evaluate(text, XY);
        assertThat(t.value(new double[] { 3, 4 })).isCloseTo(expected, within(1e-12));
    }

    @Test
    void rejectsUnboundNames() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("x + z", XY)).isInstanceOf(ExpressionException.class)
                .hasMessageContaining("'z'").hasMessageContaining("x + z")
                .satisfies(e -> assertThat(((ExpressionException) e).getKind()).isEqualTo(DiagnosticKind.EXPRESSION));
    }

    @ParameterizedTest
    @ValueSource(strings = { "abs(x)", "x < y", "x = 1", "x[0]", "x.real", "__import__", "x +", "(x", "2x", "x ^ 2", "", "   " })
    void rejectsUnsupportedConstructs(String text) {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate(text, XY)).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsMissingText() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate(null, XY)).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsConstantDivisionByZero() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("x / (2 - 2)", XY)).isInstanceOf(ExpressionException.class)
                .hasMessageContaining("division by zero");
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("0 ** -1 + x", XY)).isInstanceOf(ExpressionException.class);
    }

    @Test
    void rejectsNumbersThatAreNotFinite() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1e400*x", XY)).isInstanceOf(ExpressionException.class)
                .hasMessageContaining("1e400");
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("x + 1e308*10", XY)).isInstanceOf(ExpressionException.class)
                .hasMessageContaining("not a finite number");
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1e308 + 1e308 - x", XY)).isInstanceOf(ExpressionException.class);
        Term overflowing = ExpressionEvaluator.evaluate("1e300*x*1e300", XY);
        assertThatThrownBy(overflowing::linearForm).isInstanceOf(ExpressionException.class).hasMessageContaining("not a finite number");
    }

    @Test
    void foldsConstants() {
        Term t = ExpressionEvaluator.evaluate("2 * 3 + 4", XY);
        assertThat(t.isConstant()).isTrue();
        assertThat(t.value(new double[2])).isEqualTo(10.0);
    }

    @Test
    void computesGradients() {
        Term t = ExpressionEvaluator.evaluate("x**2*y + 3*y - x/y", XY);
        double[] g = t.gradient(new double[] { 2, 4 });
        // d/dx = 2xy - 1/y, d/dy = x^2 + 3 + x/y^2
        assertThat(g[0]).isCloseTo(16 - 0.25, within(1e-12));
        assertThat(g[1]).isCloseTo(4 + 3 + 2.0 / 16, within(1e-12));
    }

    @Test
    void extractsLinearForms() {
        Term t = ExpressionEvaluator.evaluate("3*(x - 2*y) / 2 + 4 - y", XY);
        assertThat(t.isLinear()).isTrue();
        LinearForm f = t.linearForm();
        assertThat(f.coefficient(0)).isCloseTo(1.5, within(1e-12));
        assertThat(f.coefficient(1)).isCloseTo(-4, within(1e-12));
        assertThat(f.getConstant()).isCloseTo(4, within(1e-12));
        assertThat(f.valueAt(new double[] { 2, 1 })).isCloseTo(t.value(new double[] { 2, 1 }), within(1e-12));
    }

    @ParameterizedTest
    @ValueSource(strings = { "x*y", "x**2", "1/x", "2**x" })
    void refusesLinearFormsOfNonLinearTerms(String text) {
        Term t = ExpressionEvaluator.evaluate(text, XY);
        assertThat(t.isLinear()).isFalse();
        assertThatThrownBy(t::linearForm).isInstanceOf(ExpressionException.class).hasMessageContaining("not linear");
    }

    @Test
    void bindingKeepsDeclarationOrder() {
        VariableBinding binding = VariableBinding.of(List.of("y", "x"));
        assertThat(binding.names()).containsExactly("y", "x");
        assertThat(binding.positionOf("x")).isEqualTo(1);
        assertThat(binding.isBound("z")).isFalse();
        assertThat(binding.positionOf("z")).isEqualTo(-1);
    }

    @Test
    void bindingRejectsDuplicateNames() {
        assertThatThrownBy(() -> VariableBinding.of(List.of("x", "x"))).isInstanceOf(IllegalArgumentException.class);
    }
}
