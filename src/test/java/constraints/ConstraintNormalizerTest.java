/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import dashboard.Diagnostic;
import dashboard.DiagnosticKind;
import dashboard.Diagnostics;
import problem.ExpressionConstraintRow;
import problem.LinearConstraintRow;
import problem.ValueCoercionException;

public class ConstraintNormalizerTest {

    @Test
    void skipsMalformedLinearRowsAndKeepsTheOthers() {
        Diagnostics diagnostics = new Diagnostics();
        List<LinearConstraintRow> rows = List.of(new LinearConstraintRow("L", "≤", "48"), new LinearConstraintRow("Q", "≤", "1"),
                new LinearConstraintRow("F", "=>", "20"), new LinearConstraintRow("C", "≥", "abc"), new LinearConstraintRow("C", "≠", " 8 "));
        List<NormalizedConstraint> valid = ConstraintNormalizer.normalizeLinear(rows, List.of("L", "F", "C"), diagnostics);

        assertThat(valid).extracting(c -> c.row).containsExactly(1, 5);
        assertThat(valid.get(0).operator).isEqualTo(RelationalOperator.LE);
        assertThat(valid.get(0).rhs).isEqualTo(48.0);
        assertThat(valid.get(1).operator).isEqualTo(RelationalOperator.NE);
        assertThat(valid.get(1).rhs).isEqualTo(8.0);

        assertThat(diagnostics.toList()).extracting(Diagnostic::getRow, Diagnostic::getKind).containsExactly(
                tuple(2, DiagnosticKind.UNKNOWN_PARAMETER), tuple(3, DiagnosticKind.OPERATOR),
                tuple(4, DiagnosticKind.VALUE_COERCION));
        assertThat(diagnostics.hasFatal()).isFalse();
    }

    @Test
    void skipsNonFiniteExpressionValues() {
        Diagnostics diagnostics = new Diagnostics();
        List<ExpressionConstraintRow> rows = List.of(new ExpressionConstraintRow("x + y", "≤", 10), new ExpressionConstraintRow("x", "≥", Double.NaN),
                new ExpressionConstraintRow("y", "?", 1), new ExpressionConstraintRow("x*y", "<", Double.POSITIVE_INFINITY));
        List<NormalizedConstraint> valid = ConstraintNormalizer.normalizeExpressions(rows, diagnostics);

        assertThat(valid).singleElement().satisfies(c -> {
            assertThat(c.row).isEqualTo(1);
            assertThat(c.source).isEqualTo("x + y");
        });
        assertThat(diagnostics.toList()).extracting(Diagnostic::getRow).containsExactly(2, 3, 4);
    }

    @ParameterizedTest
    @CsvSource({ "'48', 48", "' 1.5 ', 1.5", "'.5', 0.5", "'5.', 5", "'-2e3', -2000", "'+1E-2', 0.01" })
    void coercesDecimalText(String text, double expected) {
        assertThat(ConstraintNormalizer.coerce(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = { "abc", "", "1,5", "inf", "-Infinity", "nan", "0x10", "1e999", "1 2" })
    void rejectsOtherText(String text) {
        assertThatThrownBy(() -> ConstraintNormalizer.coerce(text)).isInstanceOf(ValueCoercionException.class);
    }
}
