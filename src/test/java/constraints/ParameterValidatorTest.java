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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import dashboard.Diagnostic;
import dashboard.DiagnosticKind;
import dashboard.Diagnostics;

public class ParameterValidatorTest {

    private static final List<String> ELEMENTS = List.of("Desk", "Table");

    private static Map<String, Double> values(Object... pairs) {
        Map<String, Double> m = new HashMap<>();
        for (int i = 0; i < pairs.length; i += 2)
            m.put((String) pairs[i], (Double) pairs[i + 1]);
        return m;
    }

    @Test
    void acceptsExactCoverage() {
        Diagnostics diagnostics = new Diagnostics();
        Map<String, Map<String, Double>> table = new LinkedHashMap<>();
        table.put("P", values("Desk", 60.0, "Table", 30.0));
        assertThat(ParameterValidator.validate(List.of("P"), table, ELEMENTS, diagnostics)).isTrue();
        assertThat(diagnostics.isEmpty()).isTrue();
    }

    @Test
    void reportsEveryFailingParameter() {
        Diagnostics diagnostics = new Diagnostics();
        Map<String, Map<String, Double>> table = new LinkedHashMap<>();
        table.put("P", values("Desk", 60.0, "Table", 30.0));
        table.put("L", values("Desk", 8.0));
        table.put("F", values("Desk", 4.0, "Table", 2.0, "Sofa", 1.0));
        table.put("C", values("Desk", 2.0, "Table", null));
        boolean valid = ParameterValidator.validate(List.of("P", "L", "F", "C", "W"), table, ELEMENTS, diagnostics);

        assertThat(valid).isFalse();
        assertThat(diagnostics.toList()).extracting(Diagnostic::getSubject).containsExactly("L", "F", "C", "W");
        assertThat(diagnostics.toList()).allSatisfy(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.PARAMETER_COVERAGE);
            assertThat(d.isFatal()).isTrue();
        });
        assertThat(diagnostics.toList().get(0).getMessage()).contains("missing [Table]");
        assertThat(diagnostics.toList().get(1).getMessage()).contains("unknown [Sofa]");
    }

    @Test
    void rejectsValuesThatAreNotFinite() {
        Diagnostics diagnostics = new Diagnostics();
        Map<String, Map<String, Double>> table = new LinkedHashMap<>();
        table.put("P", values("Desk", Double.NaN, "Table", 30.0));
        table.put("L", values("Desk", 8.0, "Table", Double.POSITIVE_INFINITY));
        boolean valid = ParameterValidator.validate(List.of("P", "L"), table, ELEMENTS, diagnostics);

        assertThat(valid).isFalse();
        assertThat(diagnostics.toList()).extracting(Diagnostic::getSubject).containsExactly("P", "L");
        assertThat(diagnostics.toList().get(0).getMessage()).contains("not finite").contains("[Desk]");
        assertThat(diagnostics.toList().get(1).getMessage()).contains("[Table]");
    }
}
