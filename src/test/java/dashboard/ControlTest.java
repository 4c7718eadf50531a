/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Properties;

import org.junit.jupiter.api.Test;

public class ControlTest {

    private static Properties properties(String... pairs) {
        Properties p = new Properties();
        for (int i = 0; i < pairs.length; i += 2)
            p.setProperty(pairs[i], pairs[i + 1]);
        return p;
    }

    @Test
    void builtInDefaults() {
        Control control = Control.defaults();
        assertThat(control.general.verbose).isZero();
        assertThat(control.solver.linear).isEqualTo("ojalgo");
        assertThat(control.solver.nonlinear).isEqualTo("augmented-lagrangian");
        assertThat(control.solver.timeoutMillis).isZero();
        assertThat(control.relations.strictTolerance).isEqualTo(1e-6);
        assertThat(control.relations.maxDisjunctionBranches).isEqualTo(64);
        assertThat(control.nonlinear.initialValue).isEqualTo(1.0);
    }

    @Test
    void loadsTheDefaultResource() {
        Control control = Control.load();
        assertThat(control.solver.linear).isEqualTo("ojalgo");
        assertThat(control.nonlinear.maxNodes).isEqualTo(10000);
    }

    @Test
    void explicitPropertiesOverrideDefaults() {
        Control control = Control.of(properties("solver.linear", " other ", "solver.timeoutMillis", "1500", "nonlinear.initialValue", "-2.5"));
        assertThat(control.solver.linear).isEqualTo("other");
        assertThat(control.solver.timeoutMillis).isEqualTo(1500L);
        assertThat(control.nonlinear.initialValue).isEqualTo(-2.5);
    }

    @Test
    void invalidValuesNameTheirKey() {
        assertThatThrownBy(() -> Control.of(properties("general.verbose", "loud"))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("general.verbose");
        assertThatThrownBy(() -> Control.of(properties("relations.strictTolerance", "0"))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("relations.strictTolerance");
        assertThatThrownBy(() -> Control.of(properties("solver.timeoutMillis", "-1"))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("solver.timeoutMillis");
        assertThatThrownBy(() -> Control.of(properties("nonlinear.penaltyGrowth", "1"))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonlinear.penaltyGrowth");
        assertThatThrownBy(() -> Control.of(properties("nonlinear.initialValue", "NaN"))).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nonlinear.initialValue");
    }
}
