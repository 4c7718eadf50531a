/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import dashboard.Diagnostics;
import problem.ParameterCoverageException;

/**
 * Checks that every declared parameter has a finite value for exactly the declared elements, no more and no less.
 * Unlike row-level checks, a failure here blocks the construction of the whole model.
 */
public final class ParameterValidator {

    private ParameterValidator() {
    }

    /**
     * Reports the parameters whose values are not finite, or do not cover exactly the elements.
     *
     * @param parameterNames the declared parameter names
     * @param values the parameter table (parameter name to element-to-value map)
     * @param elements the declared elements
     * @param diagnostics where failures are reported
     * @return true if every parameter is fully and exactly populated with finite values
     */
    public static boolean validate(List<String> parameterNames, Map<String, Map<String, Double>> values, List<String> elements, Diagnostics diagnostics) {
        Set<String> expected = new HashSet<>(elements);
        boolean valid = true;
        for (String name : parameterNames) {
            Set<String> actual = new HashSet<>();
            Set<String> nonFinite = new TreeSet<>();
            values.getOrDefault(name, Collections.emptyMap()).forEach((element, value) -> {
                if (value == null)
                    return;
                actual.add(element);
                if (!Double.isFinite(value))
                    nonFinite.add(element);
            });
            if (!nonFinite.isEmpty()) {
                diagnostics.report(new ParameterCoverageException(name, "Parameter '" + name + "' has values that are not finite numbers for " + nonFinite), 0);
                valid = false;
            }
            if (!actual.equals(expected)) {
                Set<String> missing = new TreeSet<>(expected);
                missing.removeAll(actual);
                Set<String> extra = new TreeSet<>(actual);
                extra.removeAll(expected);
                StringBuilder sb = new StringBuilder("Parameter '" + name + "' does not have values for all elements");
                if (!missing.isEmpty())
                    sb.append("; missing ").append(missing);
                if (!extra.isEmpty())
                    sb.append("; unknown ").append(extra);
                diagnostics.report(new ParameterCoverageException(name, sb.toString()), 0);
                valid = false;
            }
        }
        return valid;
    }
}
