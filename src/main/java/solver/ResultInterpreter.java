/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import java.util.LinkedHashMap;
import java.util.Map;

import problem.ModelVariable;
import problem.Program;
import utility.Kit;

/**
 * Turns the raw outcome of a backend into a solve result. The same check applies to every class: the outcome is
 * optimal only if the backend ended normally at a proven optimum.
 */
public final class ResultInterpreter {

    private ResultInterpreter() {
    }

    public static SolveResult interpret(Program program, RawOutcome raw) {
        int decimals = program.getProblemClass().displayDecimals;
        if (!raw.isOptimal())
            return SolveResult.notOptimal(raw.getStatus(), raw.getTermination(), raw.getMessage(), decimals);
        double[] x = raw.getValues();
        Kit.control(x.length == program.nVariables(), () -> "Expected " + program.nVariables() + " values, got " + x.length);
        Map<String, Double> values = new LinkedHashMap<>();
        for (ModelVariable v : program.getVariables())
            values.put(v.getName(), x[v.getPosition()]);
        double objective = raw.getObjectiveValue();
        if (Double.isNaN(objective))
            objective = program.getObjective().getTerm().value(x);
        return SolveResult.optimal(objective, values, decimals);
    }
}
