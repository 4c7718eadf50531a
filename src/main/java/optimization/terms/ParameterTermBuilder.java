/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.terms;

import expressions.Term;
import problem.ModelVariable;
import problem.Parameter;
import problem.ProblemClass;

/**
 * Builder for terms given by a parameter name: the weighted sum of the element variables, each weighted by the value
 * of the parameter for its element.
 */
public class ParameterTermBuilder implements TermBuilder {

    @Override
    public boolean canBuild(ProblemClass.TermSource source) {
        return source == ProblemClass.TermSource.PARAMETERS;
    }

    @Override
    public Term build(String reference, BuildContext ctx) {
        Parameter parameter = ctx.getParameter(reference);
        int n = ctx.nVariables();
        double[] coeffs = new double[n];
        String[] names = new String[n];
        for (int i = 0; i < n; i++) {
            ModelVariable x = ctx.getVariable(i);
            names[i] = x.getName();
            coeffs[i] = parameter.valueOf(x.getName());
        }
        return Term.weightedSum(parameter.getName(), coeffs, names, 0);
    }
}
