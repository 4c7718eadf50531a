/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.nonlinear;

/**
 * A constraint function c, read as c(x) &lt;= 0 for inequalities and c(x) = 0 for equalities.
 */
@FunctionalInterface
interface ConstraintFunction {

    /**
     * Evaluates the constraint function and, when gradient is not null, stores its partial derivatives there.
     *
     * @param x the current point (read-only)
     * @param gradient output array for the gradient (may be null)
     * @return the constraint value at x
     */
    double evaluate(double[] x, double[] gradient);
}
