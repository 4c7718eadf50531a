/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.nonlinear;

import solver.TerminationCondition;

/**
 * The outcome of one continuous solve: why it stopped, the last point, its objective (in minimization form) and its
 * largest constraint violation.
 */
final class Relaxation {

    final TerminationCondition termination;

    final double[] point;

    final double objective;

    final double violation;

    Relaxation(TerminationCondition termination, double[] point, double objective, double violation) {
        this.termination = termination;
        this.point = point;
        this.objective = objective;
        this.violation = violation;
    }

    @Override
    public String toString() {
        return termination + " objective=" + objective + " violation=" + violation;
    }
}
