/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

/**
 * Why a backend stopped.
 */
public enum TerminationCondition {

    OPTIMAL,

    /** a feasible point was found but optimality is not proven */
    FEASIBLE,

    INFEASIBLE,

    UNBOUNDED,

    MAX_ITERATIONS,

    MAX_TIME,

    NUMERICAL_ERROR,

    ERROR;
}
