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
 * Whether a backend ran to a normal end, as reported alongside a {@link TerminationCondition}.
 */
public enum SolverStatus {

    /** the backend ran normally */
    OK,

    /** the backend ran but could not certify a solution */
    WARNING,

    /** the backend was stopped by a limit */
    ABORTED,

    /** the backend failed */
    ERROR;
}
