/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import dashboard.DiagnosticKind;
import problem.ModelingException;

/**
 * Raised when no usable backend exists for the class of a program.
 */
public class SolverUnavailableException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public SolverUnavailableException(String backend, String message) {
        super(DiagnosticKind.SOLVER_UNAVAILABLE, backend, message);
    }
}
