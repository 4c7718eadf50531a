/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import dashboard.Control;
import problem.Program;

/**
 * A numerical solver able to optimize an assembled program. A backend receives programs whose constraints only use
 * the relations &lt;=, &gt;= and ==; strict and != relations are expanded beforehand by the dispatcher.
 */
public interface SolverBackend {

    /**
     * Returns the name under which the backend is selected in the options.
     */
    String getName();

    /**
     * Returns the family of programs the backend handles.
     */
    BackendKind getKind();

    /**
     * Returns false if the backend cannot be used in the current environment.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Optimizes the program. This is a single blocking call.
     *
     * @param program the program, with non-strict relations only
     * @param control the options
     * @return the raw outcome; never null
     */
    RawOutcome solve(Program program, Control control);
}
