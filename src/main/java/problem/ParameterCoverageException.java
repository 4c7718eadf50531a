/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import dashboard.DiagnosticKind;

/**
 * Raised when a parameter does not have a value for exactly every declared element.
 */
public class ParameterCoverageException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public ParameterCoverageException(String subject, String message) {
        super(DiagnosticKind.PARAMETER_COVERAGE, subject, message);
    }
}
