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
 * Raised when a constraint or the objective refers to a parameter that was not declared.
 */
public class UnknownParameterException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public UnknownParameterException(String subject, String message) {
        super(DiagnosticKind.UNKNOWN_PARAMETER, subject, message);
    }
}
