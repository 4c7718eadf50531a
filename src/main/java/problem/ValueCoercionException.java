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
 * Raised when a right-hand side cannot be read as a finite number.
 */
public class ValueCoercionException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public ValueCoercionException(String subject, String message) {
        super(DiagnosticKind.VALUE_COERCION, subject, message);
    }

    public ValueCoercionException(String subject, String message, Throwable cause) {
        super(DiagnosticKind.VALUE_COERCION, subject, message, cause);
    }
}
