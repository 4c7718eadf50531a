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
 * Raised when an element, parameter or variable name is declared more than once.
 */
public class DuplicateIdentifierException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public DuplicateIdentifierException(String subject, String message) {
        super(DiagnosticKind.DUPLICATE_IDENTIFIER, subject, message);
    }
}
