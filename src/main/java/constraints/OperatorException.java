/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import dashboard.DiagnosticKind;
import problem.ModelingException;

/**
 * Raised when a relational operator symbol is not one of the six accepted ones.
 */
public class OperatorException extends ModelingException {

    private static final long serialVersionUID = 1L;

    public OperatorException(String symbol) {
        super(DiagnosticKind.OPERATOR, symbol, "Operator '" + symbol + "' is not valid");
    }
}
