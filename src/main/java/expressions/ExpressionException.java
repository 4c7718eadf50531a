/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import dashboard.DiagnosticKind;
import problem.ModelingException;

/**
 * Raised when an expression cannot be turned into a term: syntax error, unsupported construct, name that is not a
 * declared variable, or constant arithmetic error. The subject is the offending expression text.
 */
public class ExpressionException extends ModelingException {

    private static final long serialVersionUID = 1L;

    private final int position;

    public ExpressionException(String text, String message) {
        this(text, -1, message);
    }

    public ExpressionException(String text, int position, String message) {
        super(DiagnosticKind.EXPRESSION, text, position < 0 ? message + " in '" + text + "'" : message + " at position " + (position + 1) + " in '" + text + "'");
        this.position = position;
    }

    /**
     * Returns the 0-based position of the error in the expression text, or -1 if unknown.
     */
    public int getPosition() {
        return position;
    }
}
