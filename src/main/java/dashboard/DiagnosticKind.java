/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

/**
 * The kinds of problems reported while reading, validating, building and solving a model.
 */
public enum DiagnosticKind {

    /** Malformed identifier text; never fatal, the text just yields fewer identifiers */
    IDENTIFIER_PARSE_WARNING(Severity.WARNING),

    /** Unknown relational operator symbol; the row is skipped */
    OPERATOR(Severity.ROW_SKIPPED),

    /** Right-hand side that is not a finite number; the row is skipped */
    VALUE_COERCION(Severity.ROW_SKIPPED),

    /** Reference to an undeclared parameter in a constraint row; the row is skipped */
    UNKNOWN_PARAMETER(Severity.ROW_SKIPPED),

    /** Parameter without a value for exactly every element; blocks the model */
    PARAMETER_COVERAGE(Severity.FATAL),

    /** Element, parameter or variable declared twice; blocks the model */
    DUPLICATE_IDENTIFIER(Severity.FATAL),

    /** Objective or constraint whose expression cannot be turned into a term; aborts the solve */
    EXPRESSION(Severity.FATAL),

    /** No usable backend for the problem class; aborts the request */
    SOLVER_UNAVAILABLE(Severity.FATAL);

    public enum Severity {
        WARNING, ROW_SKIPPED, FATAL;
    }

    private final Severity severity;

    DiagnosticKind(Severity severity) {
        this.severity = severity;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isFatal() {
        return severity == Severity.FATAL;
    }
}
