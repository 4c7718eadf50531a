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
 * Base class of the exceptions raised while reading, validating and building a model. Each one maps to a diagnostic
 * kind, so that callers can turn it into a report without losing what went wrong.
 */
public class ModelingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final DiagnosticKind kind;

    private final String subject;

    public ModelingException(DiagnosticKind kind, String subject, String message) {
        super(message);
        this.kind = kind;
        this.subject = subject;
    }

    public ModelingException(DiagnosticKind kind, String subject, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subject = subject;
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    /**
     * Returns the offending text, or null.
     */
    public String getSubject() {
        return subject;
    }
}
