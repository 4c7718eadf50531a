/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

import java.util.Objects;

/**
 * One reported problem. The row index is 1-based and is 0 when the problem is not tied to a constraint row.
 */
public final class Diagnostic {

    private final DiagnosticKind kind;

    private final int row;

    private final String subject;

    private final String message;

    public Diagnostic(DiagnosticKind kind, int row, String subject, String message) {
        this.kind = Objects.requireNonNull(kind);
        if (row < 0)
            throw new IllegalArgumentException("Invalid row index: " + row);
        this.row = row;
        this.subject = subject;
        this.message = Objects.requireNonNull(message);
    }

    public DiagnosticKind getKind() {
        return kind;
    }

    public int getRow() {
        return row;
    }

    public boolean hasRow() {
        return row > 0;
    }

    /**
     * Returns the offending text (symbol, value, parameter or expression), or null.
     */
    public String getSubject() {
        return subject;
    }

    public String getMessage() {
        return message;
    }

    public boolean isFatal() {
        return kind.isFatal();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Diagnostic))
            return false;
        Diagnostic other = (Diagnostic) o;
        return kind == other.kind && row == other.row && Objects.equals(subject, other.subject) && message.equals(other.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, row, subject, message);
    }

    @Override
    public String toString() {
        return (hasRow() ? "Constraint " + row + ": " : "") + message + " [" + kind + "]";
    }
}
