/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import problem.ModelingException;
import utility.Kit;

/**
 * Collects the diagnostics of one solve request, in the order they are reported.
 */
public final class Diagnostics {

    private final List<Diagnostic> list = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        list.add(diagnostic);
        if (diagnostic.getKind().severity() == DiagnosticKind.Severity.WARNING)
            Kit.log.info(diagnostic.toString());
        else
            Kit.log.warning(diagnostic.toString());
    }

    public void report(DiagnosticKind kind, int row, String subject, String message) {
        report(new Diagnostic(kind, row, subject, message));
    }

    /**
     * Records the given exception, tied to the given 1-based row (0 if none).
     */
    public void report(ModelingException e, int row) {
        report(new Diagnostic(e.getKind(), row, e.getSubject(), e.getMessage()));
    }

    public boolean hasFatal() {
        return list.stream().anyMatch(Diagnostic::isFatal);
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public int size() {
        return list.size();
    }

    public List<Diagnostic> toList() {
        return Collections.unmodifiableList(new ArrayList<>(list));
    }
}
