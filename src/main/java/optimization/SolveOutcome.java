/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import java.util.List;
import java.util.Optional;

import dashboard.Diagnostic;
import solver.SolveResult;

/**
 * What a solve gives back: the interpreted result when the model could be built and sent to a backend, and every
 * diagnostic raised on the way (skipped rows included).
 */
public final class SolveOutcome {

    private final SolveResult result;

    private final List<Diagnostic> diagnostics;

    private SolveOutcome(SolveResult result, List<Diagnostic> diagnostics) {
        this.result = result;
        this.diagnostics = List.copyOf(diagnostics);
    }

    static SolveOutcome solved(SolveResult result, List<Diagnostic> diagnostics) {
        return new SolveOutcome(result, diagnostics);
    }

    static SolveOutcome failed(List<Diagnostic> diagnostics) {
        return new SolveOutcome(null, diagnostics);
    }

    /**
     * Returns true if the model was built and a backend was run.
     */
    public boolean isSolved() {
        return result != null;
    }

    public boolean isOptimal() {
        return result != null && result.isOptimal();
    }

    public Optional<SolveResult> getResult() {
        return Optional.ofNullable(result);
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(result == null ? "Not solved" : result.toString());
        diagnostics.forEach(d -> sb.append("\n").append(d));
        return sb.toString();
    }
}
