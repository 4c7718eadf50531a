/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import dashboard.Control;
import problem.ProblemClass;
import problem.Program;
import solver.linear.OjAlgoBackend;
import solver.nonlinear.AugmentedLagrangianBackend;
import utility.Kit;

/**
 * Routes a program to the backend configured for its class, after expanding strict and != relations. When the
 * expansion gives several programs, each is solved and the best optimal outcome is kept.
 */
public final class SolverDispatcher {

    private final Control control;

    private final Map<String, SolverBackend> backends = new LinkedHashMap<>();

    public SolverDispatcher(Control control, List<SolverBackend> backends) {
        this.control = control;
        for (SolverBackend backend : backends)
            this.backends.put(backend.getName(), backend);
    }

    /**
     * Returns a dispatcher knowing the built-in backends.
     */
    public static SolverDispatcher withDefaultBackends(Control control) {
        return new SolverDispatcher(control, List.of(new OjAlgoBackend(), new AugmentedLagrangianBackend()));
    }

    /**
     * Returns the backend configured for the given class.
     *
     * @throws SolverUnavailableException if that backend is unknown, cannot handle the class, or is not available
     */
    public SolverBackend select(ProblemClass problemClass) {
        String name = problemClass.backend == BackendKind.LINEAR ? control.solver.linear : control.solver.nonlinear;
        SolverBackend backend = backends.get(name);
        if (backend == null)
            throw new SolverUnavailableException(name, "No solver named '" + name + "' is installed for " + problemClass);
        if (backend.getKind() != problemClass.backend)
            throw new SolverUnavailableException(name, "The solver '" + name + "' cannot solve " + problemClass + " programs");
        if (!backend.isAvailable())
            throw new SolverUnavailableException(name, "The solver '" + name + "' is not available");
        return backend;
    }

    /**
     * Solves the program with the backend of its class.
     *
     * @param program the program
     * @return the raw outcome of the backend
     * @throws SolverUnavailableException if no usable backend exists for the class of the program
     */
    public RawOutcome dispatch(Program program) {
        SolverBackend backend = select(program.getProblemClass());
        int nBranches = RelationExpansion.countBranches(program);
        if (nBranches > control.relations.maxDisjunctionBranches)
            return RawOutcome.error("The != relations give " + nBranches + " alternatives, more than the " + control.relations.maxDisjunctionBranches
                    + " allowed");
        List<Program> alternatives = RelationExpansion.expand(program, control.relations);
        Kit.log.config("Solving with " + backend.getName() + (alternatives.size() > 1 ? " over " + alternatives.size() + " alternatives" : ""));
        if (alternatives.size() == 1)
            return backend.solve(alternatives.get(0), control);
        RawOutcome best = null, firstError = null, firstOther = null;
        for (Program alternative : alternatives) {
            RawOutcome outcome = backend.solve(alternative, control);
            Kit.log.fine(() -> "Alternative: " + outcome);
            if (outcome.isOptimal()) {
                if (best == null || program.getObjective().getSense().isBetter(outcome.getObjectiveValue(), best.getObjectiveValue()))
                    best = outcome;
            } else if (outcome.getStatus() == SolverStatus.ERROR) {
                if (firstError == null)
                    firstError = outcome;
            } else if (firstOther == null)
                firstOther = outcome;
        }
        return best != null ? best : firstError != null ? firstError : firstOther;
    }
}
