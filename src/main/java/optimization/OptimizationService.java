/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import dashboard.Control;
import dashboard.Diagnostics;
import problem.Program;
import problem.SolveRequest;
import solver.RawOutcome;
import solver.ResultInterpreter;
import solver.SolveResult;
import solver.SolverDispatcher;
import solver.SolverUnavailableException;
import utility.Kit;

/**
 * Entry point: builds the program of a request, sends it to the backend of its class, and interprets the outcome. A
 * request that cannot be modeled never reaches a backend.
 */
public final class OptimizationService {

    private final SolverDispatcher dispatcher;

    /**
     * Builds a service with the options of the default resource and the built-in backends.
     */
    public OptimizationService() {
        this(Control.load());
    }

    public OptimizationService(Control control) {
        this(control, SolverDispatcher.withDefaultBackends(control));
    }

    public OptimizationService(Control control, SolverDispatcher dispatcher) {
        this.dispatcher = dispatcher;
        Kit.setVerbosity(control.general.verbose);
    }

    /**
     * Solves the request. Identical requests give equal outcomes.
     *
     * @param request the user input
     * @return the result, if the model could be built and a backend was found, with every diagnostic raised
     */
    public SolveOutcome solve(SolveRequest request) {
        Diagnostics diagnostics = new Diagnostics();
        Program program = ModelBuilder.build(request, diagnostics);
        if (program == null)
            return SolveOutcome.failed(diagnostics.toList());
        Kit.log.fine(() -> program.toString());
        try {
            RawOutcome raw = dispatcher.dispatch(program);
            Kit.log.config("Raw outcome: " + raw);
            SolveResult result = ResultInterpreter.interpret(program, raw);
            return SolveOutcome.solved(result, diagnostics.toList());
        } catch (SolverUnavailableException e) {
            diagnostics.report(e, 0);
            return SolveOutcome.failed(diagnostics.toList());
        }
    }
}
