/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.nonlinear;

import java.util.Arrays;

import dashboard.Control;
import problem.Program;
import solver.BackendKind;
import solver.RawOutcome;
import solver.SolverBackend;
import solver.SolverStatus;
import solver.TerminationCondition;
import utility.Kit;

/**
 * Nonlinear backend for NLP and MINLP programs. Programs without integer variables are solved by the augmented
 * Lagrangian method; the others by branch and bound over it.
 */
public class AugmentedLagrangianBackend implements SolverBackend {

    public static final String NAME = "augmented-lagrangian";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.NONLINEAR;
    }

    @Override
    public RawOutcome solve(Program program, Control control) {
        NonlinearProblem problem = new NonlinearProblem(program);
        if (problem.n == 0) {
            double[] empty = new double[0];
            if (problem.violation(empty, empty, empty) > control.nonlinear.feasibilityTolerance)
                return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.INFEASIBLE, "a constraint without variables never holds");
            return RawOutcome.optimal(problem.userObjective(empty), empty);
        }
        double[] start = new double[problem.n];
        Arrays.fill(start, control.nonlinear.initialValue);
        long deadline = control.solver.timeoutMillis > 0 ? System.currentTimeMillis() + control.solver.timeoutMillis : 0;
        long startTime = System.currentTimeMillis();
        Relaxation r;
        if (problem.hasIntegerVariables()) {
            BranchAndBound bb = new BranchAndBound(problem, control.nonlinear);
            r = bb.solve(start, deadline);
            Kit.log.config("Branch and bound: " + bb.nNodes() + " nodes, " + (System.currentTimeMillis() - startTime) + "ms, " + r);
        } else {
            r = new AugmentedLagrangian(problem, control.nonlinear).solve(problem.lower, problem.upper, start, deadline);
            Kit.log.config("Augmented Lagrangian: " + (System.currentTimeMillis() - startTime) + "ms, " + r);
        }
        switch (r.termination) {
        case OPTIMAL:
            return RawOutcome.optimal(problem.userObjective(r.point), r.point);
        case INFEASIBLE:
            return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.INFEASIBLE, "");
        case UNBOUNDED:
            return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.UNBOUNDED, "");
        case MAX_TIME:
            return RawOutcome.of(SolverStatus.ABORTED, TerminationCondition.MAX_TIME, "time limit reached");
        case MAX_ITERATIONS:
            return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.MAX_ITERATIONS, "iteration limit reached");
        case NUMERICAL_ERROR:
            return RawOutcome.of(SolverStatus.ERROR, TerminationCondition.NUMERICAL_ERROR, "an expression could not be evaluated");
        default:
            return RawOutcome.error("unexpected termination " + r.termination);
        }
    }
}
