/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.linear;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;

import org.junit.jupiter.api.Test;

import constraints.RelationalOperator;

import dashboard.Control;
import dashboard.Diagnostics;
import expressions.Term;
import optimization.ModelBuilder;
import problem.ModelConstraint;
import problem.ProblemClass;
import problem.Program;
import problem.SolveRequest;
import solver.RawOutcome;
import solver.SolverStatus;
import solver.TerminationCondition;

public class OjAlgoBackendTest {

    private final OjAlgoBackend backend = new OjAlgoBackend();

    private static Program program(SolveRequest.Builder builder) {
        return ModelBuilder.build(builder.build(), new Diagnostics());
    }

    @Test
    void solvesEqualitiesAndConstants() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).continuousVariables("x, y").minimize("2*x + y + 10")
                .constraint("x + y", "=", 4).constraint("x - 1", "≥", 0).constraint("y", "≥", 0));
        RawOutcome outcome = backend.solve(p, Control.defaults());
        assertThat(outcome.isOptimal()).isTrue();
        assertThat(outcome.getValues()).containsExactly(new double[] { 1, 3 }, within(1e-9));
        assertThat(outcome.getObjectiveValue()).isCloseTo(15, within(1e-9));
    }

    @Test
    void reportsUnboundedPrograms() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).continuousVariables("x").maximize("x").constraint("x", "≥", 0));
        RawOutcome outcome = backend.solve(p, Control.defaults());
        assertThat(outcome.isOptimal()).isFalse();
        assertThat(outcome.getValues()).isNull();
    }

    @Test
    void constraintsWithoutVariablesAreChecked() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).continuousVariables("x").minimize("x").constraint("x - x", "≥", 1)
                .constraint("x", "≥", 0));
        RawOutcome outcome = backend.solve(p, Control.defaults());
        assertThat(outcome.getStatus()).isEqualTo(SolverStatus.WARNING);
        assertThat(outcome.getTermination()).isEqualTo(TerminationCondition.INFEASIBLE);
    }

    @Test
    void respectsIntegrality() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).integerVariables("n").continuousVariables("y").maximize("n + y")
                .constraint("2*n", "≤", 7).constraint("y", "≤", 0.5));
        RawOutcome outcome = backend.solve(p, Control.defaults());
        assertThat(outcome.isOptimal()).isTrue();
        assertThat(outcome.getValues()[0]).isCloseTo(3, within(1e-9));
        assertThat(outcome.getObjectiveValue()).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void unboundedIntegerProgramsAreNotReportedInfeasible() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).integerVariables("n").maximize("n"));
        RawOutcome outcome = backend.solve(p, Control.defaults());
        assertThat(outcome.isOptimal()).isFalse();
        assertThat(outcome.getStatus()).isEqualTo(SolverStatus.WARNING);
        assertThat(outcome.getTermination()).isEqualTo(TerminationCondition.UNBOUNDED);
    }

    @Test
    void modelsThatCannotBeBuiltGiveErrorOutcomes() {
        Program p = program(SolveRequest.builder(ProblemClass.MILP).continuousVariables("x").maximize("x").constraint("x", "≤", 1));
        Term weighted = Term.weightedSum("W", new double[] { Double.NaN }, new String[] { "x" }, 0);
        Program broken = p.withConstraints(List.of(new ModelConstraint(1, weighted, RelationalOperator.LE, 4)));
        RawOutcome outcome = backend.solve(broken, Control.defaults());
        assertThat(outcome.getStatus()).isEqualTo(SolverStatus.ERROR);
        assertThat(outcome.getTermination()).isEqualTo(TerminationCondition.ERROR);
        assertThat(outcome.getMessage()).contains("not a finite number");
    }
}
