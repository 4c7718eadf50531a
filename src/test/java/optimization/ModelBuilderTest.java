/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.Test;

import dashboard.Diagnostic;
import dashboard.DiagnosticKind;
import dashboard.Diagnostics;
import expressions.LinearForm;
import problem.ModelVariable;
import problem.ProblemClass;
import problem.Program;
import problem.SampleProblems;
import problem.SolveRequest;

public class ModelBuilderTest {

    @Test
    void buildsElementIndexedLinearPrograms() {
        Diagnostics diagnostics = new Diagnostics();
        Program program = ModelBuilder.build(SampleProblems.furniture(), diagnostics);

        assertThat(diagnostics.isEmpty()).isTrue();
        assertThat(program.getElements()).containsExactly("Desk", "Table", "Chairs");
        assertThat(program.getVariables()).allSatisfy(v -> {
            assertThat(v.getDomain()).isEqualTo(ModelVariable.Domain.CONTINUOUS);
            assertThat(v.getLower()).isEqualTo(0.0);
            assertThat(v.hasUpper()).isFalse();
        });
        LinearForm objective = program.getObjective().getTerm().linearForm();
        assertThat(new double[] { objective.coefficient(0), objective.coefficient(1), objective.coefficient(2) }).containsExactly(60, 30, 20);
        assertThat(program.getConstraints()).extracting(c -> c.getTerm().getSource()).containsExactly("L", "F", "C");
    }

    @Test
    void integerProgramsGetIntegerVariables() {
        Program program = ModelBuilder.build(SampleProblems.boxes(), new Diagnostics());
        assertThat(program.getVariables()).allMatch(ModelVariable::isInteger);
    }

    @Test
    void mixedProgramsPlaceIntegerVariablesFirst() {
        Program program = ModelBuilder.build(SampleProblems.mixedQuadratic(), new Diagnostics());
        assertThat(program.getVariables()).extracting(ModelVariable::getName).containsExactly("x", "y", "z");
        assertThat(program.getVariables()).extracting(ModelVariable::isInteger).containsExactly(true, false, false);
        assertThat(program.getVariables()).noneMatch(ModelVariable::hasLower);
    }

    @Test
    void usesDeclaredParameterNamesWhenGiven() {
        SolveRequest request = SolveRequest.builder(ProblemClass.LP).elements("a, b").parameterNames("P, W")
                .parameter("P", Map.of("a", 1.0, "b", 2.0)).maximize("P").build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.PARAMETER_COVERAGE);
            assertThat(d.getSubject()).isEqualTo("W");
        });
    }

    @Test
    void skippedRowsDoNotBlockTheModel() {
        SolveRequest request = SolveRequest.builder(ProblemClass.LP).elements("a, b").parameter("P", Map.of("a", 1.0, "b", 2.0))
                .parameter("W", Map.of("a", 1.0, "b", 1.0)).maximize("P").constraint("W", "≤", "4").constraint("W", "<=", "4")
                .constraint("Z", "≤", "4").build();
        Diagnostics diagnostics = new Diagnostics();
        Program program = ModelBuilder.build(request, diagnostics);

        assertThat(program.getConstraints()).hasSize(1);
        assertThat(diagnostics.toList()).extracting(Diagnostic::getRow).containsExactly(2, 3);
        assertThat(diagnostics.hasFatal()).isFalse();
    }

    @Test
    void rejectsDuplicateElements() {
        SolveRequest request = SolveRequest.builder(ProblemClass.LP).elements("a, b, a").parameter("P", Map.of("a", 1.0, "b", 2.0)).maximize("P").build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).extracting(Diagnostic::getKind).containsExactly(DiagnosticKind.DUPLICATE_IDENTIFIER);
    }

    @Test
    void rejectsAVariableDeclaredBothIntegerAndContinuous() {
        SolveRequest request = SolveRequest.builder(ProblemClass.MINLP).integerVariables("x, y").continuousVariables("y").minimize("x + y").build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.DUPLICATE_IDENTIFIER);
            assertThat(d.getSubject()).isEqualTo("y");
        });
    }

    @Test
    void anUnknownObjectiveParameterBlocksTheModel() {
        SolveRequest request = SolveRequest.builder(ProblemClass.IP).elements("a").parameter("P", Map.of("a", 1.0)).maximize("Q").build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).extracting(Diagnostic::getKind).containsExactly(DiagnosticKind.UNKNOWN_PARAMETER);
    }

    @Test
    void aBadConstraintExpressionBlocksTheModel() {
        SolveRequest request = SolveRequest.builder(ProblemClass.NLP).continuousVariables("x, y").minimize("x**2 + y**2").constraint("x + y", "≥", 1)
                .constraint("x + w", "≤", 3).build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.EXPRESSION);
            assertThat(d.getRow()).isEqualTo(2);
        });
    }

    @Test
    void mixedLinearProgramsRequireLinearTerms() {
        SolveRequest request = SolveRequest.builder(ProblemClass.MILP).integerVariables("x").continuousVariables("y").minimize("x + y")
                .constraint("x*y", "≤", 3).build();
        Diagnostics diagnostics = new Diagnostics();
        assertThat(ModelBuilder.build(request, diagnostics)).isNull();
        assertThat(diagnostics.toList()).singleElement().satisfies(d -> {
            assertThat(d.getKind()).isEqualTo(DiagnosticKind.EXPRESSION);
            assertThat(d.getMessage()).contains("not linear");
        });
    }

    @Test
    void acceptsConstantObjectives() {
        SolveRequest request = SolveRequest.builder(ProblemClass.NLP).continuousVariables("x").minimize("3").constraint("x", "≥", 1).build();
        Program program = ModelBuilder.build(request, new Diagnostics());
        assertThat(program.getObjective().getTerm().isConstant()).isTrue();
    }
}
