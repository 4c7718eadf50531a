/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import constraints.RelationalOperator;
import dashboard.Control;
import dashboard.Diagnostics;
import optimization.ModelBuilder;
import problem.ModelConstraint;
import problem.ProblemClass;
import problem.Program;
import problem.SolveRequest;

public class RelationExpansionTest {

    private static Program program(String... operators) {
        SolveRequest.Builder builder = SolveRequest.builder(ProblemClass.MILP).continuousVariables("x").minimize("x");
        for (String op : operators)
            builder.constraint("x", op, 3);
        return ModelBuilder.build(builder.build(), new Diagnostics());
    }

    @Test
    void leavesNonStrictRelationsAlone() {
        Program p = program("≤", "≥", "=");
        assertThat(RelationExpansion.expand(p, Control.defaults().relations)).containsExactly(p);
        assertThat(RelationExpansion.countBranches(p)).isEqualTo(1);
    }

    @Test
    void tightensStrictRelations() {
        List<Program> programs = RelationExpansion.expand(program("<", ">"), Control.defaults().relations);
        assertThat(programs).singleElement().satisfies(p -> {
            ModelConstraint lt = p.getConstraints().get(0), gt = p.getConstraints().get(1);
            assertThat(lt.getOperator()).isEqualTo(RelationalOperator.LE);
            assertThat(lt.getRhs()).isEqualTo(3 - 1e-6);
            assertThat(gt.getOperator()).isEqualTo(RelationalOperator.GE);
            assertThat(gt.getRhs()).isEqualTo(3 + 1e-6);
            assertThat(lt.getRow()).isEqualTo(1);
        });
    }

    @Test
    void splitsEachDisequalityInTwo() {
        Program p = program("≠", "≤", "≠");
        assertThat(RelationExpansion.countBranches(p)).isEqualTo(4);
        List<Program> programs = RelationExpansion.expand(p, Control.defaults().relations);
        assertThat(programs).hasSize(4);
        assertThat(programs).allSatisfy(q -> {
            assertThat(q.getConstraints()).hasSize(3);
            assertThat(q.getConstraints()).noneMatch(c -> c.getOperator() == RelationalOperator.NE);
        });
        assertThat(programs.get(0).getConstraints()).extracting(ModelConstraint::getOperator).containsExactly(RelationalOperator.LE, RelationalOperator.LE,
                RelationalOperator.LE);
        assertThat(programs.get(3).getConstraints()).extracting(ModelConstraint::getOperator).containsExactly(RelationalOperator.GE, RelationalOperator.LE,
                RelationalOperator.GE);
    }
}
