/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import java.util.ArrayList;
import java.util.List;

import constraints.RelationalOperator;
import dashboard.Control.OptionsRelations;
import problem.ModelConstraint;
import problem.Program;

/**
 * Rewrites strict and != relations into the non-strict relations backends accept. A strict relation is tightened by
 * the strict tolerance; a != relation becomes the disjunction of the two tightened strict relations, so that a program
 * with k such relations expands into 2^k programs.
 */
public final class RelationExpansion {

    private RelationExpansion() {
    }

    /**
     * Returns the number of programs the given one expands into, saturated at Integer.MAX_VALUE.
     */
    public static int countBranches(Program program) {
        long count = 1;
        for (ModelConstraint c : program.getConstraints())
            if (c.getOperator() == RelationalOperator.NE)
                count = Math.min(count * 2, Integer.MAX_VALUE);
        return (int) count;
    }

    /**
     * Returns the programs whose union of feasible sets is the feasible set of the given program, up to the strict
     * tolerance. The first program takes the lower side of every != relation.
     *
     * @param program a program possibly using &lt;, &gt; or != relations
     * @param options the relation options
     * @return the expanded programs; the given program itself when nothing needs rewriting
     */
    public static List<Program> expand(Program program, OptionsRelations options) {
        double tol = options.strictTolerance;
        if (program.getConstraints().stream().noneMatch(c -> c.getOperator().isStrict() || c.getOperator() == RelationalOperator.NE))
            return List.of(program);
        List<List<ModelConstraint>> branches = new ArrayList<>();
        branches.add(new ArrayList<>());
        for (ModelConstraint c : program.getConstraints()) {
            switch (c.getOperator()) {
            case LT:
                branches.forEach(b -> b.add(c.with(RelationalOperator.LE, c.getRhs() - tol)));
                break;
            case GT:
                branches.forEach(b -> b.add(c.with(RelationalOperator.GE, c.getRhs() + tol)));
                break;
            case NE:
                List<List<ModelConstraint>> doubled = new ArrayList<>();
                for (List<ModelConstraint> b : branches) {
                    List<ModelConstraint> below = new ArrayList<>(b), above = new ArrayList<>(b);
                    below.add(c.with(RelationalOperator.LE, c.getRhs() - tol));
                    above.add(c.with(RelationalOperator.GE, c.getRhs() + tol));
                    doubled.add(below);
                    doubled.add(above);
                }
                branches = doubled;
                break;
            default:
                branches.forEach(b -> b.add(c));
            }
        }
        List<Program> programs = new ArrayList<>();
        for (List<ModelConstraint> b : branches)
            programs.add(program.withConstraints(b));
        return programs;
    }
}
