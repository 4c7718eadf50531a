/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.nonlinear;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import expressions.Term;
import problem.ModelConstraint;
import problem.ModelVariable;
import problem.Program;
import problem.Sense;

/**
 * A program seen as: minimize f(x) subject to c(x) &lt;= 0, h(x) = 0 and bounds on x. Maximization is turned into
 * minimization of the opposite objective.
 */
final class NonlinearProblem {

    final int n;

    private final Term objective;

    private final double sign;

    final List<ConstraintFunction> inequalities = new ArrayList<>();

    final List<ConstraintFunction> equalities = new ArrayList<>();

    final double[] lower, upper;

    final boolean[] integer;

    NonlinearProblem(Program program) {
        this.n = program.nVariables();
        this.objective = program.getObjective().getTerm();
        this.sign = program.getObjective().getSense() == Sense.MAXIMIZE ? -1 : 1;
        this.lower = new double[n];
        this.upper = new double[n];
        this.integer = new boolean[n];
        for (ModelVariable x : program.getVariables()) {
            lower[x.getPosition()] = x.getLower();
            upper[x.getPosition()] = x.getUpper();
            integer[x.getPosition()] = x.isInteger();
        }
        for (ModelConstraint c : program.getConstraints()) {
            switch (c.getOperator()) {
            case LE:
                inequalities.add(of(c.getTerm(), c.getRhs(), 1));
                break;
            case GE:
                inequalities.add(of(c.getTerm(), c.getRhs(), -1));
                break;
            case EQ:
                equalities.add(of(c.getTerm(), c.getRhs(), 1));
                break;
            default:
                throw new IllegalArgumentException("Relation " + c.getOperator().tag() + " must be expanded before solving " + c.getName());
            }
        }
    }

    /**
     * Returns s * (term - rhs).
     */
    private static ConstraintFunction of(Term term, double rhs, double s) {
        return (x, gradient) -> {
            if (gradient != null) {
                Arrays.fill(gradient, 0);
                term.accumulateGradient(x, s, gradient);
            }
            return s * (term.value(x) - rhs);
        };
    }

    /**
     * Returns the function of the bound lower &lt;= x[i] (when isLower) or x[i] &lt;= upper.
     */
    static ConstraintFunction bound(int i, double value, boolean isLower) {
        double s = isLower ? -1 : 1;
        return (x, gradient) -> {
            if (gradient != null) {
                Arrays.fill(gradient, 0);
                gradient[i] = s;
            }
            return s * (x[i] - value);
        };
    }

    boolean hasIntegerVariables() {
        for (boolean b : integer)
            if (b)
                return true;
        return false;
    }

    /**
     * Returns the objective to minimize at x.
     */
    double objective(double[] x) {
        return sign * objective.value(x);
    }

    /**
     * Adds factor times the gradient of the objective to minimize to g.
     */
    void accumulateObjectiveGradient(double[] x, double factor, double[] g) {
        objective.accumulateGradient(x, sign * factor, g);
    }

    /**
     * Returns the objective in the sense of the program, at x.
     */
    double userObjective(double[] x) {
        return objective.value(x);
    }

    /**
     * Returns the largest violation at x of the constraints and of the given bounds.
     */
    double violation(double[] x, double[] lower, double[] upper) {
        double v = 0;
        for (ConstraintFunction c : inequalities)
            v = Math.max(v, c.evaluate(x, null));
        for (ConstraintFunction h : equalities)
            v = Math.max(v, Math.abs(h.evaluate(x, null)));
        for (int i = 0; i < n; i++)
            v = Math.max(v, Math.max(lower[i] - x[i], x[i] - upper[i]));
        return v;
    }
}
