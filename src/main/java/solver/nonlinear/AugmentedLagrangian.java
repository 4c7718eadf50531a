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
import java.util.List;

import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;

import dashboard.Control.OptionsNonlinear;
import solver.TerminationCondition;
import utility.Kit;

/**
 * Continuous solver for smooth programs, using the augmented Lagrangian method (Powell-Hestenes-Rockafellar form).
 * Each outer iteration minimizes, without constraints, the objective plus multiplier and quadratic penalty terms, with
 * the nonlinear conjugate gradient optimizer of Commons Math; multipliers are then updated, and the penalty grows when
 * the violation does not decrease fast enough. Bounds on variables are handled as inequalities.
 * <p>
 * Only local optimality is obtained on non-convex programs.
 */
final class AugmentedLagrangian {

    private final NonlinearProblem problem;

    private final OptionsNonlinear options;

    AugmentedLagrangian(NonlinearProblem problem, OptionsNonlinear options) {
        this.problem = problem;
        this.options = options;
    }

    /**
     * Solves the continuous relaxation within the given bounds.
     *
     * @param lower lower bounds (possibly infinite)
     * @param upper upper bounds (possibly infinite)
     * @param start the starting point, clipped to the bounds
     * @param deadline the wall-clock time (in ms) after which to stop, or 0 for none
     */
    Relaxation solve(double[] lower, double[] upper, double[] start, long deadline) {
        List<ConstraintFunction> inequalities = new ArrayList<>(problem.inequalities);
        for (int i = 0; i < problem.n; i++) {
            if (lower[i] != Double.NEGATIVE_INFINITY)
                inequalities.add(NonlinearProblem.bound(i, lower[i], true));
            if (upper[i] != Double.POSITIVE_INFINITY)
                inequalities.add(NonlinearProblem.bound(i, upper[i], false));
        }
        List<ConstraintFunction> equalities = problem.equalities;
        double[] mu = new double[inequalities.size()], lambda = new double[equalities.size()];
        double rho = options.initialPenalty;
        double[] x = clip(start, lower, upper);
        double previousViolation = Double.POSITIVE_INFINITY, previousObjective = Double.NaN, violation = Double.NaN, f = Double.NaN;
        int stalls = 0;
        for (int k = 0; k < options.maxOuterIterations; k++) {
            if (deadline > 0 && System.currentTimeMillis() > deadline)
                return new Relaxation(TerminationCondition.MAX_TIME, x, f, violation);
            x = minimize(new Penalized(inequalities, equalities, mu, lambda, rho), x);
            f = problem.objective(x);
            boolean finite = !Double.isNaN(f) && f != Double.POSITIVE_INFINITY;
            violation = 0;
            for (int i = 0; i < mu.length; i++) {
                double c = inequalities.get(i).evaluate(x, null);
                finite &= !Double.isNaN(c);
                violation = Math.max(violation, c);
                mu[i] = Math.max(0, mu[i] + rho * c);
            }
            for (int j = 0; j < lambda.length; j++) {
                double h = equalities.get(j).evaluate(x, null);
                finite &= !Double.isNaN(h);
                violation = Math.max(violation, Math.abs(h));
                lambda[j] += rho * h;
            }
            if (!finite)
                return new Relaxation(TerminationCondition.NUMERICAL_ERROR, x, f, violation);
            boolean feasible = violation <= options.feasibilityTolerance;
            if (feasible && f < -options.unboundedThreshold)
                return new Relaxation(TerminationCondition.UNBOUNDED, x, f, violation);
            if (feasible && Math.abs(f - previousObjective) <= options.optimalityTolerance * (1 + Math.abs(f))) {
                Kit.log.fine("Augmented Lagrangian converged after " + (k + 1) + " iterations, penalty " + rho);
                return new Relaxation(TerminationCondition.OPTIMAL, x, f, violation);
            }
            if (violation > 0.25 * previousViolation) {
                if (rho >= options.maxPenalty) {
                    if (++stalls >= 3 && !feasible)
                        return new Relaxation(TerminationCondition.INFEASIBLE, x, f, violation);
                } else
                    rho = Math.min(rho * options.penaltyGrowth, options.maxPenalty);
            }
            previousViolation = violation;
            previousObjective = f;
        }
        return new Relaxation(TerminationCondition.MAX_ITERATIONS, x, f, violation);
    }

    private double[] minimize(Penalized fn, double[] start) {
        NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
                new SimpleValueChecker(1e-12, 1e-14));
        try {
            PointValuePair p = optimizer.optimize(new MaxEval(options.maxInnerEvaluations), new MaxIter(options.maxInnerEvaluations),
                    new ObjectiveFunction(fn::value), new ObjectiveFunctionGradient(fn::gradient), GoalType.MINIMIZE, new InitialGuess(start));
            return fn.bestValue < p.getValue() ? fn.best.clone() : p.getPoint();
        } catch (MathIllegalStateException e) {
            Kit.log.fine(() -> "Inner minimization stopped: " + e.getMessage());
            return fn.best == null ? start : fn.best.clone();
        }
    }

    private static double[] clip(double[] x, double[] lower, double[] upper) {
        double[] t = new double[x.length];
        for (int i = 0; i < x.length; i++)
            t[i] = Math.max(lower[i], Math.min(upper[i], x[i]));
        return t;
    }

    /**
     * The augmented Lagrangian for fixed multipliers and penalty. Remembers the best point evaluated.
     */
    private final class Penalized {

        private final List<ConstraintFunction> inequalities, equalities;

        private final double[] mu, lambda;

        private final double rho;

        private final double[] buffer = new double[problem.n];

        double[] best;

        double bestValue = Double.POSITIVE_INFINITY;

        Penalized(List<ConstraintFunction> inequalities, List<ConstraintFunction> equalities, double[] mu, double[] lambda, double rho) {
            this.inequalities = inequalities;
            this.equalities = equalities;
            this.mu = mu;
            this.lambda = lambda;
            this.rho = rho;
        }

        double value(double[] x) {
            double v = problem.objective(x);
            for (int i = 0; i < mu.length; i++) {
                double s = Math.max(0, mu[i] + rho * inequalities.get(i).evaluate(x, null));
                v += (s * s - mu[i] * mu[i]) / (2 * rho);
            }
            for (int j = 0; j < lambda.length; j++) {
                double h = equalities.get(j).evaluate(x, null);
                v += lambda[j] * h + rho / 2 * h * h;
            }
            if (Double.isNaN(v))
                return Double.POSITIVE_INFINITY; // outside the domain of some term
            if (v < bestValue) {
                bestValue = v;
                best = x.clone();
            }
            return v;
        }

        double[] gradient(double[] x) {
            double[] g = new double[problem.n];
            problem.accumulateObjectiveGradient(x, 1, g);
            for (int i = 0; i < mu.length; i++) {
                double s = Math.max(0, mu[i] + rho * inequalities.get(i).evaluate(x, buffer));
                if (s > 0)
                    for (int t = 0; t < g.length; t++)
                        g[t] += s * buffer[t];
            }
            for (int j = 0; j < lambda.length; j++) {
                double s = lambda[j] + rho * equalities.get(j).evaluate(x, buffer);
                for (int t = 0; t < g.length; t++)
                    g[t] += s * buffer[t];
            }
            return g;
        }
    }
}
