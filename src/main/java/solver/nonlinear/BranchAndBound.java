/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.nonlinear;

import java.util.ArrayDeque;
import java.util.Deque;

import dashboard.Control.OptionsNonlinear;
import solver.TerminationCondition;
import utility.Kit;

/**
 * Depth-first branch and bound over the integer variables of a nonlinear program. Each node solves the continuous
 * relaxation within its bounds, and branches on the most fractional integer variable, the closer side first. Nodes
 * whose relaxation is not better than the incumbent are pruned.
 */
final class BranchAndBound {

    private final NonlinearProblem problem;

    private final OptionsNonlinear options;

    private final AugmentedLagrangian relaxation;

    private int nNodes;

    BranchAndBound(NonlinearProblem problem, OptionsNonlinear options) {
        this.problem = problem;
        this.options = options;
        this.relaxation = new AugmentedLagrangian(problem, options);
    }

    private static final class Node {
        final double[] lower, upper, start;

        Node(double[] lower, double[] upper, double[] start) {
            this.lower = lower;
            this.upper = upper;
            this.start = start;
        }
    }

    /**
     * Returns the number of nodes explored by the last call to solve().
     */
    int nNodes() {
        return nNodes;
    }

    Relaxation solve(double[] start, long deadline) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(new Node(problem.lower.clone(), problem.upper.clone(), start));
        double[] incumbent = null;
        double incumbentValue = Double.POSITIVE_INFINITY;
        TerminationCondition interruption = null;
        nNodes = 0;
        while (!stack.isEmpty()) {
            if (nNodes >= options.maxNodes) {
                interruption = TerminationCondition.MAX_ITERATIONS;
                break;
            }
            if (deadline > 0 && System.currentTimeMillis() > deadline) {
                interruption = TerminationCondition.MAX_TIME;
                break;
            }
            Node node = stack.pop();
            nNodes++;
            Relaxation r = relaxation.solve(node.lower, node.upper, node.start, deadline);
            switch (r.termination) {
            case UNBOUNDED:
            case NUMERICAL_ERROR:
                if (nNodes == 1)
                    return r;
                continue;
            case MAX_TIME:
                interruption = TerminationCondition.MAX_TIME;
                continue;
            case OPTIMAL:
                break;
            case MAX_ITERATIONS:
                if (r.violation <= options.feasibilityTolerance)
                    break; // usable as a bound
                continue;
            default:
                continue;
            }
            if (incumbent != null && r.objective >= incumbentValue - options.optimalityTolerance * (1 + Math.abs(incumbentValue)))
                continue;
            int j = mostFractional(r.point);
            if (j < 0) {
                double[] x = snap(r.point);
                incumbent = x;
                incumbentValue = problem.objective(x);
                Kit.log.fine("New incumbent " + incumbentValue + " at node " + nNodes);
                continue;
            }
            double v = r.point[j], down = Math.floor(v);
            Node left = child(node, r.point, j, node.lower[j], down);
            Node right = child(node, r.point, j, down + 1, node.upper[j]);
            Node closer = v - down > 0.5 ? right : left, farther = closer == left ? right : left;
            if (farther != null)
                stack.push(farther);
            if (closer != null)
                stack.push(closer);
        }
        if (incumbent == null)
            return new Relaxation(interruption == null ? TerminationCondition.INFEASIBLE : interruption, problem.lower.clone(), Double.NaN, Double.NaN);
        double violation = problem.violation(incumbent, problem.lower, problem.upper);
        return new Relaxation(interruption == null ? TerminationCondition.OPTIMAL : interruption, incumbent, incumbentValue, violation);
    }

    /**
     * Returns the child of the node where variable j lies in [lo, hi], or null if that range is empty.
     */
    private static Node child(Node node, double[] point, int j, double lo, double hi) {
        if (lo > hi)
            return null;
        double[] lower = node.lower.clone(), upper = node.upper.clone();
        lower[j] = lo;
        upper[j] = hi;
        return new Node(lower, upper, point);
    }

    /**
     * Returns the integer variable whose value is farthest from an integer, or -1 if all are integral.
     */
    private int mostFractional(double[] x) {
        int best = -1;
        double bestDistance = options.integralityTolerance;
        for (int i = 0; i < x.length; i++) {
            if (!problem.integer[i])
                continue;
            double d = Math.abs(x[i] - Math.rint(x[i]));
            if (d > bestDistance) {
                best = i;
                bestDistance = d;
            }
        }
        return best;
    }

    private double[] snap(double[] x) {
        double[] t = x.clone();
        for (int i = 0; i < t.length; i++)
            if (problem.integer[i])
                t[i] = Math.rint(t[i]);
        return t;
    }
}
