/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver.linear;

import java.util.List;

import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;

import dashboard.Control;
import expressions.LinearForm;
import problem.ModelConstraint;
import problem.ModelVariable;
import problem.Program;
import problem.Sense;
import solver.BackendKind;
import solver.RawOutcome;
import solver.SolverBackend;
import solver.SolverStatus;
import solver.TerminationCondition;
import utility.Kit;

/**
 * Linear backend built on the ojAlgo expressions-based model. Handles LP, IP and MILP programs: every term must be
 * affine, and integer variables are solved as such (ojAlgo branches internally).
 */
public class OjAlgoBackend implements SolverBackend {

    public static final String NAME = "ojalgo";

    /**
     * Tolerance used to check constraints that involve no variable.
     */
    private static final double CONSTANT_TOLERANCE = 1e-9;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public BackendKind getKind() {
        return BackendKind.LINEAR;
    }

    @Override
    public RawOutcome solve(Program program, Control control) {
        try {
            for (ModelConstraint c : program.getConstraints()) {
                LinearForm f = c.getTerm().linearForm();
                // no variable involved: the constraint holds or the program is infeasible
                if (f.isConstant() && !c.getOperator().holds(0, c.getRhs() - f.getConstant(), CONSTANT_TOLERANCE))
                    return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.INFEASIBLE, c.getName() + " can never hold");
            }
            if (program.nVariables() == 0)
                return RawOutcome.optimal(program.getObjective().getTerm().linearForm().getConstant(), new double[0]);

            long startTime = System.currentTimeMillis();
            Optimisation.Result result = optimise(program, control, false);
            long elapsed = System.currentTimeMillis() - startTime;
            Optimisation.State state = result.getState();
            Kit.log.config("ojAlgo solve time: " + elapsed + "ms, state: " + state + (state.isFeasible() ? ", value: " + result.getValue() : ""));
            if (state == Optimisation.State.INFEASIBLE && program.hasIntegerVariables()) {
                // ojAlgo reports unbounded integer programs as infeasible
                Optimisation.State relaxed = optimise(program, control, true).getState();
                Kit.log.config("ojAlgo continuous relaxation state: " + relaxed);
                if (relaxed == Optimisation.State.UNBOUNDED)
                    return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.UNBOUNDED, "the continuous relaxation is unbounded");
            }
            return toOutcome(program, result);
        } catch (RuntimeException e) {
            Kit.log.warning("ojAlgo error: " + e.getMessage() + " (" + e.getClass().getSimpleName() + ")");
            return RawOutcome.error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Builds the ojAlgo model of the program and optimises it, with integrality dropped if relaxed.
     */
    private static Optimisation.Result optimise(Program program, Control control, boolean relaxed) {
        ExpressionsBasedModel model = new ExpressionsBasedModel();
        List<ModelVariable> variables = program.getVariables();
        Variable[] lpVars = new Variable[variables.size()];
        for (ModelVariable x : variables) {
            Variable v = Variable.make(x.getName());
            if (x.hasLower())
                v.lower(x.getLower());
            if (x.hasUpper())
                v.upper(x.getUpper());
            if (x.isInteger() && !relaxed)
                v.integer(true);
            lpVars[x.getPosition()] = v;
            model.addVariable(v);
        }

        Expression objExpr = model.addExpression("objective");
        setCoefficients(objExpr, program.getObjective().getTerm().linearForm(), lpVars);
        objExpr.weight(1);

        for (ModelConstraint c : program.getConstraints()) {
            LinearForm f = c.getTerm().linearForm();
            if (f.isConstant())
                continue;
            double rhs = c.getRhs() - f.getConstant();
            Expression expr = model.addExpression(c.getName());
            setCoefficients(expr, f, lpVars);
            switch (c.getOperator()) {
            case LE:
                expr.upper(rhs);
                break;
            case GE:
                expr.lower(rhs);
                break;
            case EQ:
                expr.level(rhs);
                break;
            default:
                throw new IllegalArgumentException("Relation " + c.getOperator().tag() + " must be expanded before solving " + c.getName());
            }
        }

        if (control.solver.timeoutMillis > 0L)
            model.options.time_abort = control.solver.timeoutMillis;
        return program.getObjective().getSense() == Sense.MAXIMIZE ? model.maximise() : model.minimise();
    }

    private static void setCoefficients(Expression expr, LinearForm f, Variable[] lpVars) {
        for (int i = 0; i < lpVars.length; i++) {
            double coeff = f.coefficient(i);
            if (coeff != 0)
                expr.set(lpVars[i], coeff);
        }
    }

    private static RawOutcome toOutcome(Program program, Optimisation.Result result) {
        Optimisation.State state = result.getState();
        if (state.isOptimal()) {
            double[] x = new double[program.nVariables()];
            for (int i = 0; i < x.length; i++)
                x[i] = result.doubleValue(i);
            return RawOutcome.optimal(program.getObjective().getTerm().value(x), x);
        }
        if (state == Optimisation.State.INFEASIBLE)
            return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.INFEASIBLE, "");
        if (state == Optimisation.State.UNBOUNDED)
            return RawOutcome.of(SolverStatus.WARNING, TerminationCondition.UNBOUNDED, "");
        if (state.isFeasible())
            return RawOutcome.of(SolverStatus.ABORTED, TerminationCondition.MAX_TIME, "stopped at a feasible but unproven solution");
        return RawOutcome.of(SolverStatus.ERROR, TerminationCondition.ERROR, "ojAlgo ended in state " + state);
    }
}
