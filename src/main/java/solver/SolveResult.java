/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import utility.Kit;

/**
 * The interpreted result of a solve: either an optimal solution, with its objective value and one value per decision
 * variable, or the indication that no optimal solution was obtained. The raw status and termination condition of the
 * backend are kept in both cases.
 */
public final class SolveResult {

    public enum Status {
        OPTIMAL, INFEASIBLE_OR_ERROR;
    }

    private final Status status;

    private final double objectiveValue;

    private final Map<String, Double> values;

    private final SolverStatus solverStatus;

    private final TerminationCondition termination;

    private final String message;

    private final int displayDecimals;

    private SolveResult(Status status, double objectiveValue, Map<String, Double> values, SolverStatus solverStatus, TerminationCondition termination,
            String message, int displayDecimals) {
        this.status = status;
        this.objectiveValue = objectiveValue;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.solverStatus = solverStatus;
        this.termination = termination;
        this.message = message;
        this.displayDecimals = displayDecimals;
    }

    static SolveResult optimal(double objectiveValue, Map<String, Double> values, int displayDecimals) {
        return new SolveResult(Status.OPTIMAL, objectiveValue, values, SolverStatus.OK, TerminationCondition.OPTIMAL, "", displayDecimals);
    }

    static SolveResult notOptimal(SolverStatus solverStatus, TerminationCondition termination, String message, int displayDecimals) {
        return new SolveResult(Status.INFEASIBLE_OR_ERROR, Double.NaN, Map.of(), solverStatus, termination, message, displayDecimals);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOptimal() {
        return status == Status.OPTIMAL;
    }

    /**
     * Returns the objective value, or NaN if the result is not optimal.
     */
    public double getObjectiveValue() {
        return objectiveValue;
    }

    /**
     * Returns the objective value rounded for display.
     */
    public double displayObjective() {
        return Kit.round(objectiveValue, displayDecimals);
    }

    /**
     * Returns the value of every decision variable, in declaration order; empty if the result is not optimal.
     */
    public Map<String, Double> getValues() {
        return values;
    }

    /**
     * Returns the value of the named variable rounded for display.
     *
     * @throws IllegalArgumentException if the result has no such variable
     */
    public double displayValue(String name) {
        Double v = values.get(name);
        if (v == null)
            throw new IllegalArgumentException("No value for " + name);
        return Kit.round(v, displayDecimals);
    }

    public SolverStatus getSolverStatus() {
        return solverStatus;
    }

    public TerminationCondition getTermination() {
        return termination;
    }

    public String getMessage() {
        return message;
    }

    public int getDisplayDecimals() {
        return displayDecimals;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SolveResult))
            return false;
        SolveResult other = (SolveResult) o;
        return status == other.status && Double.compare(objectiveValue, other.objectiveValue) == 0 && values.equals(other.values)
                && solverStatus == other.solverStatus && termination == other.termination && message.equals(other.message)
                && displayDecimals == other.displayDecimals;
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, objectiveValue, values, solverStatus, termination, message, displayDecimals);
    }

    @Override
    public String toString() {
        if (!isOptimal())
            return "No optimal solution (status " + solverStatus + ", termination " + termination + ")" + (message.isEmpty() ? "" : ": " + message);
        StringBuilder sb = new StringBuilder("Optimal objective value: ").append(displayObjective());
        values.forEach((name, v) -> sb.append("\n  ").append(name).append(" = ").append(Kit.round(v, displayDecimals)));
        return sb.toString();
    }
}
