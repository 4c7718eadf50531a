/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package solver;

import java.util.Arrays;
import java.util.Objects;

/**
 * What a backend returns for one program: status, termination condition and, when available, the objective value
 * and the variable values (indexed by variable position).
 */
public final class RawOutcome {

    private final SolverStatus status;

    private final TerminationCondition termination;

    private final double objectiveValue;

    private final double[] values;

    private final String message;

    public RawOutcome(SolverStatus status, TerminationCondition termination, double objectiveValue, double[] values, String message) {
        this.status = Objects.requireNonNull(status);
        this.termination = Objects.requireNonNull(termination);
        this.objectiveValue = objectiveValue;
        this.values = values == null ? null : values.clone();
        this.message = message == null ? "" : message;
    }

    public static RawOutcome optimal(double objectiveValue, double[] values) {
        return new RawOutcome(SolverStatus.OK, TerminationCondition.OPTIMAL, objectiveValue, values, "");
    }

    public static RawOutcome of(SolverStatus status, TerminationCondition termination, String message) {
        return new RawOutcome(status, termination, Double.NaN, null, message);
    }

    public static RawOutcome error(String message) {
        return of(SolverStatus.ERROR, TerminationCondition.ERROR, message);
    }

    public SolverStatus getStatus() {
        return status;
    }

    public TerminationCondition getTermination() {
        return termination;
    }

    /**
     * Returns true if the backend reports a normal end at a proven optimum.
     */
    public boolean isOptimal() {
        return status == SolverStatus.OK && termination == TerminationCondition.OPTIMAL && values != null;
    }

    /**
     * Returns the objective value, or NaN if not available.
     */
    public double getObjectiveValue() {
        return objectiveValue;
    }

    /**
     * Returns a copy of the variable values, or null if not available.
     */
    public double[] getValues() {
        return values == null ? null : values.clone();
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "RawOutcome{status=" + status + ", termination=" + termination + ", objective=" + objectiveValue + ", values="
                + Arrays.toString(values) + (message.isEmpty() ? "" : ", message=" + message) + "}";
    }
}
