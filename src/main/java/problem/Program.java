/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A solver-agnostic mathematical program: index set, parameters, decision variables, one objective and an ordered
 * list of constraints. Programs are immutable; one is built per solve request.
 */
public final class Program {

    private final ProblemClass problemClass;

    private final List<String> elements;

    private final Map<String, Parameter> parameters;

    private final List<ModelVariable> variables;

    private final Objective objective;

    private final List<ModelConstraint> constraints;

    public Program(ProblemClass problemClass, List<String> elements, Map<String, Parameter> parameters, List<ModelVariable> variables,
            Objective objective, List<ModelConstraint> constraints) {
        this.problemClass = Objects.requireNonNull(problemClass);
        this.elements = List.copyOf(elements);
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.variables = List.copyOf(variables);
        this.objective = Objects.requireNonNull(objective);
        this.constraints = List.copyOf(constraints);
        for (int i = 0; i < this.variables.size(); i++)
            if (this.variables.get(i).getPosition() != i)
                throw new IllegalArgumentException("Variable " + this.variables.get(i).getName() + " is not at its position " + i);
    }

    public ProblemClass getProblemClass() {
        return problemClass;
    }

    /**
     * Returns the elements of the index set; empty for classes over free-standing scalars.
     */
    public List<String> getElements() {
        return elements;
    }

    public Map<String, Parameter> getParameters() {
        return parameters;
    }

    public List<ModelVariable> getVariables() {
        return variables;
    }

    public int nVariables() {
        return variables.size();
    }

    public boolean hasIntegerVariables() {
        return variables.stream().anyMatch(ModelVariable::isInteger);
    }

    public Objective getObjective() {
        return objective;
    }

    public List<ModelConstraint> getConstraints() {
        return constraints;
    }

    /**
     * Returns the same program with other constraints.
     */
    public Program withConstraints(List<ModelConstraint> constraints) {
        return new Program(problemClass, elements, parameters, variables, objective, constraints);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(problemClass.name()).append(" program\n");
        variables.forEach(v -> sb.append("  var ").append(v).append('\n'));
        sb.append("  ").append(objective).append('\n');
        constraints.forEach(c -> sb.append("  ").append(c).append('\n'));
        return sb.toString();
    }
}
