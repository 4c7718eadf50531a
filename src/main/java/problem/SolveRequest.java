/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the user entered for one solve: the raw texts, tables and rows, before any validation.
 * <p>
 * Linear classes (LP, IP) use the element text, the parameter table and linear rows; the objective refers to a
 * parameter. The other classes use the variable texts and expression rows; the objective is an expression. NLP only
 * has continuous variables.
 */
public final class SolveRequest {

    private final ProblemClass problemClass;

    private final String elements;

    private final String parameterNames;

    private final Map<String, Map<String, Double>> parameters;

    private final String integerVariables;

    private final String continuousVariables;

    private final Sense sense;

    private final String objective;

    private final List<LinearConstraintRow> linearRows;

    private final List<ExpressionConstraintRow> expressionRows;

    private SolveRequest(Builder builder) {
        this.problemClass = builder.problemClass;
        this.elements = builder.elements;
        this.parameterNames = builder.parameterNames;
        Map<String, Map<String, Double>> m = new LinkedHashMap<>();
        builder.parameters.forEach((name, values) -> m.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        this.parameters = Collections.unmodifiableMap(m);
        this.integerVariables = builder.integerVariables;
        this.continuousVariables = builder.continuousVariables;
        this.sense = builder.sense;
        this.objective = builder.objective;
        this.linearRows = List.copyOf(builder.linearRows);
        this.expressionRows = List.copyOf(builder.expressionRows);
    }

    public static Builder builder(ProblemClass problemClass) {
        return new Builder(problemClass);
    }

    public ProblemClass getProblemClass() {
        return problemClass;
    }

    /**
     * Returns the comma-separated element names (linear classes), or null.
     */
    public String getElements() {
        return elements;
    }

    /**
     * Returns the comma-separated declared parameter names, or null when the keys of the table are the declared names.
     */
    public String getParameterNames() {
        return parameterNames;
    }

    /**
     * Returns the parameter table: parameter name to (element to value).
     */
    public Map<String, Map<String, Double>> getParameters() {
        return parameters;
    }

    public String getIntegerVariables() {
        return integerVariables;
    }

    public String getContinuousVariables() {
        return continuousVariables;
    }

    public Sense getSense() {
        return sense;
    }

    /**
     * Returns the objective reference: a parameter name for linear classes, an expression otherwise.
     */
    public String getObjective() {
        return objective;
    }

    public List<LinearConstraintRow> getLinearRows() {
        return linearRows;
    }

    public List<ExpressionConstraintRow> getExpressionRows() {
        return expressionRows;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof SolveRequest))
            return false;
        SolveRequest other = (SolveRequest) o;
        return problemClass == other.problemClass && Objects.equals(elements, other.elements) && Objects.equals(parameterNames, other.parameterNames)
                && parameters.equals(other.parameters) && Objects.equals(integerVariables, other.integerVariables)
                && Objects.equals(continuousVariables, other.continuousVariables) && sense == other.sense && Objects.equals(objective, other.objective)
                && linearRows.equals(other.linearRows) && expressionRows.equals(other.expressionRows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(problemClass, elements, parameterNames, parameters, integerVariables, continuousVariables, sense, objective, linearRows,
                expressionRows);
    }

    /**
     * Builder for solve requests.
     */
    public static final class Builder {
        private final ProblemClass problemClass;
        private String elements;
        private String parameterNames;
        private final Map<String, Map<String, Double>> parameters = new LinkedHashMap<>();
        private String integerVariables;
        private String continuousVariables;
        private Sense sense;
        private String objective;
        private final List<LinearConstraintRow> linearRows = new ArrayList<>();
        private final List<ExpressionConstraintRow> expressionRows = new ArrayList<>();

        private Builder(ProblemClass problemClass) {
            this.problemClass = Objects.requireNonNull(problemClass);
        }

        /**
         * Sets the comma-separated element names.
         */
        public Builder elements(String text) {
            this.elements = text;
            return this;
        }

        /**
         * Sets the comma-separated declared parameter names. When not set, the names given to
         * {@link #parameter(String, Map)} are the declared ones.
         */
        public Builder parameterNames(String text) {
            this.parameterNames = text;
            return this;
        }

        /**
         * Sets the values of one parameter, element by element.
         */
        public Builder parameter(String name, Map<String, Double> values) {
            parameters.put(name, new LinkedHashMap<>(values));
            return this;
        }

        public Builder integerVariables(String text) {
            this.integerVariables = text;
            return this;
        }

        public Builder continuousVariables(String text) {
            this.continuousVariables = text;
            return this;
        }

        /**
         * Sets the objective: a parameter name for linear classes, an expression otherwise.
         */
        public Builder objective(Sense sense, String reference) {
            this.sense = Objects.requireNonNull(sense);
            this.objective = reference;
            return this;
        }

        public Builder maximize(String reference) {
            return objective(Sense.MAXIMIZE, reference);
        }

        public Builder minimize(String reference) {
            return objective(Sense.MINIMIZE, reference);
        }

        /**
         * Adds a linear constraint row (parameter, operator symbol, value text).
         */
        public Builder constraint(String parameter, String operator, String value) {
            linearRows.add(new LinearConstraintRow(parameter, operator, value));
            return this;
        }

        /**
         * Adds an expression constraint row (expression, operator symbol, value).
         */
        public Builder constraint(String expression, String operator, double value) {
            expressionRows.add(new ExpressionConstraintRow(expression, operator, value));
            return this;
        }

        /**
         * Builds the request.
         *
         * @throws IllegalStateException if no objective was given, or if the rows do not suit the problem class
         */
        public SolveRequest build() {
            if (sense == null)
                throw new IllegalStateException("An objective is required");
            boolean parameterBased = problemClass.termSource == ProblemClass.TermSource.PARAMETERS;
            if (parameterBased && !expressionRows.isEmpty())
                throw new IllegalStateException(problemClass + " takes parameter constraint rows, not expression rows");
            if (!parameterBased && (!linearRows.isEmpty() || !parameters.isEmpty()))
                throw new IllegalStateException(problemClass + " takes expression constraint rows, not parameters");
            if (problemClass == ProblemClass.NLP && integerVariables != null && !integerVariables.isBlank())
                throw new IllegalStateException("NLP has no integer variables");
            return new SolveRequest(this);
        }
    }
}
