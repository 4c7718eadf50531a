/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.terms;

import java.util.List;
import java.util.Map;

import expressions.VariableBinding;
import problem.ModelVariable;
import problem.Parameter;
import problem.ProblemClass;
import problem.UnknownParameterException;

/**
 * Context object passed to TermBuilders. Provides access to the decision variables, their binding and the parameters
 * of the program being built.
 */
public class BuildContext {

    private final ProblemClass problemClass;

    private final List<ModelVariable> variables;

    private final VariableBinding binding;

    private final Map<String, Parameter> parameters;

    /**
     * Creates a new build context.
     *
     * @param problemClass the class of the program
     * @param variables the decision variables, in position order
     * @param parameters the validated parameters, by name
     */
    public BuildContext(ProblemClass problemClass, List<ModelVariable> variables, Map<String, Parameter> parameters) {
        this.problemClass = problemClass;
        this.variables = variables;
        this.parameters = parameters;
        this.binding = VariableBinding.of(variables.stream().map(ModelVariable::getName).toList());
    }

    public ProblemClass getProblemClass() {
        return problemClass;
    }

    /**
     * Returns true if the terms built in this context must be linear.
     */
    public boolean requiresLinearTerms() {
        return problemClass.requiresLinearTerms();
    }

    public VariableBinding getBinding() {
        return binding;
    }

    public int nVariables() {
        return variables.size();
    }

    public ModelVariable getVariable(int position) {
        return variables.get(position);
    }

    /**
     * Get the parameter of the given name.
     *
     * @throws UnknownParameterException if no parameter has this name
     */
    public Parameter getParameter(String name) {
        Parameter p = name == null ? null : parameters.get(name.strip());
        if (p == null)
            throw new UnknownParameterException(String.valueOf(name), "Parameter '" + name + "' is not declared");
        return p;
    }
}
