/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates free-form arithmetic expressions against a binding of declared variable names. Only numeric literals,
 * bound names, + - * / **, unary signs and parentheses are accepted; nothing outside the binding is ever resolved.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    /**
     * Turns the expression into a term over the variables of the binding.
     *
     * @param text the expression text
     * @param binding the declared variables the expression may refer to
     * @return the term
     * @throws ExpressionException on syntax error, unsupported construct, unbound name or constant arithmetic error
     */
    public static Term evaluate(String text, VariableBinding binding) {
        if (text == null)
            throw new ExpressionException("", "Missing expression");
        return new Term(text, new ExpressionParser(text, binding).parse(), binding.size());
    }

    /**
     * Evaluates the expression numerically, each name taking the value it is bound to.
     *
     * @throws ExpressionException as {@link #evaluate(String, VariableBinding)}
     */
    public static double evaluate(String text, Map<String, Double> values) {
        List<String> names = new ArrayList<>(values.keySet());
        double[] point = new double[names.size()];
        for (int i = 0; i < point.length; i++)
            point[i] = values.get(names.get(i));
        return evaluate(text, VariableBinding.of(names)).value(point);
    }
}
