/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.Objects;

/**
 * One constraint row of an expression-class request: left-hand side expression, operator symbol and numeric
 * right-hand side.
 */
public final class ExpressionConstraintRow {

    private final String expression;

    private final String operator;

    private final double value;

    public ExpressionConstraintRow(String expression, String operator, double value) {
        this.expression = expression;
        this.operator = operator;
        this.value = value;
    }

    public String getExpression() {
        return expression;
    }

    public String getOperator() {
        return operator;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ExpressionConstraintRow))
            return false;
        ExpressionConstraintRow other = (ExpressionConstraintRow) o;
        return Objects.equals(expression, other.expression) && Objects.equals(operator, other.operator)
                && Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, operator, value);
    }

    @Override
    public String toString() {
        return expression + " " + operator + " " + value;
    }
}
