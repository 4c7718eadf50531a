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
 * One constraint row of a linear-class request: parameter name, operator symbol and right-hand side text, as typed.
 */
public final class LinearConstraintRow {

    private final String parameter;

    private final String operator;

    private final String value;

    public LinearConstraintRow(String parameter, String operator, String value) {
        this.parameter = parameter;
        this.operator = operator;
        this.value = value;
    }

    public String getParameter() {
        return parameter;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof LinearConstraintRow))
            return false;
        LinearConstraintRow other = (LinearConstraintRow) o;
        return Objects.equals(parameter, other.parameter) && Objects.equals(operator, other.operator) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(parameter, operator, value);
    }

    @Override
    public String toString() {
        return parameter + " " + operator + " " + value;
    }
}
