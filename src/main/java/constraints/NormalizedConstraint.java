/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import java.util.Objects;

/**
 * A constraint row that passed row-level validation: the source of its left-hand side (a parameter name or an
 * expression), a canonical operator and a finite right-hand side. Its term is built later, against the declared
 * variables.
 */
public final class NormalizedConstraint {

    public final int row;

    public final String source;

    public final RelationalOperator operator;

    public final double rhs;

    public NormalizedConstraint(int row, String source, RelationalOperator operator, double rhs) {
        this.row = row;
        this.source = Objects.requireNonNull(source);
        this.operator = Objects.requireNonNull(operator);
        this.rhs = rhs;
    }

    @Override
    public String toString() {
        return "row " + row + ": " + source + " " + operator.tag() + " " + rhs;
    }
}
