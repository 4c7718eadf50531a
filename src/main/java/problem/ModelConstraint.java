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

import constraints.RelationalOperator;
import expressions.Term;

/**
 * A constraint of a program: term op rhs. The row is the 1-based index of the input row it comes from.
 */
public final class ModelConstraint {

    private final int row;

    private final Term term;

    private final RelationalOperator operator;

    private final double rhs;

    public ModelConstraint(int row, Term term, RelationalOperator operator, double rhs) {
        this.row = row;
        this.term = Objects.requireNonNull(term);
        this.operator = Objects.requireNonNull(operator);
        this.rhs = rhs;
    }

    public String getName() {
        return "c" + row;
    }

    public int getRow() {
        return row;
    }

    public Term getTerm() {
        return term;
    }

    public RelationalOperator getOperator() {
        return operator;
    }

    public double getRhs() {
        return rhs;
    }

    /**
     * Returns the same constraint with another relation.
     */
    public ModelConstraint with(RelationalOperator operator, double rhs) {
        return new ModelConstraint(row, term, operator, rhs);
    }

    @Override
    public String toString() {
        return getName() + ": " + term + " " + operator.tag() + " " + rhs;
    }
}
