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
 * A decision variable of a program: either one per element (LP, IP) or a free-standing scalar.
 */
public final class ModelVariable {

    public enum Domain {
        CONTINUOUS, INTEGER;
    }

    private final String name;

    private final int position;

    private final Domain domain;

    private final double lower;

    private final double upper;

    public ModelVariable(String name, int position, Domain domain, double lower, double upper) {
        this.name = Objects.requireNonNull(name);
        this.position = position;
        this.domain = Objects.requireNonNull(domain);
        if (lower > upper)
            throw new IllegalArgumentException("Lower bound must not exceed upper bound for " + name);
        this.lower = lower;
        this.upper = upper;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the position of the variable in the program, which is also its position in solution vectors.
     */
    public int getPosition() {
        return position;
    }

    public Domain getDomain() {
        return domain;
    }

    public boolean isInteger() {
        return domain == Domain.INTEGER;
    }

    /**
     * Returns the lower bound, or negative infinity.
     */
    public double getLower() {
        return lower;
    }

    /**
     * Returns the upper bound, or positive infinity.
     */
    public double getUpper() {
        return upper;
    }

    public boolean hasLower() {
        return lower != Double.NEGATIVE_INFINITY;
    }

    public boolean hasUpper() {
        return upper != Double.POSITIVE_INFINITY;
    }

    @Override
    public String toString() {
        String l = hasLower() ? String.valueOf(lower) : "-∞";
        String u = hasUpper() ? String.valueOf(upper) : "+∞";
        return name + (isInteger() ? " ∈ ℤ" : " ∈ ℝ") + " [" + l + ", " + u + "]";
    }
}
