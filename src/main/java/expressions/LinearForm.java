/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.Arrays;

/**
 * An affine function: a constant plus one coefficient per variable of the binding it was built against.
 */
public final class LinearForm {

    private final double constant;

    private final double[] coefficients;

    private LinearForm(double constant, double[] coefficients) {
        this.constant = constant;
        this.coefficients = coefficients;
    }

    public static LinearForm constant(int dimension, double value) {
        return new LinearForm(value, new double[dimension]);
    }

    public static LinearForm variable(int dimension, int index) {
        double[] t = new double[dimension];
        t[index] = 1;
        return new LinearForm(0, t);
    }

    public LinearForm plus(LinearForm other) {
        double[] t = coefficients.clone();
        for (int i = 0; i < t.length; i++)
            t[i] += other.coefficients[i];
        return new LinearForm(constant + other.constant, t);
    }

    public LinearForm minus(LinearForm other) {
        return plus(other.scale(-1));
    }

    public LinearForm scale(double factor) {
        double[] t = coefficients.clone();
        for (int i = 0; i < t.length; i++)
            t[i] *= factor;
        return new LinearForm(constant * factor, t);
    }

    /**
     * Returns true if no variable has a non-zero coefficient.
     */
    public boolean isConstant() {
        return Arrays.stream(coefficients).allMatch(c -> c == 0);
    }

    public boolean isFinite() {
        return Double.isFinite(constant) && Arrays.stream(coefficients).allMatch(Double::isFinite);
    }

    public double getConstant() {
        return constant;
    }

    public double coefficient(int index) {
        return coefficients[index];
    }

    public int dimension() {
        return coefficients.length;
    }

    public double valueAt(double[] point) {
        double v = constant;
        for (int i = 0; i < coefficients.length; i++)
            v += coefficients[i] * point[i];
        return v;
    }

    @Override
    public String toString() {
        return "LinearForm{constant=" + constant + ", coefficients=" + Arrays.toString(coefficients) + "}";
    }
}
