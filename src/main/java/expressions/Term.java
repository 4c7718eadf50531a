/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.Objects;

/**
 * A symbolic term usable in an objective or a constraint: an expression tree over the decision variables of one
 * binding, together with the text it was read from.
 */
public final class Term {

    private final String source;

    private final Node root;

    private final int dimension;

    public Term(String source, Node root, int dimension) {
        this.source = Objects.requireNonNull(source);
        this.root = Objects.requireNonNull(root);
        this.dimension = dimension;
    }

    /**
     * Builds the term sum(coefficients[i] * x[i]) + constant, over all variables of a binding of the array's length.
     */
    public static Term weightedSum(String source, double[] coefficients, String[] names, double constant) {
        Node node = null;
        for (int i = 0; i < coefficients.length; i++) {
            Node product = Node.multiply(Node.constant(coefficients[i]), Node.variable(names[i], i));
            node = node == null ? product : Node.add(node, product);
        }
        if (constant != 0 || node == null)
            node = node == null ? Node.constant(constant) : Node.add(node, Node.constant(constant));
        return new Term(source, node, coefficients.length);
    }

    public String getSource() {
        return source;
    }

    /**
     * Returns the number of variables of the binding the term refers to.
     */
    public int dimension() {
        return dimension;
    }

    public double value(double[] point) {
        return root.value(point);
    }

    /**
     * Returns the gradient of the term at the given point.
     */
    public double[] gradient(double[] point) {
        double[] gradient = new double[dimension];
        root.backward(point, 1, gradient);
        return gradient;
    }

    /**
     * Adds factor times the gradient of the term at the given point to the given array.
     */
    public void accumulateGradient(double[] point, double factor, double[] gradient) {
        if (factor != 0)
            root.backward(point, factor, gradient);
    }

    public boolean isLinear() {
        return root.linear(dimension) != null;
    }

    public boolean isConstant() {
        return root.isConstant();
    }

    /**
     * Returns the affine decomposition of the term.
     *
     * @throws ExpressionException if the term is not affine in the variables, or a coefficient overflows
     */
    public LinearForm linearForm() {
        LinearForm form = root.linear(dimension);
        if (form == null)
            throw new ExpressionException(source, "Expression is not linear");
        if (!form.isFinite())
            throw new ExpressionException(source, "Expression has a coefficient that is not a finite number");
        return form;
    }

    @Override
    public String toString() {
        return root.toString();
    }
}
