/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

/**
 * A node of an arithmetic expression tree over decision variables. Nodes are immutable; constant sub-trees are folded
 * when the tree is built through the static factory methods.
 */
public abstract class Node {

    /**
     * Returns the value of the sub-tree at the given point (indexed by variable position).
     */
    public abstract double value(double[] point);

    /**
     * Adds adjoint * d(this)/dx to gradient, for every variable x of the sub-tree (reverse accumulation).
     */
    abstract void backward(double[] point, double adjoint, double[] gradient);

    /**
     * Returns the affine form of the sub-tree over the given number of variables, or null if the sub-tree is not affine.
     */
    abstract LinearForm linear(int dimension);

    public boolean isConstant() {
        return false;
    }

    /**
     * The precedence used when rendering (higher binds tighter).
     */
    abstract int precedence();

    String render(Node child, boolean parenthesizeEqual) {
        String s = child.toString();
        boolean wrap = child.precedence() < precedence() || (parenthesizeEqual && child.precedence() == precedence());
        return wrap ? "(" + s + ")" : s;
    }

    /**********************************************************************************************
     * Factories (with constant folding)
     *********************************************************************************************/

    public static Node constant(double value) {
        return new Constant(value);
    }

    public static Node variable(String name, int position) {
        return new Variable(name, position);
    }

    public static Node negate(Node child) {
        if (child.isConstant())
            return new Constant(-((Constant) child).value);
        return new Negate(child);
    }

    /**
     * @throws ArithmeticException if both operands are constant and the sum overflows
     */
    public static Node add(Node left, Node right) {
        if (left.isConstant() && right.isConstant())
            return folded(((Constant) left).value + ((Constant) right).value);
        return new Add(left, right);
    }

    public static Node subtract(Node left, Node right) {
        if (left.isConstant() && right.isConstant())
            return folded(((Constant) left).value - ((Constant) right).value);
        return new Subtract(left, right);
    }

    public static Node multiply(Node left, Node right) {
        if (left.isConstant() && right.isConstant())
            return folded(((Constant) left).value * ((Constant) right).value);
        return new Multiply(left, right);
    }

    /**
     * @throws ArithmeticException if the divisor is the constant zero
     */
    public static Node divide(Node left, Node right) {
        if (right.isConstant() && ((Constant) right).value == 0)
            throw new ArithmeticException("division by zero");
        if (left.isConstant() && right.isConstant())
            return folded(((Constant) left).value / ((Constant) right).value);
        return new Divide(left, right);
    }

    /**
     * @throws ArithmeticException if both operands are constant and the power is undefined over the reals
     */
    public static Node power(Node base, Node exponent) {
        if (base.isConstant() && exponent.isConstant()) {
            double b = ((Constant) base).value, e = ((Constant) exponent).value;
            if (b == 0 && e < 0)
                throw new ArithmeticException("zero raised to a negative power");
            double v = Math.pow(b, e);
            if (Double.isNaN(v))
                throw new ArithmeticException("power " + b + " ** " + e + " is not a real number");
            return folded(v);
        }
        return new Power(base, exponent);
    }

    private static Node folded(double value) {
        if (!Double.isFinite(value))
            throw new ArithmeticException("result is not a finite number");
        return new Constant(value);
    }

    /**********************************************************************************************
     * Leaves
     *********************************************************************************************/

    public static final class Constant extends Node {

        public final double value;

        Constant(double value) {
            this.value = value;
        }

        @Override
        public double value(double[] point) {
            return value;
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
        }

        @Override
        LinearForm linear(int dimension) {
            return LinearForm.constant(dimension, value);
        }

        @Override
        public boolean isConstant() {
            return true;
        }

        @Override
        int precedence() {
            return value < 0 ? 2 : 5;
        }

        @Override
        public String toString() {
            return value == Math.rint(value) && Math.abs(value) < 1e15 ? String.valueOf((long) value) : String.valueOf(value);
        }
    }

    public static final class Variable extends Node {

        public final String name;

        public final int position;

        Variable(String name, int position) {
            this.name = name;
            this.position = position;
        }

        @Override
        public double value(double[] point) {
            return point[position];
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            gradient[position] += adjoint;
        }

        @Override
        LinearForm linear(int dimension) {
            return LinearForm.variable(dimension, position);
        }

        @Override
        int precedence() {
            return 5;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**********************************************************************************************
     * Operators
     *********************************************************************************************/

    static final class Negate extends Node {

        final Node child;

        Negate(Node child) {
            this.child = child;
        }

        @Override
        public double value(double[] point) {
            return -child.value(point);
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            child.backward(point, -adjoint, gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm f = child.linear(dimension);
            return f == null ? null : f.scale(-1);
        }

        @Override
        int precedence() {
            return 3;
        }

        @Override
        public String toString() {
            return "-" + render(child, false);
        }
    }

    static final class Add extends Node {

        final Node left, right;

        Add(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double value(double[] point) {
            return left.value(point) + right.value(point);
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            left.backward(point, adjoint, gradient);
            right.backward(point, adjoint, gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm l = left.linear(dimension), r = right.linear(dimension);
            return l == null || r == null ? null : l.plus(r);
        }

        @Override
        int precedence() {
            return 1;
        }

        @Override
        public String toString() {
            return render(left, false) + " + " + render(right, false);
        }
    }

    static final class Subtract extends Node {

        final Node left, right;

        Subtract(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double value(double[] point) {
            return left.value(point) - right.value(point);
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            left.backward(point, adjoint, gradient);
            right.backward(point, -adjoint, gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm l = left.linear(dimension), r = right.linear(dimension);
            return l == null || r == null ? null : l.minus(r);
        }

        @Override
        int precedence() {
            return 1;
        }

        @Override
        public String toString() {
            return render(left, false) + " - " + render(right, true);
        }
    }

    static final class Multiply extends Node {

        final Node left, right;

        Multiply(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double value(double[] point) {
            return left.value(point) * right.value(point);
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            left.backward(point, adjoint * right.value(point), gradient);
            right.backward(point, adjoint * left.value(point), gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm l = left.linear(dimension), r = right.linear(dimension);
            if (l == null || r == null)
                return null;
            if (l.isConstant())
                return r.scale(l.getConstant());
            if (r.isConstant())
                return l.scale(r.getConstant());
            return null; // product of two variable terms
        }

        @Override
        int precedence() {
            return 2;
        }

        @Override
        public String toString() {
            return render(left, false) + "*" + render(right, true);
        }
    }

    static final class Divide extends Node {

        final Node left, right;

        Divide(Node left, Node right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public double value(double[] point) {
            return left.value(point) / right.value(point);
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            double r = right.value(point);
            left.backward(point, adjoint / r, gradient);
            right.backward(point, -adjoint * left.value(point) / (r * r), gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm l = left.linear(dimension), r = right.linear(dimension);
            if (l == null || r == null || !r.isConstant() || r.getConstant() == 0)
                return null;
            return l.scale(1 / r.getConstant());
        }

        @Override
        int precedence() {
            return 2;
        }

        @Override
        public String toString() {
            return render(left, false) + "/" + render(right, true);
        }
    }

    static final class Power extends Node {

        final Node base, exponent;

        Power(Node base, Node exponent) {
            this.base = base;
            this.exponent = exponent;
        }

        @Override
        public double value(double[] point) {
            return Math.pow(base.value(point), exponent.value(point));
        }

        @Override
        void backward(double[] point, double adjoint, double[] gradient) {
            double b = base.value(point), e = exponent.value(point);
            if (!base.isConstant())
                base.backward(point, adjoint * (e == 0 ? 0 : e * Math.pow(b, e - 1)), gradient);
            if (!exponent.isConstant())
                exponent.backward(point, adjoint * Math.pow(b, e) * Math.log(b), gradient);
        }

        @Override
        LinearForm linear(int dimension) {
            LinearForm b = base.linear(dimension), e = exponent.linear(dimension);
            if (b == null || e == null || !e.isConstant())
                return null;
            double k = e.getConstant();
            if (k == 0)
                return LinearForm.constant(dimension, 1);
            if (k == 1)
                return b;
            if (b.isConstant())
                return LinearForm.constant(dimension, Math.pow(b.getConstant(), k));
            return null;
        }

        @Override
        int precedence() {
            return 4;
        }

        @Override
        public String toString() {
            return render(base, true) + "**" + render(exponent, false);
        }
    }
}
