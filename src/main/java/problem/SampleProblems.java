/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ready-made requests, one per problem class, usable as examples and as smoke tests.
 */
public final class SampleProblems {

    private SampleProblems() {
    }

    private static Map<String, Double> values(String[] elements, double... values) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < elements.length; i++)
            m.put(elements[i], values[i]);
        return m;
    }

    /**
     * Furniture production: maximize profit under labor, finishing and carpentry hours. Optimum 280.
     */
    public static SolveRequest furniture() {
        String[] products = { "Desk", "Table", "Chairs" };
        return SolveRequest.builder(ProblemClass.LP).elements("Desk, Table, Chairs") //
                .parameter("L", values(products, 8, 6, 1)) //
                .parameter("F", values(products, 4, 2, 1.5)) //
                .parameter("C", values(products, 2, 1.5, 0.5)) //
                .parameter("P", values(products, 60, 30, 20)) //
                .maximize("P") //
                .constraint("L", "≤", "48") //
                .constraint("F", "≤", "20") //
                .constraint("C", "≤", "8") //
                .build();
    }

    /**
     * Two kinds of boxes: maximize profit under an assembly time limit. Optimum 80.
     */
    public static SolveRequest boxes() {
        String[] boxes = { "Caja1", "Caja2" };
        return SolveRequest.builder(ProblemClass.IP).elements("Caja1, Caja2") //
                .parameter("Ganancia", values(boxes, 20, 30)) //
                .parameter("Tiempo", values(boxes, 4, 6)) //
                .maximize("Ganancia") //
                .constraint("Tiempo", "≤", "16") //
                .constraint("Ganancia", "≥", "40") //
                .build();
    }

    /**
     * Concave production profit under a quadratic resource constraint.
     */
    public static SolveRequest quadraticProfit() {
        return SolveRequest.builder(ProblemClass.NLP).continuousVariables("x1, x2") //
                .maximize("80*x1 + 120*x2 - 3*x1**2 - 2*x2**2 - 0.8*x1*x2") //
                .constraint("x1**2 + 1.5*x2**2", "≤", 500) //
                .build();
    }

    /**
     * A mixed program whose bounds contradict each other: x + y &lt;= 10 while x &gt;= 20.
     */
    public static SolveRequest infeasibleMixed() {
        return SolveRequest.builder(ProblemClass.MILP).integerVariables("x").continuousVariables("y, z") //
                .minimize("x + 2*y + 3*z") //
                .constraint("x + y", "≤", 10) //
                .constraint("y + z", "≥", 5) //
                .constraint("x", "≥", 20) //
                .constraint("y", "≥", 11) //
                .constraint("z", "≤", 100) //
                .build();
    }

    /**
     * A mixed-integer program with quadratic objective and constraints.
     */
    public static SolveRequest mixedQuadratic() {
        return SolveRequest.builder(ProblemClass.MINLP).integerVariables("x").continuousVariables("y, z") //
                .minimize("x**2 + 2*y**2 + 3*z + x*y") //
                .constraint("x + y + z", "≤", 10) //
                .constraint("x**2 + y", "≥", 2) //
                .constraint("y + z**2", "≤", 8) //
                .constraint("x", "≥", 0) //
                .constraint("y", "≥", 0) //
                .build();
    }
}
