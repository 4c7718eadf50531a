/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.Locale;

/**
 * The optimization direction of an objective.
 */
public enum Sense {

    MAXIMIZE, MINIMIZE;

    /**
     * Returns the sense named by the given label, ignoring case ("maximize", "MINIMIZE", ...).
     *
     * @throws IllegalArgumentException if the label is unknown
     */
    public static Sense of(String label) {
        try {
            return valueOf(label.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IllegalArgumentException("Unknown objective sense: " + label, e);
        }
    }

    /**
     * Returns true if value a is strictly better than value b for this sense.
     */
    public boolean isBetter(double a, double b) {
        return this == MAXIMIZE ? a > b : a < b;
    }
}
