/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package utility;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static helpers shared by the whole code base: the logger and invariant checks.
 */
public final class Kit {

    private Kit() {
    }

    /**
     * The logger used everywhere; its level is adjusted from the verbosity option.
     */
    public static final Logger log = Logger.getLogger("Logger OptiModel");

    /**
     * Adjusts the logger to the given verbosity (0 = warnings, 1 = config, 2 and more = fine).
     *
     * @param verbose the verbosity level
     */
    public static void setVerbosity(int verbose) {
        log.setLevel(verbose <= 0 ? Level.WARNING : verbose == 1 ? Level.CONFIG : Level.FINE);
    }

    /**
     * Throws an IllegalStateException with the supplied message if the condition does not hold.
     */
    public static void control(boolean condition, Supplier<String> message) {
        if (!condition)
            throw new IllegalStateException(message.get());
    }

    /**
     * Rounds half-up for display purposes. Non-finite values are returned unchanged.
     *
     * @param value the value to round
     * @param decimals the number of decimals to keep
     * @return the rounded value
     */
    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value))
            return value;
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
    }
}
