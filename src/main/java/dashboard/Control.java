/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package dashboard;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * The options controlling model building and solving. Options are grouped by concern, and read as
 * {@code control.nonlinear.feasibilityTolerance}. Defaults come from the classpath resource {@value #RESOURCE}.
 */
public final class Control {

    /**
     * The classpath resource holding the default options
     */
    public static final String RESOURCE = "/optimodel.properties";

    /**
     * The prefix of JVM system properties overriding options
     */
    public static final String SYSTEM_PREFIX = "optimodel.";

    /**
     * Returns the options read from the default resource, then overridden by system properties.
     */
    public static Control load() {
        Properties properties = new Properties();
        try (InputStream in = Control.class.getResourceAsStream(RESOURCE)) {
            if (in != null)
                properties.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + RESOURCE, e);
        }
        System.getProperties().stringPropertyNames().stream().filter(key -> key.startsWith(SYSTEM_PREFIX))
                .forEach(key -> properties.setProperty(key.substring(SYSTEM_PREFIX.length()), System.getProperty(key)));
        return new Control(properties);
    }

    /**
     * Returns the options built from the given properties; missing keys take their built-in default.
     */
    public static Control of(Properties properties) {
        return new Control(properties);
    }

    /**
     * Returns the built-in defaults, ignoring resources and system properties.
     */
    public static Control defaults() {
        return new Control(new Properties());
    }

    public final OptionsGeneral general;

    public final OptionsSolver solver;

    public final OptionsRelations relations;

    public final OptionsNonlinear nonlinear;

    private Control(Properties properties) {
        Reader reader = new Reader(properties);
        this.general = new OptionsGeneral(reader);
        this.solver = new OptionsSolver(reader);
        this.relations = new OptionsRelations(reader);
        this.nonlinear = new OptionsNonlinear(reader);
    }

    public static final class OptionsGeneral {

        /**
         * 0 = warnings only, 1 = model statistics, 2 = backend details
         */
        public final int verbose;

        private OptionsGeneral(Reader reader) {
            this.verbose = reader.intValue("general.verbose", 0, 0);
        }
    }

    public static final class OptionsSolver {

        /**
         * the name of the backend used for LP, IP and MILP
         */
        public final String linear;

        /**
         * the name of the backend used for NLP and MINLP
         */
        public final String nonlinear;

        /**
         * wall-clock limit of one solve, in milliseconds; 0 means no limit
         */
        public final long timeoutMillis;

        private OptionsSolver(Reader reader) {
            this.linear = reader.stringValue("solver.linear", "ojalgo");
            this.nonlinear = reader.stringValue("solver.nonlinear", "augmented-lagrangian");
            this.timeoutMillis = reader.longValue("solver.timeoutMillis", 0L);
        }
    }

    public static final class OptionsRelations {

        /**
         * the shift applied to the right-hand side when a strict relation is tightened into a non-strict one
         */
        public final double strictTolerance;

        /**
         * the maximal number of programs enumerated when expanding != relations
         */
        public final int maxDisjunctionBranches;

        private OptionsRelations(Reader reader) {
            this.strictTolerance = reader.positiveDouble("relations.strictTolerance", 1e-6);
            this.maxDisjunctionBranches = reader.intValue("relations.maxDisjunctionBranches", 64, 1);
        }
    }

    public static final class OptionsNonlinear {

        public final double initialValue;

        public final double feasibilityTolerance;

        /**
         * relative change of the objective between outer iterations under which a feasible point is accepted
         */
        public final double optimalityTolerance;

        public final int maxOuterIterations;

        public final int maxInnerEvaluations;

        public final double initialPenalty;

        public final double penaltyGrowth;

        public final double maxPenalty;

        /**
         * objective values below minus this threshold at a feasible point are taken as a sign of unboundedness
         */
        public final double unboundedThreshold;

        public final double integralityTolerance;

        /**
         * the maximal number of branch-and-bound nodes explored for integer variables
         */
        public final int maxNodes;

        private OptionsNonlinear(Reader reader) {
            this.initialValue = reader.doubleValue("nonlinear.initialValue", 1.0);
            this.feasibilityTolerance = reader.positiveDouble("nonlinear.feasibilityTolerance", 1e-6);
            this.optimalityTolerance = reader.positiveDouble("nonlinear.optimalityTolerance", 1e-7);
            this.maxOuterIterations = reader.intValue("nonlinear.maxOuterIterations", 60, 1);
            this.maxInnerEvaluations = reader.intValue("nonlinear.maxInnerEvaluations", 20000, 10);
            this.initialPenalty = reader.positiveDouble("nonlinear.initialPenalty", 10.0);
            this.penaltyGrowth = reader.positiveDouble("nonlinear.penaltyGrowth", 10.0);
            this.maxPenalty = reader.positiveDouble("nonlinear.maxPenalty", 1e9);
            this.unboundedThreshold = reader.positiveDouble("nonlinear.unboundedThreshold", 1e15);
            this.integralityTolerance = reader.positiveDouble("nonlinear.integralityTolerance", 1e-5);
            this.maxNodes = reader.intValue("nonlinear.maxNodes", 10000, 1);
            if (penaltyGrowth <= 1)
                throw new IllegalArgumentException("nonlinear.penaltyGrowth must be greater than 1: " + penaltyGrowth);
        }
    }

    /**
     * Typed access to the raw properties; every failure names the offending key.
     */
    private static final class Reader {

        private final Properties properties;

        private Reader(Properties properties) {
            this.properties = properties;
        }

        private String raw(String key) {
            String value = properties.getProperty(key);
            return value == null ? null : value.trim();
        }

        String stringValue(String key, String defaultValue) {
            String value = raw(key);
            return value == null || value.isEmpty() ? defaultValue : value;
        }

        int intValue(String key, int defaultValue, int min) {
            String value = raw(key);
            if (value == null || value.isEmpty())
                return defaultValue;
            try {
                int v = Integer.parseInt(value);
                if (v < min)
                    throw new IllegalArgumentException(key + " must be at least " + min + ": " + value);
                return v;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + value, e);
            }
        }

        long longValue(String key, long defaultValue) {
            String value = raw(key);
            if (value == null || value.isEmpty())
                return defaultValue;
            try {
                long v = Long.parseLong(value);
                if (v < 0)
                    throw new IllegalArgumentException(key + " must be non-negative: " + value);
                return v;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not an integer: " + value, e);
            }
        }

        double doubleValue(String key, double defaultValue) {
            String value = raw(key);
            if (value == null || value.isEmpty())
                return defaultValue;
            try {
                double v = Double.parseDouble(value);
                if (Double.isNaN(v) || Double.isInfinite(v))
                    throw new IllegalArgumentException(key + " must be finite: " + value);
                return v;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " is not a number: " + value, e);
            }
        }

        double positiveDouble(String key, double defaultValue) {
            double v = doubleValue(key, defaultValue);
            if (v <= 0)
                throw new IllegalArgumentException(key + " must be positive: " + v);
            return v;
        }
    }
}
