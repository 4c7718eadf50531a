/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named table giving one numeric coefficient per element.
 */
public final class Parameter {

    private final String name;

    private final Map<String, Double> values;

    public Parameter(String name, Map<String, Double> values) {
        this.name = Objects.requireNonNull(name);
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the value for the given element.
     *
     * @throws IllegalArgumentException if the parameter has no value for the element
     */
    public double valueOf(String element) {
        Double v = values.get(element);
        if (v == null)
            throw new IllegalArgumentException("Parameter " + name + " has no value for " + element);
        return v;
    }

    public Map<String, Double> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return name + values;
    }
}
