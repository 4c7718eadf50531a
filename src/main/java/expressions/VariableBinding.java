/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package expressions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The names an expression may refer to, each bound to the position of its decision variable. Expressions are
 * resolved against this binding only: a name absent from it is an error, never a lookup elsewhere.
 */
public final class VariableBinding {

    private final Map<String, Integer> positions;

    private VariableBinding(Map<String, Integer> positions) {
        this.positions = Collections.unmodifiableMap(positions);
    }

    /**
     * Binds the given names to their positions in the list.
     *
     * @throws IllegalArgumentException if a name appears twice
     */
    public static VariableBinding of(List<String> names) {
        Map<String, Integer> m = new LinkedHashMap<>();
        for (String name : names)
            if (m.putIfAbsent(name, m.size()) != null)
                throw new IllegalArgumentException("Name bound twice: " + name);
        return new VariableBinding(m);
    }

    /**
     * Returns the position bound to the name, or -1 if the name is not bound.
     */
    public int positionOf(String name) {
        Integer p = positions.get(name);
        return p == null ? -1 : p;
    }

    public boolean isBound(String name) {
        return positions.containsKey(name);
    }

    public int size() {
        return positions.size();
    }

    public List<String> names() {
        return List.copyOf(positions.keySet());
    }
}
