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

import expressions.Term;

/**
 * The single objective of a program.
 */
public final class Objective {

    private final Sense sense;

    private final Term term;

    public Objective(Sense sense, Term term) {
        this.sense = Objects.requireNonNull(sense);
        this.term = Objects.requireNonNull(term);
    }

    public Sense getSense() {
        return sense;
    }

    public Term getTerm() {
        return term;
    }

    @Override
    public String toString() {
        return sense.name().toLowerCase() + " " + term;
    }
}
