/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.terms;

import expressions.Term;
import problem.ProblemClass;

/**
 * Interface for builders that turn the textual reference of an objective or a constraint into a term over the
 * decision variables. Each implementation handles one source of terms.
 */
public interface TermBuilder {

    /**
     * Check if this builder handles the terms of the given source.
     *
     * @param source where terms come from
     * @return true if this builder can build such terms
     */
    boolean canBuild(ProblemClass.TermSource source);

    /**
     * Build the term referenced by the given text. Called only after canBuild() returns true.
     *
     * @param reference a parameter name or an expression
     * @param ctx the build context providing access to variables and parameters
     * @return the term
     * @throws problem.ModelingException if the reference cannot be turned into a term
     */
    Term build(String reference, BuildContext ctx);
}
