/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.terms;

import expressions.ExpressionEvaluator;
import expressions.Term;
import problem.ProblemClass;

/**
 * Builder for terms given by an arithmetic expression over the declared variables. In linear contexts, the expression
 * must be affine.
 */
public class ExpressionTermBuilder implements TermBuilder {

    @Override
    public boolean canBuild(ProblemClass.TermSource source) {
        return source == ProblemClass.TermSource.EXPRESSIONS;
    }

    @Override
    public Term build(String reference, BuildContext ctx) {
        Term term = ExpressionEvaluator.evaluate(reference, ctx.getBinding());
        if (ctx.requiresLinearTerms())
            term.linearForm(); // throws if not affine
        return term;
    }
}
