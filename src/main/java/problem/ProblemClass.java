/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package problem;

import solver.BackendKind;

/**
 * The five supported problem classes. They share one model builder and differ only by the tags below: what the
 * variables are indexed by, which domain they get, where objective and constraint terms come from, and which backend
 * solves the resulting program.
 */
public enum ProblemClass {

    LP(IndexDomain.ELEMENTS, DomainRule.NON_NEGATIVE_CONTINUOUS, TermSource.PARAMETERS, BackendKind.LINEAR, 2),

    IP(IndexDomain.ELEMENTS, DomainRule.NON_NEGATIVE_INTEGER, TermSource.PARAMETERS, BackendKind.LINEAR, 2),

    NLP(IndexDomain.SCALARS, DomainRule.FREE_CONTINUOUS, TermSource.EXPRESSIONS, BackendKind.NONLINEAR, 4),

    MILP(IndexDomain.SCALARS, DomainRule.DECLARED_MIXED, TermSource.EXPRESSIONS, BackendKind.LINEAR, 4),

    MINLP(IndexDomain.SCALARS, DomainRule.DECLARED_MIXED, TermSource.EXPRESSIONS, BackendKind.NONLINEAR, 4);

    /**
     * What decision variables are declared over
     */
    public enum IndexDomain {
        /** one variable per element of the index set */
        ELEMENTS,
        /** free-standing named scalars */
        SCALARS;
    }

    /**
     * How the domain of each decision variable is chosen
     */
    public enum DomainRule {
        NON_NEGATIVE_CONTINUOUS, NON_NEGATIVE_INTEGER, FREE_CONTINUOUS, DECLARED_MIXED;
    }

    /**
     * Where objective and constraint terms come from
     */
    public enum TermSource {
        /** linear combinations of element-indexed parameters */
        PARAMETERS,
        /** free-form arithmetic expressions over the variables */
        EXPRESSIONS;
    }

    public final IndexDomain indexDomain;

    public final DomainRule domainRule;

    public final TermSource termSource;

    public final BackendKind backend;

    /**
     * number of decimals used when displaying values of this class
     */
    public final int displayDecimals;

    ProblemClass(IndexDomain indexDomain, DomainRule domainRule, TermSource termSource, BackendKind backend, int displayDecimals) {
        this.indexDomain = indexDomain;
        this.domainRule = domainRule;
        this.termSource = termSource;
        this.backend = backend;
        this.displayDecimals = displayDecimals;
    }

    /**
     * Returns true if every term of a program of this class must be linear.
     */
    public boolean requiresLinearTerms() {
        return backend == BackendKind.LINEAR;
    }

    /**
     * Returns the domain of a variable, given whether it was declared in the integer list.
     */
    public ModelVariable.Domain domainOf(boolean declaredInteger) {
        switch (domainRule) {
        case NON_NEGATIVE_INTEGER:
            return ModelVariable.Domain.INTEGER;
        case DECLARED_MIXED:
            return declaredInteger ? ModelVariable.Domain.INTEGER : ModelVariable.Domain.CONTINUOUS;
        default:
            return ModelVariable.Domain.CONTINUOUS;
        }
    }

    /**
     * Returns the lower bound every variable of this class gets.
     */
    public double lowerBound() {
        return domainRule == DomainRule.NON_NEGATIVE_CONTINUOUS || domainRule == DomainRule.NON_NEGATIVE_INTEGER ? 0 : Double.NEGATIVE_INFINITY;
    }
}
