/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import constraints.ConstraintNormalizer;
import constraints.NormalizedConstraint;
import constraints.ParameterValidator;
import dashboard.Diagnostics;
import expressions.Term;
import optimization.terms.BuildContext;
import optimization.terms.ExpressionTermBuilder;
import optimization.terms.ParameterTermBuilder;
import optimization.terms.TermBuilder;
import problem.DuplicateIdentifierException;
import problem.IdentifierListParser;
import problem.ModelConstraint;
import problem.ModelVariable;
import problem.ModelingException;
import problem.Objective;
import problem.Parameter;
import problem.ProblemClass;
import problem.Program;
import problem.SolveRequest;
import utility.Kit;

/**
 * Assembles a program from a solve request. Declarations and parameters are checked first; malformed constraint rows
 * are reported and skipped, while a failure on declarations, parameters, the objective or a constraint term stops the
 * construction.
 */
public final class ModelBuilder {

    /**
     * Registry of term builders.
     */
    private static final List<TermBuilder> TERM_BUILDERS = List.of(new ParameterTermBuilder(), new ExpressionTermBuilder());

    private ModelBuilder() {
    }

    /**
     * Builds the program described by the request.
     *
     * @param request the user input
     * @param diagnostics where every problem found is reported
     * @return the program, or null if a problem prevents its construction
     */
    public static Program build(SolveRequest request, Diagnostics diagnostics) {
        ProblemClass pc = request.getProblemClass();
        try {
            return pc.indexDomain == ProblemClass.IndexDomain.ELEMENTS ? buildOverElements(request, diagnostics) : buildOverScalars(request, diagnostics);
        } catch (ModelingException e) {
            diagnostics.report(e, 0);
            return null;
        }
    }

    private static Program buildOverElements(SolveRequest request, Diagnostics diagnostics) {
        ProblemClass pc = request.getProblemClass();
        List<String> elements = IdentifierListParser.parse(request.getElements(), diagnostics, "elements");
        checkDistinct(elements, "element");
        List<String> parameterNames = request.getParameterNames() != null ? IdentifierListParser.parse(request.getParameterNames(), diagnostics, "parameters")
                : new ArrayList<>(request.getParameters().keySet());
        checkDistinct(parameterNames, "parameter");

        List<NormalizedConstraint> rows = ConstraintNormalizer.normalizeLinear(request.getLinearRows(), parameterNames, diagnostics);
        if (!ParameterValidator.validate(parameterNames, request.getParameters(), elements, diagnostics))
            return null;

        Map<String, Parameter> parameters = new LinkedHashMap<>();
        for (String name : parameterNames)
            parameters.put(name, new Parameter(name, request.getParameters().get(name)));
        List<ModelVariable> variables = new ArrayList<>();
        for (String element : elements)
            variables.add(new ModelVariable(element, variables.size(), pc.domainOf(false), pc.lowerBound(), Double.POSITIVE_INFINITY));
        return assemble(request, elements, parameters, variables, rows, diagnostics);
    }

    private static Program buildOverScalars(SolveRequest request, Diagnostics diagnostics) {
        ProblemClass pc = request.getProblemClass();
        List<String> integers = IdentifierListParser.parse(request.getIntegerVariables(), diagnostics, "integer variables");
        List<String> continuous = IdentifierListParser.parse(request.getContinuousVariables(), diagnostics, "continuous variables");
        List<String> all = new ArrayList<>(integers);
        all.addAll(continuous);
        checkDistinct(all, "variable");

        List<NormalizedConstraint> rows = ConstraintNormalizer.normalizeExpressions(request.getExpressionRows(), diagnostics);
        List<ModelVariable> variables = new ArrayList<>();
        for (String name : integers)
            variables.add(new ModelVariable(name, variables.size(), pc.domainOf(true), pc.lowerBound(), Double.POSITIVE_INFINITY));
        for (String name : continuous)
            variables.add(new ModelVariable(name, variables.size(), pc.domainOf(false), pc.lowerBound(), Double.POSITIVE_INFINITY));
        return assemble(request, List.of(), Map.of(), variables, rows, diagnostics);
    }

    private static Program assemble(SolveRequest request, List<String> elements, Map<String, Parameter> parameters, List<ModelVariable> variables,
            List<NormalizedConstraint> rows, Diagnostics diagnostics) {
        ProblemClass pc = request.getProblemClass();
        BuildContext ctx = new BuildContext(pc, variables, parameters);
        TermBuilder builder = TERM_BUILDERS.stream().filter(b -> b.canBuild(pc.termSource)).findFirst()
                .orElseThrow(() -> new IllegalStateException("No term builder for " + pc.termSource));
        Objective objective = new Objective(request.getSense(), builder.build(request.getObjective(), ctx));
        List<ModelConstraint> constraints = new ArrayList<>();
        for (NormalizedConstraint row : rows) {
            Term term;
            try {
                term = builder.build(row.source, ctx);
            } catch (ModelingException e) {
                diagnostics.report(e, row.row);
                return null;
            }
            constraints.add(new ModelConstraint(row.row, term, row.operator, row.rhs));
        }
        Kit.log.config(pc + " model: " + variables.size() + " variables, " + constraints.size() + " constraints");
        return new Program(pc, elements, parameters, variables, objective, constraints);
    }

    private static void checkDistinct(List<String> names, String what) {
        Set<String> seen = new HashSet<>();
        for (String name : names)
            if (!seen.add(name))
                throw new DuplicateIdentifierException(name, "The " + what + " name '" + name + "' is declared more than once");
    }
}
