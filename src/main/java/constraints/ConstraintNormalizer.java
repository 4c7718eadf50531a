/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

import dashboard.Diagnostics;
import problem.ExpressionConstraintRow;
import problem.LinearConstraintRow;
import problem.ModelingException;
import problem.UnknownParameterException;
import problem.ValueCoercionException;

/**
 * Validates constraint rows one by one. A malformed row (unknown parameter, unknown operator, value that is not a
 * finite number) is reported with its 1-based index and skipped; the other rows are still processed.
 */
public final class ConstraintNormalizer {

    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern NON_FINITE = Pattern.compile("[+-]?(inf|infinity|nan)");

    private ConstraintNormalizer() {
    }

    /**
     * Normalizes rows of the form (parameter, operator symbol, value text).
     *
     * @param rows the rows, in input order
     * @param parameterNames the declared parameter names
     * @param diagnostics where skipped rows are reported
     * @return the valid rows, in input order
     */
    public static List<NormalizedConstraint> normalizeLinear(List<LinearConstraintRow> rows, Collection<String> parameterNames, Diagnostics diagnostics) {
        List<NormalizedConstraint> list = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            LinearConstraintRow row = rows.get(i);
            try {
                if (row.getParameter() == null || !parameterNames.contains(row.getParameter()))
                    throw new UnknownParameterException(row.getParameter(), "Parameter '" + row.getParameter() + "' is not recognized");
                RelationalOperator op = RelationalOperator.canonicalize(row.getOperator());
                list.add(new NormalizedConstraint(i + 1, row.getParameter(), op, coerce(row.getValue())));
            } catch (ModelingException e) {
                diagnostics.report(e, i + 1);
            }
        }
        return list;
    }

    /**
     * Normalizes rows of the form (expression, operator symbol, value). The expression itself is checked when its
     * term is built.
     *
     * @param rows the rows, in input order
     * @param diagnostics where skipped rows are reported
     * @return the valid rows, in input order
     */
    public static List<NormalizedConstraint> normalizeExpressions(List<ExpressionConstraintRow> rows, Diagnostics diagnostics) {
        List<NormalizedConstraint> list = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            ExpressionConstraintRow row = rows.get(i);
            try {
                RelationalOperator op = RelationalOperator.canonicalize(row.getOperator());
                double value = row.getValue();
                if (Double.isNaN(value) || Double.isInfinite(value))
                    throw new ValueCoercionException(String.valueOf(value), "Value '" + value + "' is not a finite number");
                list.add(new NormalizedConstraint(i + 1, row.getExpression() == null ? "" : row.getExpression(), op, value));
            } catch (ModelingException e) {
                diagnostics.report(e, i + 1);
            }
        }
        return list;
    }

    /**
     * Reads a right-hand side typed by the user: surrounding whitespace is ignored, decimal and scientific notations
     * are accepted.
     *
     * @param text the value text
     * @return the value
     * @throws ValueCoercionException if the text is not a number, or is an infinite or NaN value
     */
    public static double coerce(String text) {
        if (text == null)
            throw new ValueCoercionException(null, "Value is missing");
        String s = text.strip();
        if (NON_FINITE.matcher(s.toLowerCase(Locale.ROOT)).matches())
            throw new ValueCoercionException(text, "Value '" + text + "' is not a finite number");
        if (!DECIMAL.matcher(s).matches())
            throw new ValueCoercionException(text, "Value '" + text + "' is not numeric");
        try {
            double v = Double.parseDouble(s);
            if (Double.isInfinite(v))
                throw new ValueCoercionException(text, "Value '" + text + "' is out of range");
            return v;
        } catch (NumberFormatException e) {
            throw new ValueCoercionException(text, "Value '" + text + "' is not numeric", e);
        }
    }
}
