/*
 * This file is part of the optimization modeler OptiModel.
 *
 * Copyright (c) 2021. All rights reserved.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package constraints;

import java.util.Arrays;

/**
 * The relational operators a constraint may use. Each one has the symbol the user picks and a canonical tag; the two
 * are in one-to-one correspondence.
 */
public enum RelationalOperator {

    LE("≤", "<="), GE("≥", ">="), EQ("=", "=="), LT("<", "<"), GT(">", ">"), NE("≠", "!=");

    private final String symbol;

    private final String tag;

    RelationalOperator(String symbol, String tag) {
        this.symbol = symbol;
        this.tag = tag;
    }

    /**
     * Returns the symbol shown to the user.
     */
    public String symbol() {
        return symbol;
    }

    /**
     * Returns the canonical comparison tag.
     */
    public String tag() {
        return tag;
    }

    public boolean isStrict() {
        return this == LT || this == GT;
    }

    /**
     * Returns the operator whose user symbol is the given one.
     *
     * @param symbol one of ≤ ≥ = &lt; &gt; ≠
     * @return the operator
     * @throws OperatorException if the symbol is not one of the six accepted ones
     */
    public static RelationalOperator canonicalize(String symbol) {
        if (symbol != null) {
            String s = symbol.strip();
            for (RelationalOperator op : values())
                if (op.symbol.equals(s))
                    return op;
        }
        throw new OperatorException(symbol);
    }

    /**
     * Returns the operator with the given canonical tag.
     *
     * @throws OperatorException if the tag is unknown
     */
    public static RelationalOperator ofTag(String tag) {
        return Arrays.stream(values()).filter(op -> op.tag.equals(tag)).findFirst().orElseThrow(() -> new OperatorException(tag));
    }

    /**
     * Returns true if lhs op rhs holds, up to the given tolerance for the non-strict relations.
     */
    public boolean holds(double lhs, double rhs, double tolerance) {
        switch (this) {
        case LE:
            return lhs <= rhs + tolerance;
        case GE:
            return lhs >= rhs - tolerance;
        case EQ:
            return Math.abs(lhs - rhs) <= tolerance;
        case LT:
            return lhs < rhs;
        case GT:
            return lhs > rhs;
        default:
            return lhs != rhs;
        }
    }
}
