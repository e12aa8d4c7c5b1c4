package com.devicesim.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Operators an attribute condition can apply. Ordered operators use the domain's level order;
 * the others use set membership.
 */
public enum ComparisonOperator {
    EQUALS("equals", "=="),
    NOT_EQUALS("not_equals", "!="),
    LT("lt", "<"),
    LTE("lte", "<="),
    GT("gt", ">"),
    GTE("gte", ">="),
    IN("in", "in"),
    NOT_IN("not_in", "not in");

    private final String wireName;
    private final String symbol;

    ComparisonOperator(String wireName, String symbol) {
        this.wireName = wireName;
        this.symbol = symbol;
    }

    public String wireName() {
        return wireName;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isOrdered() {
        return this == LT || this == LTE || this == GT || this == GTE;
    }

    /**
     * Tests a concrete level against the operand. {@code operand} holds one value for the
     * scalar operators and any number for {@code in}/{@code not_in}.
     */
    public boolean test(OrderedDomain domain, String actual, List<String> operand) {
        if (operand.isEmpty()) {
            return this == NOT_IN;
        }
        String expected = operand.get(0);
        return switch (this) {
            case EQUALS -> actual.equals(expected);
            case NOT_EQUALS -> !actual.equals(expected);
            case LT -> domain.compare(actual, expected) < 0;
            case LTE -> domain.compare(actual, expected) <= 0;
            case GT -> domain.compare(actual, expected) > 0;
            case GTE -> domain.compare(actual, expected) >= 0;
            case IN -> operand.contains(actual);
            case NOT_IN -> !operand.contains(actual);
        };
    }

    /**
     * The subset of {@code candidates} for which this operator holds, in candidate order.
     */
    public List<String> filter(OrderedDomain domain, List<String> candidates, List<String> operand) {
        var result = new ArrayList<String>();
        for (String candidate : candidates) {
            if (test(domain, candidate, operand)) {
                result.add(candidate);
            }
        }
        return result;
    }

    public static ComparisonOperator fromWireName(String value) {
        for (ComparisonOperator op : values()) {
            if (op.wireName.equals(value) || op.symbol.equals(value)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown comparison operator: " + value);
    }
}
