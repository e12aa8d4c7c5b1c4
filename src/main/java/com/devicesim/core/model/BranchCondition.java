package com.devicesim.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Why a node exists: the predicate that separates it from its siblings.
 * <p>
 * A simple condition names one attribute and the value (or value-set) it was narrowed to.
 * A compound condition combines sub-conditions with {@link Combinator#AND} or
 * {@link Combinator#OR}; alternatives of a failing precondition are materialized as sibling
 * nodes, so a fail branch is never an {@code OR}.
 *
 * @param attribute     attribute path for a simple condition, {@code null} for a compound one
 * @param operator      {@link ComparisonOperator#EQUALS} for one value, {@link ComparisonOperator#IN} for several
 * @param values        the value or value-set the attribute is restricted to
 * @param source        precondition or postcondition
 * @param kind          role among siblings
 * @param combinator    combinator of a compound condition, {@code null} for a simple one
 * @param subConditions ordered sub-conditions of a compound condition
 */
public record BranchCondition(
    String attribute,
    ComparisonOperator operator,
    List<String> values,
    BranchSource source,
    BranchKind kind,
    Combinator combinator,
    List<BranchCondition> subConditions
) implements Serializable {

    /** Boolean combinator of a compound branch condition. */
    public enum Combinator {
        AND,
        OR;

        public String wireName() {
            return name().toLowerCase();
        }

        public static Combinator fromWireName(String value) {
            return valueOf(value.toUpperCase());
        }
    }

    public BranchCondition {
        values = values == null ? List.of() : List.copyOf(values);
        subConditions = subConditions == null ? List.of() : List.copyOf(subConditions);
    }

    public static BranchCondition simple(String attribute, List<String> values, BranchSource source, BranchKind kind) {
        var operator = values.size() > 1 ? ComparisonOperator.IN : ComparisonOperator.EQUALS;
        return new BranchCondition(attribute, operator, values, source, kind, null, List.of());
    }

    /**
     * Combines sub-conditions. A single sub-condition is returned as is.
     */
    public static BranchCondition compound(Combinator combinator, List<BranchCondition> subConditions,
                                           BranchSource source, BranchKind kind) {
        if (subConditions.isEmpty()) {
            throw new IllegalArgumentException("Compound branch condition needs at least one sub-condition");
        }
        if (subConditions.size() == 1) {
            return subConditions.get(0);
        }
        return new BranchCondition(null, null, List.of(), source, kind, combinator, subConditions);
    }

    public boolean isCompound() {
        return combinator != null;
    }

    /**
     * Every attribute path this condition constrains, depth first.
     */
    public List<String> attributes() {
        if (!isCompound()) {
            return List.of(attribute);
        }
        return subConditions.stream()
                .flatMap(sub -> sub.attributes().stream())
                .distinct()
                .toList();
    }

    public String describe() {
        if (isCompound()) {
            return subConditions.stream()
                    .map(BranchCondition::describe)
                    .collect(Collectors.joining(" " + combinator.name() + " ", "(", ")"));
        }
        if (values.size() == 1) {
            return attribute + " " + operator.symbol() + " " + values.get(0);
        }
        return attribute + " " + operator.symbol() + " {" + String.join(", ", values) + "}";
    }
}
