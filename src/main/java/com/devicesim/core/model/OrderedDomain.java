package com.devicesim.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * An ordered, finite set of named levels, e.g. {@code empty < low < medium < high < full}.
 * Order is fixed at construction and drives lt/lte/gt/gte comparison and trend expansion.
 *
 * @param id     domain identifier referenced by attribute specs
 * @param levels ordered, unique, non-empty level names
 */
public record OrderedDomain(
    String id,
    List<String> levels
) implements Serializable {

    /** Sentinel for an attribute whose value has not been observed. Never a level. */
    public static final String UNKNOWN = "unknown";

    public OrderedDomain {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Domain id must not be blank");
        }
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("Domain '" + id + "' must declare at least one level");
        }
        var unique = new LinkedHashSet<String>();
        for (String level : levels) {
            if (level == null || level.isBlank()) {
                throw new IllegalArgumentException("Domain '" + id + "' contains a blank level");
            }
            if (UNKNOWN.equals(level)) {
                throw new IllegalArgumentException("Domain '" + id + "' may not use reserved level '" + UNKNOWN + "'");
            }
            if (!unique.add(level)) {
                throw new IllegalArgumentException("Domain '" + id + "' has duplicate level '" + level + "'");
            }
        }
        levels = List.copyOf(levels);
    }

    public boolean contains(String value) {
        return levels.contains(value);
    }

    public int indexOf(String value) {
        int idx = levels.indexOf(value);
        if (idx < 0) {
            throw new IllegalArgumentException("Value '" + value + "' is not in domain '" + id + "' " + levels);
        }
        return idx;
    }

    public int compare(String a, String b) {
        return Integer.compare(indexOf(a), indexOf(b));
    }

    public int size() {
        return levels.size();
    }

    /**
     * Levels reachable from {@code value} when moving in the given direction, inclusive.
     * {@link Trend#NONE} yields the value itself.
     */
    public List<String> levelsFrom(String value, Trend trend) {
        int idx = indexOf(value);
        return switch (trend) {
            case DOWN -> List.copyOf(levels.subList(0, idx + 1));
            case UP -> List.copyOf(levels.subList(idx, levels.size()));
            case NONE -> List.of(value);
        };
    }

    /**
     * Every level for which {@code operator} holds against {@code operand}, in domain order.
     */
    public List<String> valuesSatisfying(ComparisonOperator operator, List<String> operand) {
        return operator.filter(this, levels, operand);
    }

    /**
     * Re-orders {@code values} into domain order, dropping anything that is not a level.
     */
    public List<String> ordered(Iterable<String> values) {
        var wanted = new LinkedHashSet<String>();
        values.forEach(wanted::add);
        var result = new ArrayList<String>();
        for (String level : levels) {
            if (wanted.contains(level)) {
                result.add(level);
            }
        }
        return result;
    }

    /**
     * Levels of this domain that are not in {@code values}, in domain order.
     */
    public List<String> complement(List<String> values) {
        var result = new ArrayList<String>();
        for (String level : levels) {
            if (!values.contains(level)) {
                result.add(level);
            }
        }
        return result;
    }
}
