package com.devicesim.core.snapshot;

import com.devicesim.core.model.OrderedDomain;

import java.io.Serializable;
import java.util.List;

/**
 * Value of one attribute in a snapshot: a single level (or {@code unknown}), or a value-set of
 * two or more levels the true value is known to lie in.
 */
public sealed interface SnapshotValue extends Serializable permits SnapshotValue.Single, SnapshotValue.ValueSet {

    static SnapshotValue single(String value) {
        return new Single(value);
    }

    static SnapshotValue unknown() {
        return new Single(OrderedDomain.UNKNOWN);
    }

    /**
     * A value-set, collapsed to {@link Single} when it holds exactly one level.
     *
     * @throws IllegalArgumentException for an empty set
     */
    static SnapshotValue of(List<String> values) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("A value-set must hold at least one value");
        }
        return values.size() == 1 ? new Single(values.get(0)) : new ValueSet(values);
    }

    /**
     * Levels the attribute may hold: the set itself, the whole domain for {@code unknown},
     * or the single level.
     */
    List<String> possibleValues(OrderedDomain domain);

    /** Whether branching must treat the value as undetermined. */
    boolean isUncertain();

    String render();

    /**
     * @param value a domain level or {@link OrderedDomain#UNKNOWN}
     */
    record Single(String value) implements SnapshotValue {

        public boolean isUnknown() {
            return OrderedDomain.UNKNOWN.equals(value);
        }

        @Override
        public List<String> possibleValues(OrderedDomain domain) {
            return isUnknown() ? domain.levels() : List.of(value);
        }

        @Override
        public boolean isUncertain() {
            return isUnknown();
        }

        @Override
        public String render() {
            return value;
        }
    }

    /**
     * @param values two or more levels, in domain order
     */
    record ValueSet(List<String> values) implements SnapshotValue {

        public ValueSet {
            if (values.size() < 2) {
                throw new IllegalArgumentException("A value-set holds two or more values, got " + values);
            }
            values = List.copyOf(values);
        }

        @Override
        public List<String> possibleValues(OrderedDomain domain) {
            return values;
        }

        @Override
        public boolean isUncertain() {
            return true;
        }

        @Override
        public String render() {
            return "{" + String.join(", ", values) + "}";
        }
    }
}
