package com.devicesim.core.model;

import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ConditionDescriber;

import java.io.Serializable;
import java.util.List;

/**
 * {@code if condition then requires}. Checked after every transition; a violation is reported
 * but does not prevent the state from being materialized.
 *
 * @param condition when this holds...
 * @param requires  ...this must hold as well
 * @param resets    side effects applied when a narrowed snapshot is repaired
 */
public record DependencyConstraint(
    Condition condition,
    Condition requires,
    List<ConstraintReset> resets
) implements Serializable {

    public DependencyConstraint {
        resets = resets == null ? List.of() : List.copyOf(resets);
    }

    /**
     * Whether both sides are single attribute comparisons, the only shape snapshot repair handles.
     */
    public boolean isRepairable() {
        return condition instanceof AttributeCondition && requires instanceof AttributeCondition;
    }

    public String describe() {
        return "If " + ConditionDescriber.describe(condition) + " then " + ConditionDescriber.describe(requires);
    }
}
