package com.devicesim.core.model;

import com.devicesim.core.condition.Condition;
import com.devicesim.core.effect.Effect;

import java.io.Serializable;
import java.util.List;

/**
 * Device-specific additions to an action: extra preconditions and effects appended to the
 * base action's own.
 *
 * @param actionName    action this behavior extends or defines
 * @param preconditions additional preconditions
 * @param effects       additional effects
 */
public record DeviceBehavior(
    String actionName,
    List<Condition> preconditions,
    List<Effect> effects
) implements Serializable {

    public DeviceBehavior {
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }
}
