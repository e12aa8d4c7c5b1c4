package com.devicesim.core.effect;

import com.devicesim.core.condition.Condition;

import java.util.List;

/**
 * Guarded effects; an else-if is a single nested {@code ConditionalEffect} in {@code elseEffects}.
 *
 * @param condition   guard, evaluated against the instance as mutated so far
 * @param thenEffects effects applied when the guard holds
 * @param elseEffects effects applied otherwise
 */
public record ConditionalEffect(
    Condition condition,
    List<Effect> thenEffects,
    List<Effect> elseEffects
) implements Effect {

    public ConditionalEffect {
        thenEffects = List.copyOf(thenEffects);
        elseEffects = elseEffects == null ? List.of() : List.copyOf(elseEffects);
    }

    /**
     * The nested conditional when the else branch is exactly one conditional, i.e. an else-if.
     */
    public ConditionalEffect elseIf() {
        if (elseEffects.size() == 1 && elseEffects.get(0) instanceof ConditionalEffect nested) {
            return nested;
        }
        return null;
    }
}
