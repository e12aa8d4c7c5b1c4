package com.devicesim.core.condition;

import java.io.Serializable;

/**
 * Boolean predicate over device attributes and action parameters.
 * <p>
 * The hierarchy is closed; every consumer handles each variant explicitly and fails loudly
 * on anything else.
 */
public sealed interface Condition extends Serializable
        permits AttributeCondition, AndCondition, OrCondition, NotCondition,
                ImplicationCondition, ParameterEqualsCondition, ParameterValidCondition {
}
