package com.devicesim.core.condition;

import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ComparisonOperator;
import com.devicesim.core.model.ValueRef;

/**
 * Compares one attribute against a literal or parameter value.
 *
 * @param target   attribute being tested
 * @param operator comparison to apply
 * @param value    right-hand operand
 */
public record AttributeCondition(
    AttributePath target,
    ComparisonOperator operator,
    ValueRef value
) implements Condition {}
