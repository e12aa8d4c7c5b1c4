package com.devicesim.core.condition;

import java.util.List;

/**
 * Disjunction; true when any operand holds.
 *
 * @param operands ordered sub-conditions
 */
public record OrCondition(List<Condition> operands) implements Condition {

    public OrCondition {
        operands = List.copyOf(operands);
    }
}
