package com.devicesim.core.condition;

import java.util.List;

/**
 * Conjunction; true when every operand holds.
 *
 * @param operands ordered sub-conditions
 */
public record AndCondition(List<Condition> operands) implements Condition {

    public AndCondition {
        operands = List.copyOf(operands);
    }
}
