package com.devicesim.core.condition;

/**
 * {@code if antecedent then consequent}, equivalent to {@code not antecedent or consequent}.
 *
 * @param antecedent the "if" side
 * @param consequent the "then" side
 */
public record ImplicationCondition(
    Condition antecedent,
    Condition consequent
) implements Condition {}
