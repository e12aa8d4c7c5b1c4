package com.devicesim.core.condition;

/**
 * @param operand the negated condition
 */
public record NotCondition(Condition operand) implements Condition {}
