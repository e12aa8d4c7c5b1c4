package com.devicesim.core.condition;

/**
 * True when the named action parameter was supplied with the given value.
 *
 * @param parameter parameter name
 * @param value     expected value
 */
public record ParameterEqualsCondition(
    String parameter,
    String value
) implements Condition {}
