package com.devicesim.core.condition;

import java.util.List;

/**
 * True when the named action parameter was supplied with one of the valid values.
 *
 * @param parameter   parameter name
 * @param validValues accepted values
 */
public record ParameterValidCondition(
    String parameter,
    List<String> validValues
) implements Condition {

    public ParameterValidCondition {
        validValues = List.copyOf(validValues);
    }
}
