package com.devicesim.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Declared action parameter.
 *
 * @param name     parameter name
 * @param choices  allowed values, empty when unrestricted
 * @param required whether the parameter must be supplied
 */
public record ParameterSpec(
    String name,
    List<String> choices,
    boolean required
) implements Serializable {

    public ParameterSpec {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }
}
