package com.devicesim.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * A named bundle of attributes a device must expose for generic actions to apply to it.
 *
 * @param name       capability name
 * @param attributes required attribute path to the domain id it must use
 */
public record CapabilitySpec(
    String name,
    Map<AttributePath, String> attributes
) implements Serializable {

    public CapabilitySpec {
        attributes = Map.copyOf(attributes);
    }
}
