package com.devicesim.core.model;

import java.io.Serializable;

/**
 * Immutable declaration of an attribute, shared by every instance of the device type.
 *
 * @param name         attribute name
 * @param domainId     id of the {@link OrderedDomain} the value is drawn from
 * @param mutable      whether effects may write the attribute
 * @param defaultValue initial value, a domain level or {@link OrderedDomain#UNKNOWN}
 */
public record AttributeSpec(
    String name,
    String domainId,
    boolean mutable,
    String defaultValue
) implements Serializable {}
