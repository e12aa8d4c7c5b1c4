package com.devicesim.core.effect;

import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ValueRef;

/**
 * @param target attribute to write
 * @param value  literal or parameter value to write
 */
public record SetAttributeEffect(
    AttributePath target,
    ValueRef value
) implements Effect {}
