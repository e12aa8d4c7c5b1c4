package com.devicesim.core.model;

import java.io.Serializable;

/**
 * Side effect applied when a dependency constraint is repaired.
 *
 * @param target     attribute to reset
 * @param value      value to write, or {@code null} to leave the value alone
 * @param clearTrend whether to clear any active trend on the target
 */
public record ConstraintReset(
    AttributePath target,
    String value,
    boolean clearTrend
) implements Serializable {}
