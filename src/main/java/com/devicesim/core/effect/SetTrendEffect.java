package com.devicesim.core.effect;

import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.Trend;

/**
 * Starts the attribute drifting in a direction. The current value becomes unknown and the
 * last known value is remembered so the reachable levels can be derived.
 *
 * @param target    attribute to drift
 * @param direction drift direction; {@link Trend#NONE} clears the trend
 */
public record SetTrendEffect(
    AttributePath target,
    Trend direction
) implements Effect {}
