package com.devicesim.core.snapshot;

import com.devicesim.core.model.Trend;

import java.io.Serializable;

/**
 * @param value value or value-set
 * @param trend active drift direction
 */
public record AttributeState(
    SnapshotValue value,
    Trend trend
) implements Serializable {

    public AttributeState {
        trend = trend == null ? Trend.NONE : trend;
    }

    public AttributeState withValue(SnapshotValue newValue) {
        return new AttributeState(newValue, trend);
    }

    public AttributeState withTrend(Trend newTrend) {
        return new AttributeState(value, newTrend);
    }
}
