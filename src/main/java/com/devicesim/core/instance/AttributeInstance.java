package com.devicesim.core.instance;

import com.devicesim.core.model.AttributeSpec;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.Trend;

/**
 * Mutable per-instance state of one attribute. The {@link AttributeSpec} is shared and never
 * copied; {@link #copy()} duplicates only the mutable fields.
 */
public class AttributeInstance {

    private final AttributeSpec spec;
    private String current;
    private Trend trend;
    private double confidence;
    private String lastKnown;
    private Trend lastTrendDirection;

    public AttributeInstance(AttributeSpec spec, String initial) {
        this.spec = spec;
        this.trend = Trend.NONE;
        if (initial == null || OrderedDomain.UNKNOWN.equals(initial)) {
            markUnknown();
        } else {
            writeValue(initial);
        }
    }

    private AttributeInstance(AttributeInstance other) {
        this.spec = other.spec;
        this.current = other.current;
        this.trend = other.trend;
        this.confidence = other.confidence;
        this.lastKnown = other.lastKnown;
        this.lastTrendDirection = other.lastTrendDirection;
    }

    public AttributeInstance copy() {
        return new AttributeInstance(this);
    }

    /**
     * Concrete write: clears any trend and remembers the value as last known.
     */
    public void writeValue(String value) {
        this.current = value;
        this.lastKnown = value;
        this.trend = Trend.NONE;
        this.lastTrendDirection = null;
        this.confidence = 1.0;
    }

    /**
     * Starts a drift. The current value becomes unknown; a concrete current value is kept as
     * the anchor the reachable levels are derived from. {@link Trend#NONE} clears the drift.
     */
    public void writeTrend(Trend direction) {
        if (direction == Trend.NONE) {
            clearTrend();
            return;
        }
        if (!isUnknown()) {
            this.lastKnown = current;
        }
        this.current = OrderedDomain.UNKNOWN;
        this.trend = direction;
        this.lastTrendDirection = direction;
        this.confidence = 0.5;
    }

    public void clearTrend() {
        this.trend = Trend.NONE;
        this.lastTrendDirection = null;
    }

    /**
     * Forgets the value entirely, e.g. when the caller marks it as not yet observed.
     */
    public void markUnknown() {
        this.current = OrderedDomain.UNKNOWN;
        this.trend = Trend.NONE;
        this.lastTrendDirection = null;
        this.lastKnown = null;
        this.confidence = 0.0;
    }

    /**
     * Forgets the concrete value but keeps the anchor and drift, used when a value is only
     * known to lie in a set.
     */
    public void markUncertain() {
        this.current = OrderedDomain.UNKNOWN;
        this.confidence = 0.0;
    }

    public boolean isUnknown() {
        return OrderedDomain.UNKNOWN.equals(current);
    }

    /**
     * Whether the value is unknown because of an active drift with a known anchor.
     */
    public boolean hasActiveTrend() {
        return isUnknown() && lastTrendDirection != null && lastKnown != null;
    }

    public AttributeSpec spec() {
        return spec;
    }

    public String current() {
        return current;
    }

    public Trend trend() {
        return trend;
    }

    public double confidence() {
        return confidence;
    }

    public String lastKnown() {
        return lastKnown;
    }

    public Trend lastTrendDirection() {
        return lastTrendDirection;
    }
}
