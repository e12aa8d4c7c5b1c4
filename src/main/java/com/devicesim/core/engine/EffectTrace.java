package com.devicesim.core.engine;

import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.AttributePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Records what a run of effects wrote: the ordered changes and which attributes received a
 * concrete value or a trend.
 */
public class EffectTrace {

    private final List<AttributeChange> changes = new ArrayList<>();
    private final Set<AttributePath> valueWrites = new LinkedHashSet<>();
    private final Set<AttributePath> trendWrites = new LinkedHashSet<>();

    void recordValue(AttributePath path, AttributeChange change) {
        valueWrites.add(path);
        trendWrites.remove(path);
        changes.add(change);
    }

    void recordTrend(AttributePath path, List<AttributeChange> trendChanges) {
        trendWrites.add(path);
        valueWrites.remove(path);
        changes.addAll(trendChanges);
    }

    /**
     * Changes in application order, without no-ops.
     */
    public List<AttributeChange> changes() {
        return changes.stream().filter(c -> !c.isNoOp()).toList();
    }

    public Set<AttributePath> valueWrites() {
        return Collections.unmodifiableSet(valueWrites);
    }

    public Set<AttributePath> trendWrites() {
        return Collections.unmodifiableSet(trendWrites);
    }

    public boolean wrote(AttributePath path) {
        return valueWrites.contains(path) || trendWrites.contains(path);
    }
}
