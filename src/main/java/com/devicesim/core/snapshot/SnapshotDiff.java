package com.devicesim.core.snapshot;

import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ChangeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered attribute differences between two snapshots: attributes the action wrote first in
 * write order, then constraint repairs, then any remaining narrowed attributes by path.
 */
public final class SnapshotDiff {

    private SnapshotDiff() {}

    public static List<AttributeChange> diff(WorldSnapshot before, WorldSnapshot after,
                                             Set<AttributePath> valueWrites, Set<AttributePath> trendWrites,
                                             Set<AttributePath> repaired) {
        var order = new LinkedHashSet<String>();
        var kinds = new HashMap<String, ChangeKind>();
        for (AttributePath path : valueWrites) {
            order.add(path.toString());
            kinds.put(path.toString(), ChangeKind.VALUE);
        }
        for (AttributePath path : trendWrites) {
            order.add(path.toString());
            kinds.put(path.toString(), ChangeKind.TREND);
        }
        for (AttributePath path : repaired) {
            order.add(path.toString());
            kinds.put(path.toString(), ChangeKind.CONSTRAINT);
        }
        order.addAll(after.attributes().keySet());

        var changes = new ArrayList<AttributeChange>();
        for (String path : order) {
            if (!before.has(path) || !after.has(path)) {
                continue;
            }
            var from = before.state(path);
            var to = after.state(path);
            var kind = kinds.getOrDefault(path, ChangeKind.NARROWING);
            if (!from.value().equals(to.value())) {
                changes.add(new AttributeChange(path, from.value().render(), to.value().render(), kind));
            }
            if (from.trend() != to.trend()) {
                changes.add(new AttributeChange(path + ".trend", from.trend().wireName(), to.trend().wireName(),
                        kind == ChangeKind.CONSTRAINT ? ChangeKind.CONSTRAINT : ChangeKind.TREND));
            }
        }
        return changes;
    }

    public static List<AttributeChange> diff(WorldSnapshot before, WorldSnapshot after) {
        return diff(before, after, Set.of(), Set.of(), Set.of());
    }
}
