package com.devicesim.core.snapshot;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.Trend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Restricts attributes of a snapshot to subsets of their values.
 * <p>
 * A value written concretely by the action is never overridden. An attribute whose trend the
 * action set is re-expanded from the requested values in the trend direction. Anything else
 * is intersected with its current possible values; an empty intersection is an
 * {@link EvaluationException}.
 */
public class SnapshotNarrower {

    private static final Logger log = LoggerFactory.getLogger(SnapshotNarrower.class);

    private final DefinitionCatalog catalog;

    public SnapshotNarrower(DefinitionCatalog catalog) {
        this.catalog = catalog;
    }

    public WorldSnapshot narrow(WorldSnapshot snapshot, DeviceType type, Map<AttributePath, List<String>> restrictions,
                                Set<AttributePath> valueWrites, Set<AttributePath> trendWrites) {
        WorldSnapshot result = snapshot;
        for (var entry : restrictions.entrySet()) {
            AttributePath path = entry.getKey();
            if (valueWrites.contains(path)) {
                continue;
            }
            var domain = catalog.domainOf(type, path);
            if (domain.isEmpty()) {
                log.warn("Not narrowing {}: no value domain on {}", path, type.name());
                continue;
            }
            var state = result.state(path.toString());
            SnapshotValue narrowed = trendWrites.contains(path)
                    ? expand(domain.get(), entry.getValue(), state.trend())
                    : intersect(domain.get(), state.value(), entry.getValue(), path);
            result = result.with(path.toString(), state.withValue(narrowed));
        }
        return result;
    }

    public WorldSnapshot narrow(WorldSnapshot snapshot, DeviceType type, Map<AttributePath, List<String>> restrictions) {
        return narrow(snapshot, type, restrictions, Set.of(), Set.of());
    }

    private static SnapshotValue intersect(OrderedDomain domain, SnapshotValue current, List<String> allowed, AttributePath path) {
        var possible = current.possibleValues(domain);
        var kept = new ArrayList<String>();
        for (String level : possible) {
            if (allowed.contains(level)) {
                kept.add(level);
            }
        }
        if (kept.isEmpty()) {
            throw new EvaluationException("Narrowing " + path + " " + current.render()
                    + " to " + allowed + " leaves no value");
        }
        return SnapshotValue.of(kept);
    }

    /**
     * Levels reachable from the requested set in the trend direction: everything at or below
     * its highest level for {@code down}, at or above its lowest for {@code up}.
     */
    private static SnapshotValue expand(OrderedDomain domain, List<String> from, Trend direction) {
        var ordered = domain.ordered(from);
        if (ordered.isEmpty()) {
            throw new EvaluationException("No levels of " + domain.id() + " in " + from);
        }
        return switch (direction) {
            case DOWN -> SnapshotValue.of(domain.levelsFrom(ordered.get(ordered.size() - 1), Trend.DOWN));
            case UP -> SnapshotValue.of(domain.levelsFrom(ordered.get(0), Trend.UP));
            case NONE -> SnapshotValue.of(ordered);
        };
    }
}
