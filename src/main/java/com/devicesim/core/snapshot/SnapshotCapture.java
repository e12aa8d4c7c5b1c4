package com.devicesim.core.snapshot;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributePath;

import java.util.LinkedHashMap;
import java.util.Set;

/**
 * Projects a device instance into a {@link WorldSnapshot}.
 * <p>
 * Per attribute, first match wins:
 * <ol>
 *   <li>not written by the action, unknown in the instance, and a value-set in the parent:
 *       the parent's value-set is carried over</li>
 *   <li>unknown because of an active trend: the levels reachable from the last known value</li>
 *   <li>otherwise the raw current value</li>
 * </ol>
 */
public class SnapshotCapture {

    private final DefinitionCatalog catalog;

    public SnapshotCapture(DefinitionCatalog catalog) {
        this.catalog = catalog;
    }

    public WorldSnapshot capture(DeviceInstance instance) {
        return capture(instance, null, Set.of());
    }

    public WorldSnapshot capture(DeviceInstance instance, WorldSnapshot parent, Set<AttributePath> written) {
        var type = catalog.requireDeviceType(instance.typeName());
        var states = new LinkedHashMap<String, AttributeState>();
        for (AttributePath path : instance.paths()) {
            var attribute = instance.attribute(path);
            String key = path.toString();
            var parentState = parent != null && parent.has(key) ? parent.state(key) : null;

            if (!written.contains(path) && attribute.isUnknown() && parentState != null
                    && parentState.value() instanceof SnapshotValue.ValueSet) {
                states.put(key, parentState);
                continue;
            }

            var domain = catalog.domainOf(type, path);
            if (attribute.hasActiveTrend() && domain.isPresent() && domain.get().contains(attribute.lastKnown())) {
                var reachable = domain.get().levelsFrom(attribute.lastKnown(), attribute.lastTrendDirection());
                states.put(key, new AttributeState(SnapshotValue.of(reachable), attribute.trend()));
                continue;
            }

            states.put(key, new AttributeState(SnapshotValue.single(attribute.current()), attribute.trend()));
        }
        return new WorldSnapshot(instance.typeName(), states);
    }
}
