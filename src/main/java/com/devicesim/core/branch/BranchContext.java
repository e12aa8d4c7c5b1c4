package com.devicesim.core.branch;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.Trend;
import com.devicesim.core.snapshot.AttributeState;
import com.devicesim.core.snapshot.SnapshotValue;
import com.devicesim.core.snapshot.WorldSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What branch computation reads: the parent snapshot, the device type, the catalog for
 * domains and the action parameters.
 */
public record BranchContext(
    DefinitionCatalog catalog,
    DeviceType deviceType,
    WorldSnapshot snapshot,
    Map<String, String> parameters
) {

    public BranchContext {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public Optional<OrderedDomain> domain(AttributePath path) {
        return catalog.domainOf(deviceType, path);
    }

    /**
     * Values the attribute may hold in the parent snapshot, in domain order.
     */
    public List<String> possibleValues(AttributePath path, OrderedDomain domain) {
        if (!snapshot.has(path.toString())) {
            throw new EvaluationException("Unknown attribute '" + path + "' on " + deviceType.name());
        }
        return snapshot.value(path.toString()).possibleValues(domain);
    }

    /**
     * Whether the attribute is unknown or a value-set of more than one level in the parent snapshot.
     */
    public boolean isUncertain(AttributePath path) {
        if (!snapshot.has(path.toString())) {
            throw new EvaluationException("Unknown attribute '" + path + "' on " + deviceType.name());
        }
        return snapshot.value(path.toString()).isUncertain();
    }

    /**
     * The same context with the given attributes pinned to concrete values, e.g. values an
     * earlier effect of the action wrote before a guard reads them.
     */
    public BranchContext withValues(Map<AttributePath, String> values) {
        if (values.isEmpty()) {
            return this;
        }
        WorldSnapshot pinned = snapshot;
        for (var entry : values.entrySet()) {
            pinned = pinned.with(entry.getKey().toString(),
                    new AttributeState(SnapshotValue.single(entry.getValue()), Trend.NONE));
        }
        return new BranchContext(catalog, deviceType, pinned, parameters);
    }
}
