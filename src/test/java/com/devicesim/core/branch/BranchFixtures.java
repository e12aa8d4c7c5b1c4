package com.devicesim.core.branch;

import com.devicesim.TestDefinitions;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.instance.DeviceInstanceFactory;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.snapshot.AttributeState;
import com.devicesim.core.snapshot.SnapshotCapture;
import com.devicesim.core.snapshot.SnapshotValue;

import java.util.List;
import java.util.Map;

final class BranchFixtures {

    private BranchFixtures() {}

    static BranchContext context(String device, Map<String, String> initial, List<String> unknown) {
        var catalog = catalogFor(device);
        var type = catalog.requireDeviceType(device);
        var instance = DeviceInstanceFactory.instantiate(catalog, type, initial, unknown);
        return new BranchContext(catalog, type, new SnapshotCapture(catalog).capture(instance), Map.of());
    }

    static ActionDefinition action(String device, String name) {
        return catalogFor(device).resolveAction(device, name).orElseThrow();
    }

    static BranchContext withSet(BranchContext ctx, String path, List<String> values) {
        return new BranchContext(ctx.catalog(), ctx.deviceType(),
                ctx.snapshot().with(path, new AttributeState(SnapshotValue.of(values), null)), ctx.parameters());
    }

    private static DefinitionCatalog catalogFor(String device) {
        return "lantern".equals(device) ? TestDefinitions.branchingCatalog() : TestDefinitions.catalog();
    }
}
