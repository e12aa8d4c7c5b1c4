package com.devicesim.core.snapshot;

import com.devicesim.TestDefinitions;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.instance.DeviceInstanceFactory;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotNarrowerTest {

    private static final AttributePath BATTERY = AttributePath.parse("battery.level");

    private SnapshotNarrower narrower;
    private DeviceType flashlight;
    private WorldSnapshot unknownBattery;

    @BeforeEach
    void setUp() {
        DefinitionCatalog catalog = TestDefinitions.catalog();
        narrower = new SnapshotNarrower(catalog);
        flashlight = catalog.requireDeviceType("flashlight");
        var instance = DeviceInstanceFactory.instantiate(flashlight);
        instance.attribute(BATTERY).markUnknown();
        unknownBattery = new SnapshotCapture(catalog).capture(instance);
    }

    @Test
    @DisplayName("intersects an unknown value with the allowed levels")
    void intersectsUnknown() {
        var narrowed = narrower.narrow(unknownBattery, flashlight, Map.of(BATTERY, List.of("high", "low")));
        assertEquals(SnapshotValue.of(List.of("low", "high")), narrowed.value("battery.level"));
    }

    @Test
    @DisplayName("a single remaining level collapses to a plain value")
    void collapses() {
        var set = unknownBattery.with("battery.level",
                new AttributeState(SnapshotValue.of(List.of("low", "medium")), Trend.NONE));
        var narrowed = narrower.narrow(set, flashlight, Map.of(BATTERY, List.of("medium", "full")));
        assertEquals(SnapshotValue.single("medium"), narrowed.value("battery.level"));
    }

    @Test
    @DisplayName("an explicit write survives narrowing")
    void explicitWriteWins() {
        var written = unknownBattery.with("battery.level", new AttributeState(SnapshotValue.single("full"), Trend.NONE));
        var narrowed = narrower.narrow(written, flashlight, Map.of(BATTERY, List.of("low")), Set.of(BATTERY), Set.of());
        assertEquals(SnapshotValue.single("full"), narrowed.value("battery.level"));
    }

    @Test
    @DisplayName("a trend written by the action re-expands from the requested levels")
    void trendExpansion() {
        var drifting = unknownBattery.with("battery.level",
                new AttributeState(SnapshotValue.of(List.of("empty", "low", "medium")), Trend.DOWN));
        var narrowed = narrower.narrow(drifting, flashlight, Map.of(BATTERY, List.of("low")), Set.of(), Set.of(BATTERY));
        assertEquals(SnapshotValue.of(List.of("empty", "low")), narrowed.value("battery.level"));
        assertEquals(Trend.DOWN, narrowed.state("battery.level").trend());
    }

    @Test
    @DisplayName("an empty intersection is an evaluation error")
    void emptyIntersection() {
        var known = unknownBattery.with("battery.level", new AttributeState(SnapshotValue.single("low"), Trend.NONE));
        var ex = assertThrows(EvaluationException.class,
                () -> narrower.narrow(known, flashlight, Map.of(BATTERY, List.of("full"))));
        assertEquals("Narrowing battery.level low to [full] leaves no value", ex.getMessage());
    }

    @Test
    @DisplayName("re-expanding a trend from levels outside the domain is an evaluation error")
    void trendExpansionOutsideDomain() {
        var drifting = unknownBattery.with("battery.level",
                new AttributeState(SnapshotValue.of(List.of("low", "medium")), Trend.UP));
        assertThrows(EvaluationException.class, () -> narrower.narrow(drifting, flashlight,
                Map.of(BATTERY, List.of("overflowing")), Set.of(), Set.of(BATTERY)));
    }
}
