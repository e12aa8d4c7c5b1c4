package com.devicesim.core.snapshot;

import com.devicesim.TestDefinitions;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.instance.DeviceInstanceFactory;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotCaptureTest {

    private static final AttributePath BATTERY = AttributePath.parse("battery.level");

    private DefinitionCatalog catalog;
    private SnapshotCapture capture;
    private DeviceInstance flashlight;

    @BeforeEach
    void setUp() {
        catalog = TestDefinitions.catalog();
        capture = new SnapshotCapture(catalog);
        flashlight = DeviceInstanceFactory.instantiate(catalog.requireDeviceType("flashlight"));
    }

    @Test
    @DisplayName("captures every attribute with its current value")
    void plainValues() {
        var snapshot = capture.capture(flashlight);

        assertEquals("flashlight", snapshot.deviceType());
        assertEquals(4, snapshot.attributes().size());
        assertEquals(SnapshotValue.single("medium"), snapshot.value("battery.level"));
        assertEquals(SnapshotValue.single("high"), snapshot.value("bulb.max_output"));
    }

    @Test
    @DisplayName("active trend becomes the levels reachable from the last known value")
    void trend() {
        flashlight.attribute(BATTERY).writeTrend(Trend.UP);
        var state = capture.capture(flashlight).state("battery.level");

        assertEquals(SnapshotValue.of(List.of("medium", "high", "full")), state.value());
        assertEquals(Trend.UP, state.trend());
    }

    @Test
    @DisplayName("unknown without an anchor stays unknown")
    void unknown() {
        flashlight.attribute(BATTERY).markUnknown();
        assertEquals(SnapshotValue.unknown(), capture.capture(flashlight).value("battery.level"));
    }

    @Test
    @DisplayName("parent value-set is carried over unless the attribute was written")
    void carriesParentValueSet() {
        flashlight.attribute(BATTERY).markUnknown();
        var parent = capture.capture(flashlight)
                .with("battery.level", new AttributeState(SnapshotValue.of(List.of("low", "medium")), Trend.NONE));

        assertEquals(SnapshotValue.of(List.of("low", "medium")),
                capture.capture(flashlight, parent, Set.of()).value("battery.level"));
        assertEquals(SnapshotValue.unknown(),
                capture.capture(flashlight, parent, Set.of(BATTERY)).value("battery.level"));
    }
}
