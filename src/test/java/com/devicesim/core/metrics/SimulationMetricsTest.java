package com.devicesim.core.metrics;

import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.model.NodeStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SimulationMetricsTest {

    private SimpleMeterRegistry registry;
    private SimulationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SimulationMetrics(registry);
    }

    @Test
    @DisplayName("recordSimulationDuration creates a timer per device type")
    void recordSimulationDuration() {
        metrics.recordSimulationDuration("flashlight", 12);
        var timer = registry.find("devicesim.simulation.duration").tag("device", "flashlight").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordNodeCreated increments by status tag")
    void recordNodeCreated() {
        metrics.recordNodeCreated(NodeStatus.OK);
        metrics.recordNodeCreated(NodeStatus.OK);
        metrics.recordNodeCreated(NodeStatus.CONSTRAINT_VIOLATED);

        var ok = registry.find("devicesim.nodes.created").tag("status", "ok").counter();
        var violated = registry.find("devicesim.nodes.created").tag("status", "constraint_violated").counter();

        assertNotNull(ok);
        assertNotNull(violated);
        assertEquals(2.0, ok.count());
        assertEquals(1.0, violated.count());
    }

    @Test
    @DisplayName("recordGraph records node count and branch points")
    void recordGraph() {
        metrics.recordGraph(new GraphStatistics(7, 2, 4, 4, 2, 5, 1, 1, 7));

        var nodes = registry.find("devicesim.graph.nodes").summary();
        assertNotNull(nodes);
        assertEquals(7.0, nodes.totalAmount());
        assertEquals(2.0, registry.find("devicesim.graph.branch_points").summary().totalAmount());
    }

    @Test
    @DisplayName("recordClarification separates answered and declined")
    void recordClarification() {
        metrics.recordClarification(true);
        metrics.recordClarification(false);
        metrics.recordClarification(false);

        assertEquals(1.0, registry.find("devicesim.clarifications.total").tag("result", "answered").counter().count());
        assertEquals(2.0, registry.find("devicesim.clarifications.total").tag("result", "declined").counter().count());
    }

    @Test
    @DisplayName("recordLayerWidth and recordNodeMerged")
    void layerAndMerge() {
        metrics.recordLayerWidth(3);
        metrics.recordNodeMerged();

        assertEquals(3.0, registry.find("devicesim.layer.width").summary().max());
        assertEquals(1.0, registry.find("devicesim.nodes.merged").counter().count());
    }
}
