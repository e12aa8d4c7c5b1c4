package com.devicesim.core.metrics;

import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.model.NodeStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for simulation runs.
 */
@Service
public class SimulationMetrics {

    private final MeterRegistry registry;

    public SimulationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordSimulationDuration(String deviceType, long ms) {
        Timer.builder("devicesim.simulation.duration")
                .tag("device", deviceType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordNodeCreated(NodeStatus status) {
        Counter.builder("devicesim.nodes.created")
                .tag("status", status.wireName())
                .register(registry)
                .increment();
    }

    public void recordNodeMerged() {
        Counter.builder("devicesim.nodes.merged")
                .description("Arrivals folded into an existing node of the same layer")
                .register(registry)
                .increment();
    }

    public void recordLayerWidth(int width) {
        DistributionSummary.builder("devicesim.layer.width")
                .register(registry)
                .record(width);
    }

    /**
     * Records the final shape of a finished simulation.
     *
     * @param stats statistics of the finished graph
     */
    public void recordGraph(GraphStatistics stats) {
        DistributionSummary.builder("devicesim.graph.nodes")
                .register(registry)
                .record(stats.totalNodes());
        DistributionSummary.builder("devicesim.graph.branch_points")
                .register(registry)
                .record(stats.branchPoints());
    }

    public void recordClarification(boolean answered) {
        Counter.builder("devicesim.clarifications.total")
                .tag("result", answered ? "answered" : "declined")
                .register(registry)
                .increment();
    }
}
