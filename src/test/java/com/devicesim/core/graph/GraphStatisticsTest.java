package com.devicesim.core.graph;

import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.NodeStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.devicesim.core.graph.GraphFixtures.arrival;
import static com.devicesim.core.graph.GraphFixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class GraphStatisticsTest {

    @Test
    @DisplayName("root-only graph")
    void rootOnly() {
        var graph = new SimulationGraph("sim_1", "mixer", List.of());
        graph.addNode(TreeNode.root(graph.nextNodeId(), snapshot("open")));

        var stats = GraphStatistics.of(graph);

        assertEquals(new GraphStatistics(1, 0, 1, 1, 0, 0, 0, 0, 0), stats);
    }

    @Test
    @DisplayName("counts depth, width, branch points, outcomes and merges")
    void branchedGraph() {
        var graph = new SimulationGraph("sim_1", "mixer",
                List.of(ActionRequest.parse("start"), ActionRequest.parse("reset")));
        graph.addNode(TreeNode.root(graph.nextNodeId(), snapshot("open")));
        graph.addNode(new TreeNode(graph.nextNodeId(), snapshot("closed"), "state0", "start", Map.of(),
                NodeStatus.OK, null, null, List.of()));
        graph.addNode(new TreeNode(graph.nextNodeId(), snapshot("open"), "state0", "start", Map.of(),
                NodeStatus.REJECTED, "Precondition failed", null, List.of()));

        var factory = new NodeFactory();
        var cache = new LayerCache();
        factory.createOrMerge(graph, cache, snapshot("closed"), null, arrival("state1", "reset"));
        factory.createOrMerge(graph, cache, snapshot("closed"), null, arrival("state2", "reset"));

        var stats = GraphStatistics.of(graph);

        assertEquals(4, stats.totalNodes());
        assertEquals(2, stats.depth());
        assertEquals(2, stats.width());
        assertEquals(1, stats.leafNodes());
        assertEquals(1, stats.branchPoints());
        assertEquals(2, stats.successfulActions());
        assertEquals(1, stats.failedActions());
        assertEquals(1, stats.mergedNodes());
        assertEquals(4, stats.edgeCount());
    }
}
