package com.devicesim.core.graph;

import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.NodeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.devicesim.core.graph.GraphFixtures.arrival;
import static com.devicesim.core.graph.GraphFixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class NodeFactoryTest {

    private SimulationGraph graph;
    private NodeFactory factory;

    @BeforeEach
    void setUp() {
        graph = new SimulationGraph("sim_1", "mixer", List.of(ActionRequest.parse("close_lid")));
        graph.addNode(TreeNode.root(graph.nextNodeId(), snapshot("open")));
        graph.addNode(new TreeNode(graph.nextNodeId(), snapshot("closed"), "state0", "reset", null,
                NodeStatus.OK, null, null, null));
        factory = new NodeFactory();
    }

    @Test
    @DisplayName("identical snapshots in one layer share a node with two parents")
    void mergesWithinLayer() {
        var cache = new LayerCache();

        var first = factory.createOrMerge(graph, cache, snapshot("closed"), null, arrival("state0", "close_lid"));
        var second = factory.createOrMerge(graph, cache, snapshot("closed"), null, arrival("state1", "close_lid"));

        assertFalse(first.merged());
        assertTrue(second.merged());
        assertSame(first.node(), second.node());
        assertEquals(List.of("state0", "state1"), first.node().parentIds());
        assertEquals(1, first.node().incomingEdges().size());
        assertEquals(3, graph.size());
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("different snapshots or a new layer create separate nodes")
    void separateNodes() {
        var cache = new LayerCache();
        var closed = factory.createOrMerge(graph, cache, snapshot("closed"), null, arrival("state0", "close_lid"));
        var open = factory.createOrMerge(graph, cache, snapshot("open"), null, arrival("state0", "close_lid"));
        var nextLayer = factory.createOrMerge(graph, new LayerCache(), snapshot("closed"), null, arrival("state1", "close_lid"));

        assertNotEquals(closed.node().id(), open.node().id());
        assertFalse(nextLayer.merged());
        assertEquals(5, graph.size());
    }
}
