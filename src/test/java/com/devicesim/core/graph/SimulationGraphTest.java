package com.devicesim.core.graph;

import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.NodeStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.devicesim.core.graph.GraphFixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class SimulationGraphTest {

    private SimulationGraph graph;

    @BeforeEach
    void setUp() {
        graph = new SimulationGraph("sim_1", "mixer", List.of(ActionRequest.parse("close_lid")));
        graph.addNode(TreeNode.root(graph.nextNodeId(), snapshot("open")));
    }

    private TreeNode child(String parentId, String lid) {
        var node = new TreeNode(graph.nextNodeId(), snapshot(lid), parentId, "close_lid", Map.of(),
                NodeStatus.OK, null, null, List.of());
        graph.addNode(node);
        return node;
    }

    @Test
    @DisplayName("first parentless node becomes the root and ids are sequential")
    void rootAndIds() {
        var child = child("state0", "closed");

        assertEquals("state0", graph.rootId());
        assertTrue(graph.root().isRoot());
        assertEquals("state1", child.id());
        assertEquals(List.of("state1"), graph.children("state0"));
        assertEquals(List.of(child), graph.leaves());
    }

    @Test
    @DisplayName("an extra edge links another parent without duplicating the child")
    void addEdge() {
        var a = child("state0", "closed");
        var b = child("state0", "open");
        var merged = child(a.id(), "closed");

        graph.addEdge(merged.id(), new IncomingEdge(b.id(), "close_lid", Map.of(), NodeStatus.OK, null, null, List.of()));

        assertEquals(List.of(a.id(), b.id()), merged.parentIds());
        assertEquals(a.id(), merged.primaryParentId());
        assertTrue(merged.hasMultipleParents());
        assertEquals(List.of(merged.id()), graph.children(b.id()));
    }

    @Test
    @DisplayName("rejects duplicate ids and unknown parents")
    void integrity() {
        assertThrows(IllegalStateException.class, () -> graph.addNode(TreeNode.root("state0", snapshot("open"))));
        assertThrows(IllegalStateException.class, () -> child("state42", "closed"));
        assertThrows(IllegalArgumentException.class, () -> graph.node("missing"));
    }

    @Test
    @DisplayName("id counter continues past nodes added with explicit ids")
    void counterContinues() {
        graph.addNode(new TreeNode("state7", snapshot("closed"), "state0", "close_lid", Map.of(),
                NodeStatus.OK, null, null, List.of()));
        assertEquals("state8", graph.nextNodeId());
    }

    @Test
    @DisplayName("describe shows action, status, condition and error")
    void describe() {
        var rejected = new TreeNode("state1", snapshot("open"), "state0", "start", Map.of(),
                NodeStatus.REJECTED, "Precondition failed", null, List.of());
        assertEquals("state0 [root]", graph.root().describe());
        assertEquals("state1 [start] rejected - Precondition failed", rejected.describe());
    }
}
