package com.devicesim.io;

import com.devicesim.TestDefinitions;
import com.devicesim.core.engine.SimulationEngine;
import com.devicesim.core.engine.SimulationRequest;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.graph.TreeNode;
import com.devicesim.core.model.ActionRequest;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphSerializerTest {

    private static SimulationGraph graph;

    private final GraphSerializer serializer = new GraphSerializer();

    @BeforeAll
    static void simulate() {
        var engine = new SimulationEngine(TestDefinitions.catalog());
        graph = engine.run(new SimulationRequest("mixer",
                List.of(ActionRequest.parse("start"), ActionRequest.parse("reset")),
                Map.of("bowl.seating", "seated"), List.of("lid.position", "override.key"), "sim_serial"));
    }

    private static void assertSameGraph(SimulationGraph expected, SimulationGraph actual) {
        assertEquals(expected.simulationId(), actual.simulationId());
        assertEquals(expected.deviceType(), actual.deviceType());
        assertEquals(expected.actions(), actual.actions());
        assertEquals(expected.rootId(), actual.rootId());
        assertEquals(expected.size(), actual.size());
        for (TreeNode node : expected.nodes()) {
            var copy = actual.node(node.id());
            assertEquals(node.snapshot(), copy.snapshot(), node.id());
            assertEquals(node.snapshot().stateHash(), copy.snapshot().stateHash());
            assertEquals(node.parentIds(), copy.parentIds());
            assertEquals(node.status(), copy.status());
            assertEquals(node.error(), copy.error());
            assertEquals(node.branchCondition(), copy.branchCondition());
            assertEquals(node.changes(), copy.changes());
            assertEquals(node.incomingEdges(), copy.incomingEdges());
            assertEquals(expected.children(node.id()), actual.children(node.id()));
        }
    }

    @Test
    @DisplayName("YAML output reads back into an equal graph")
    void yaml(@TempDir Path dir) {
        var file = dir.resolve("out/graph.yaml");
        serializer.write(graph, file);

        assertTrue(Files.exists(file));
        assertSameGraph(graph, serializer.read(file));
    }

    @Test
    @DisplayName("JSON is chosen by extension and reads back into an equal graph")
    void json(@TempDir Path dir) throws IOException {
        var file = dir.resolve("graph.json");
        serializer.write(graph, file);

        assertTrue(Files.readString(file).startsWith("{"));
        assertSameGraph(graph, serializer.read(file));
    }

    @Test
    @DisplayName("tree carries merge edges and value-sets")
    void treeShape() {
        var tree = serializer.toTree(graph);

        assertEquals("sim_serial", tree.get("simulation_id").asText());
        assertEquals("state0", tree.get("root_id").asText());
        var merged = tree.get("nodes").get(4);
        assertEquals(3, merged.get("parents").size());
        assertEquals(2, merged.get("incoming_edges").size());
        var rejected = tree.get("nodes").findValues("status").stream().filter(s -> s.asText().equals("rejected")).count();
        assertEquals(1, rejected);
        assertEquals(16, merged.get("state_hash").asText().length());
    }

    @Test
    @DisplayName("a file without a graph object is rejected")
    void notAGraph(@TempDir Path dir) throws IOException {
        var file = Files.writeString(dir.resolve("list.yaml"), "- a\n- b\n");
        assertThrows(IllegalArgumentException.class, () -> serializer.read(file));
        assertThrows(UncheckedIOException.class, () -> serializer.read(dir.resolve("missing.yaml")));
    }
}
