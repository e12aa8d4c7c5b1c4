package com.devicesim.io;

import com.devicesim.core.graph.IncomingEdge;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.graph.TreeNode;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.BranchKind;
import com.devicesim.core.model.BranchSource;
import com.devicesim.core.model.ChangeKind;
import com.devicesim.core.model.ComparisonOperator;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.core.model.Trend;
import com.devicesim.core.snapshot.AttributeState;
import com.devicesim.core.snapshot.SnapshotValue;
import com.devicesim.core.snapshot.WorldSnapshot;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a {@link SimulationGraph} as a YAML or JSON document, chosen by file extension, and
 * reads it back. Nodes are written in creation order so parents always precede children.
 */
public class GraphSerializer {

    private static final Logger log = LoggerFactory.getLogger(GraphSerializer.class);

    private final ObjectMapper yamlMapper;
    private final ObjectMapper jsonMapper;

    public GraphSerializer() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(SimulationGraph graph, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            mapperFor(file).writeValue(file.toFile(), toTree(graph));
            log.info("Wrote {} nodes of {} to {}", graph.size(), graph.simulationId(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph to " + file, e);
        }
    }

    public SimulationGraph read(Path file) {
        JsonNode root;
        try {
            root = mapperFor(file).readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph from " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException(file + " does not contain a simulation graph");
        }
        return fromTree(root);
    }

    public ObjectNode toTree(SimulationGraph graph) {
        var root = jsonMapper.createObjectNode();
        root.put("simulation_id", graph.simulationId());
        root.put("device_type", graph.deviceType());
        var actions = root.putArray("actions");
        for (ActionRequest action : graph.actions()) {
            var node = actions.addObject();
            node.put("name", action.name());
            if (!action.parameters().isEmpty()) {
                putMap(node.putObject("parameters"), action.parameters());
            }
        }
        root.put("root_id", graph.rootId());
        var nodes = root.putArray("nodes");
        for (TreeNode node : graph.nodes()) {
            nodes.add(nodeTree(node));
        }
        return root;
    }

    public SimulationGraph fromTree(JsonNode root) {
        var actions = new ArrayList<ActionRequest>();
        for (JsonNode action : root.path("actions")) {
            actions.add(new ActionRequest(action.path("name").asText(), readMap(action.get("parameters"))));
        }
        var graph = new SimulationGraph(root.path("simulation_id").asText(), root.path("device_type").asText(), actions);
        for (JsonNode node : root.path("nodes")) {
            var parents = new ArrayList<String>();
            node.path("parents").forEach(p -> parents.add(p.asText()));
            var treeNode = new TreeNode(
                    node.path("id").asText(),
                    readSnapshot(root.path("device_type").asText(), node.path("snapshot")),
                    parents.isEmpty() ? null : parents.get(0),
                    textOrNull(node, "action"),
                    readMap(node.get("parameters")),
                    NodeStatus.fromWireName(node.path("status").asText("ok")),
                    textOrNull(node, "error"),
                    readCondition(node.get("branch_condition")),
                    readChanges(node.get("changes")));
            graph.addNode(treeNode);
            for (JsonNode edge : node.path("incoming_edges")) {
                graph.addEdge(treeNode.id(), new IncomingEdge(
                        edge.path("parent").asText(),
                        textOrNull(edge, "action"),
                        readMap(edge.get("parameters")),
                        NodeStatus.fromWireName(edge.path("status").asText("ok")),
                        textOrNull(edge, "error"),
                        readCondition(edge.get("branch_condition")),
                        readChanges(edge.get("changes"))));
            }
        }
        return graph;
    }

    private ObjectNode nodeTree(TreeNode node) {
        var out = jsonMapper.createObjectNode();
        out.put("id", node.id());
        var parents = out.putArray("parents");
        node.parentIds().forEach(parents::add);
        if (node.actionName() != null) {
            out.put("action", node.actionName());
        }
        if (!node.parameters().isEmpty()) {
            putMap(out.putObject("parameters"), node.parameters());
        }
        out.put("status", node.status().wireName());
        if (node.error() != null) {
            out.put("error", node.error());
        }
        if (node.branchCondition() != null) {
            out.set("branch_condition", conditionTree(node.branchCondition()));
        }
        if (!node.changes().isEmpty()) {
            out.set("changes", changesTree(node.changes()));
        }
        out.put("state_hash", node.snapshot().stateHash());
        out.set("snapshot", snapshotTree(node.snapshot()));
        if (!node.incomingEdges().isEmpty()) {
            var edges = out.putArray("incoming_edges");
            for (IncomingEdge edge : node.incomingEdges()) {
                var e = edges.addObject();
                e.put("parent", edge.parentId());
                if (edge.actionName() != null) {
                    e.put("action", edge.actionName());
                }
                if (!edge.parameters().isEmpty()) {
                    putMap(e.putObject("parameters"), edge.parameters());
                }
                e.put("status", edge.status().wireName());
                if (edge.error() != null) {
                    e.put("error", edge.error());
                }
                if (edge.branchCondition() != null) {
                    e.set("branch_condition", conditionTree(edge.branchCondition()));
                }
                if (!edge.changes().isEmpty()) {
                    e.set("changes", changesTree(edge.changes()));
                }
            }
        }
        return out;
    }

    private ObjectNode snapshotTree(WorldSnapshot snapshot) {
        var out = jsonMapper.createObjectNode();
        snapshot.attributes().forEach((path, state) -> {
            var attr = out.putObject(path);
            if (state.value() instanceof SnapshotValue.ValueSet set) {
                var values = attr.putArray("value");
                set.values().forEach(values::add);
            } else if (state.value() instanceof SnapshotValue.Single single) {
                attr.put("value", single.value());
            }
            if (state.trend() != Trend.NONE) {
                attr.put("trend", state.trend().wireName());
            }
        });
        return out;
    }

    private WorldSnapshot readSnapshot(String deviceType, JsonNode node) {
        var attributes = new LinkedHashMap<String, AttributeState>();
        node.fields().forEachRemaining(entry -> {
            var valueNode = entry.getValue().path("value");
            SnapshotValue value;
            if (valueNode.isArray()) {
                var values = new ArrayList<String>();
                valueNode.forEach(v -> values.add(v.asText()));
                value = SnapshotValue.of(values);
            } else {
                value = SnapshotValue.single(valueNode.asText());
            }
            attributes.put(entry.getKey(), new AttributeState(value,
                    Trend.fromWireName(entry.getValue().path("trend").asText(""))));
        });
        return new WorldSnapshot(deviceType, attributes);
    }

    private ObjectNode conditionTree(BranchCondition condition) {
        var out = jsonMapper.createObjectNode();
        if (condition.isCompound()) {
            out.put("combinator", condition.combinator().wireName());
            var subs = out.putArray("sub_conditions");
            condition.subConditions().forEach(sub -> subs.add(conditionTree(sub)));
        } else {
            out.put("attribute", condition.attribute());
            out.put("operator", condition.operator().wireName());
            var values = out.putArray("values");
            condition.values().forEach(values::add);
        }
        if (condition.source() != null) {
            out.put("source", condition.source().wireName());
        }
        if (condition.kind() != null) {
            out.put("kind", condition.kind().wireName());
        }
        out.put("description", condition.describe());
        return out;
    }

    private BranchCondition readCondition(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        var source = node.hasNonNull("source") ? BranchSource.fromWireName(node.get("source").asText()) : null;
        var kind = node.hasNonNull("kind") ? BranchKind.fromWireName(node.get("kind").asText()) : null;
        if (node.hasNonNull("combinator")) {
            var subs = new ArrayList<BranchCondition>();
            node.path("sub_conditions").forEach(sub -> subs.add(readCondition(sub)));
            return new BranchCondition(null, null, List.of(),
                    source, kind, BranchCondition.Combinator.fromWireName(node.get("combinator").asText()), subs);
        }
        var values = new ArrayList<String>();
        node.path("values").forEach(v -> values.add(v.asText()));
        return new BranchCondition(node.path("attribute").asText(),
                ComparisonOperator.fromWireName(node.path("operator").asText("equals")),
                values, source, kind, null, List.of());
    }

    private ArrayNode changesTree(List<AttributeChange> changes) {
        var out = jsonMapper.createArrayNode();
        for (AttributeChange change : changes) {
            var c = out.addObject();
            c.put("attribute", change.attribute());
            c.put("before", change.before());
            c.put("after", change.after());
            c.put("kind", change.kind().wireName());
        }
        return out;
    }

    private List<AttributeChange> readChanges(JsonNode node) {
        var changes = new ArrayList<AttributeChange>();
        if (node == null) {
            return changes;
        }
        for (JsonNode c : node) {
            changes.add(new AttributeChange(c.path("attribute").asText(), c.path("before").asText(),
                    c.path("after").asText(), ChangeKind.fromWireName(c.path("kind").asText("value"))));
        }
        return changes;
    }

    private static void putMap(ObjectNode target, Map<String, String> values) {
        values.forEach(target::put);
    }

    private static Map<String, String> readMap(JsonNode node) {
        var map = new LinkedHashMap<String, String>();
        if (node != null) {
            node.fields().forEachRemaining(e -> map.put(e.getKey(), e.getValue().asText()));
        }
        return map;
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private ObjectMapper mapperFor(Path file) {
        return file.getFileName().toString().toLowerCase().endsWith(".json") ? jsonMapper : yamlMapper;
    }
}
