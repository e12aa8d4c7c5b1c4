package com.devicesim.core.graph;

import com.devicesim.core.model.ActionRequest;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All nodes of one simulation, keyed by sequential id ({@code state0}, {@code state1}, ...).
 * Grows monotonically; nodes are never removed.
 */
public class SimulationGraph {

    private final String simulationId;
    private final String deviceType;
    private final List<ActionRequest> actions;
    private final Map<String, TreeNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<String>> children = new LinkedHashMap<>();
    private String rootId;
    private int nextId;

    public SimulationGraph(String simulationId, String deviceType, List<ActionRequest> actions) {
        this.simulationId = simulationId;
        this.deviceType = deviceType;
        this.actions = List.copyOf(actions);
    }

    public String nextNodeId() {
        return "state" + nextId++;
    }

    public void addNode(TreeNode node) {
        if (nodes.containsKey(node.id())) {
            throw new IllegalStateException("Duplicate node id: " + node.id());
        }
        for (String parentId : node.parentIds()) {
            if (!nodes.containsKey(parentId)) {
                throw new IllegalStateException("Unknown parent node: " + parentId);
            }
        }
        nodes.put(node.id(), node);
        children.put(node.id(), new ArrayList<>());
        if (rootId == null && node.parentIds().isEmpty()) {
            rootId = node.id();
        }
        for (String parentId : node.parentIds()) {
            linkChild(parentId, node.id());
        }
        bumpCounterPast(node.id());
    }

    /**
     * Attaches another incoming edge to an existing node.
     */
    public void addEdge(String nodeId, IncomingEdge edge) {
        var node = node(nodeId);
        node.addIncomingEdge(edge);
        linkChild(edge.parentId(), nodeId);
    }

    private void linkChild(String parentId, String childId) {
        var list = children.get(parentId);
        if (list == null) {
            throw new IllegalStateException("Unknown parent node: " + parentId);
        }
        if (!list.contains(childId)) {
            list.add(childId);
        }
    }

    private void bumpCounterPast(String id) {
        if (id.startsWith("state")) {
            try {
                nextId = Math.max(nextId, Integer.parseInt(id.substring("state".length())) + 1);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Malformed node id: " + id, e);
            }
        }
    }

    public TreeNode node(String id) {
        var node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown node: " + id);
        }
        return node;
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public Collection<TreeNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<String> children(String id) {
        var list = children.get(id);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    public List<TreeNode> leaves() {
        return nodes.values().stream().filter(n -> children(n.id()).isEmpty()).toList();
    }

    public int size() {
        return nodes.size();
    }

    public String simulationId() {
        return simulationId;
    }

    public String deviceType() {
        return deviceType;
    }

    public List<ActionRequest> actions() {
        return actions;
    }

    public String rootId() {
        return rootId;
    }

    public TreeNode root() {
        return rootId == null ? null : nodes.get(rootId);
    }
}
