package com.devicesim.core.graph;

import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.core.snapshot.WorldSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One distinct world state in a simulation graph. The fields describe how the node was first
 * reached from its primary parent; later arrivals are appended as {@link IncomingEdge}s.
 */
public class TreeNode {

    private final String id;
    private final WorldSnapshot snapshot;
    private final String actionName;
    private final Map<String, String> parameters;
    private final NodeStatus status;
    private final String error;
    private final BranchCondition branchCondition;
    private final List<AttributeChange> changes;
    private final List<String> parentIds = new ArrayList<>();
    private final List<IncomingEdge> incomingEdges = new ArrayList<>();

    public TreeNode(String id, WorldSnapshot snapshot, String parentId, String actionName,
                    Map<String, String> parameters, NodeStatus status, String error,
                    BranchCondition branchCondition, List<AttributeChange> changes) {
        this.id = id;
        this.snapshot = snapshot;
        this.actionName = actionName;
        this.parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        this.status = status;
        this.error = error;
        this.branchCondition = branchCondition;
        this.changes = changes == null ? List.of() : List.copyOf(changes);
        if (parentId != null) {
            parentIds.add(parentId);
        }
    }

    public static TreeNode root(String id, WorldSnapshot snapshot) {
        return new TreeNode(id, snapshot, null, null, Map.of(), NodeStatus.OK, null, null, List.of());
    }

    /**
     * Records another parent reaching this node.
     */
    public void addIncomingEdge(IncomingEdge edge) {
        incomingEdges.add(edge);
        if (!parentIds.contains(edge.parentId())) {
            parentIds.add(edge.parentId());
        }
    }

    public String id() {
        return id;
    }

    public WorldSnapshot snapshot() {
        return snapshot;
    }

    public String actionName() {
        return actionName;
    }

    public Map<String, String> parameters() {
        return parameters;
    }

    public NodeStatus status() {
        return status;
    }

    public String error() {
        return error;
    }

    public BranchCondition branchCondition() {
        return branchCondition;
    }

    public List<AttributeChange> changes() {
        return changes;
    }

    public List<String> parentIds() {
        return Collections.unmodifiableList(parentIds);
    }

    public String primaryParentId() {
        return parentIds.isEmpty() ? null : parentIds.get(0);
    }

    public List<IncomingEdge> incomingEdges() {
        return Collections.unmodifiableList(incomingEdges);
    }

    public boolean isRoot() {
        return actionName == null && parentIds.isEmpty();
    }

    public boolean hasMultipleParents() {
        return parentIds.size() > 1;
    }

    public String describe() {
        var sb = new StringBuilder(id);
        if (actionName != null) {
            sb.append(" [").append(actionName).append("] ").append(status.wireName());
        } else {
            sb.append(" [root]");
        }
        if (branchCondition != null) {
            sb.append(" if ").append(branchCondition.describe());
        }
        if (error != null) {
            sb.append(" - ").append(error);
        }
        return sb.toString();
    }
}
