package com.devicesim.core.graph;

import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.NodeStatus;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * A further way of reaching an already materialized node, recorded when deduplication merges
 * a new branch into it.
 *
 * @param parentId        id of the additional parent
 * @param actionName      action applied to that parent
 * @param parameters      action parameters
 * @param status          outcome of the action from that parent
 * @param error           rejection or error text
 * @param branchCondition condition of the branch from that parent
 * @param changes         diffs relative to that parent
 */
public record IncomingEdge(
    String parentId,
    String actionName,
    Map<String, String> parameters,
    NodeStatus status,
    String error,
    BranchCondition branchCondition,
    List<AttributeChange> changes
) implements Serializable {

    public IncomingEdge {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        changes = changes == null ? List.of() : List.copyOf(changes);
    }
}
