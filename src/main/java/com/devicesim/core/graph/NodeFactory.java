package com.devicesim.core.graph;

import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.core.snapshot.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Creates nodes, or merges into an existing node of the same layer with an identical snapshot.
 */
public class NodeFactory {

    private static final Logger log = LoggerFactory.getLogger(NodeFactory.class);

    /**
     * @param node     created or reused node
     * @param instance instance to carry forward from the node
     * @param merged   whether an existing node was reused
     */
    public record Result(TreeNode node, DeviceInstance instance, boolean merged) {}

    /**
     * Everything describing one arrival at a state from a parent.
     *
     * @param parentId        parent node id
     * @param actionName      action applied
     * @param parameters      action parameters
     * @param status          outcome
     * @param error           rejection or error text
     * @param branchCondition branch condition
     * @param changes         diffs against the parent
     */
    public record Arrival(
        String parentId,
        String actionName,
        Map<String, String> parameters,
        NodeStatus status,
        String error,
        BranchCondition branchCondition,
        List<AttributeChange> changes
    ) {}

    public Result createOrMerge(SimulationGraph graph, LayerCache cache, WorldSnapshot snapshot,
                                DeviceInstance instance, Arrival arrival) {
        String hash = snapshot.stateHash();
        var existing = cache.find(hash);
        if (existing.isPresent()) {
            var node = existing.get().node();
            graph.addEdge(node.id(), new IncomingEdge(arrival.parentId(), arrival.actionName(), arrival.parameters(),
                    arrival.status(), arrival.error(), arrival.branchCondition(), arrival.changes()));
            log.debug("Merged arrival from {} into {} ({})", arrival.parentId(), node.id(), hash);
            return new Result(node, existing.get().instance(), true);
        }

        var node = new TreeNode(graph.nextNodeId(), snapshot, arrival.parentId(), arrival.actionName(),
                arrival.parameters(), arrival.status(), arrival.error(), arrival.branchCondition(), arrival.changes());
        graph.addNode(node);
        cache.put(hash, node, instance);
        return new Result(node, instance, false);
    }
}
