package com.devicesim.core.graph;

import com.devicesim.core.model.NodeStatus;

import java.util.HashMap;
import java.util.Map;

/**
 * Summary figures for a simulation graph.
 *
 * @param totalNodes        number of nodes including the root
 * @param depth             number of action layers below the root
 * @param width             largest number of nodes in one layer
 * @param leafNodes         nodes without children
 * @param branchPoints      nodes with more than one child
 * @param successfulActions non-root nodes with status ok
 * @param failedActions     non-root nodes with any other status
 * @param mergedNodes       nodes reached from more than one parent
 * @param edgeCount         parent to child links, counting merged arrivals
 */
public record GraphStatistics(
    int totalNodes,
    int depth,
    int width,
    int leafNodes,
    int branchPoints,
    int successfulActions,
    int failedActions,
    int mergedNodes,
    int edgeCount
) {

    public static GraphStatistics of(SimulationGraph graph) {
        var depthById = new HashMap<String, Integer>();
        var widthByDepth = new HashMap<Integer, Integer>();
        int leaves = 0;
        int branchPoints = 0;
        int ok = 0;
        int failed = 0;
        int merged = 0;
        int edges = 0;

        for (TreeNode node : graph.nodes()) {
            int depth = depthOf(node, depthById);
            widthByDepth.merge(depth, 1, Integer::sum);
            int childCount = graph.children(node.id()).size();
            if (childCount == 0) leaves++;
            if (childCount > 1) branchPoints++;
            if (!node.isRoot()) {
                if (node.status() == NodeStatus.OK) ok++;
                else failed++;
            }
            if (node.hasMultipleParents()) merged++;
            edges += node.parentIds().size();
        }

        int maxDepth = widthByDepth.keySet().stream().mapToInt(Integer::intValue).max().orElse(0);
        int width = widthByDepth.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return new GraphStatistics(graph.size(), maxDepth, width, leaves, branchPoints, ok, failed, merged, edges);
    }

    // nodes are inserted layer by layer, so parents are always resolved before children
    private static int depthOf(TreeNode node, Map<String, Integer> depthById) {
        int depth = 0;
        for (String parentId : node.parentIds()) {
            depth = Math.max(depth, depthById.getOrDefault(parentId, 0) + 1);
        }
        depthById.put(node.id(), depth);
        return depth;
    }
}
