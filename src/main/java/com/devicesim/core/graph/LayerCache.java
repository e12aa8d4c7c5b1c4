package com.devicesim.core.graph;

import com.devicesim.core.instance.DeviceInstance;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Nodes created while advancing one action across all open branches, keyed by snapshot hash.
 * A fresh cache is used for every action.
 */
public class LayerCache {

    /**
     * @param node     the materialized node
     * @param instance the instance carried forward from it
     */
    public record Entry(TreeNode node, DeviceInstance instance) {}

    private final Map<String, Entry> byHash = new HashMap<>();

    public Optional<Entry> find(String stateHash) {
        return Optional.ofNullable(byHash.get(stateHash));
    }

    public void put(String stateHash, TreeNode node, DeviceInstance instance) {
        byHash.put(stateHash, new Entry(node, instance));
    }

    public int size() {
        return byHash.size();
    }
}
