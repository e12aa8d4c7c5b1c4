package com.devicesim.core.model;

/**
 * Outcome of applying one action to one world state.
 */
public enum NodeStatus {
    OK,
    REJECTED,
    CONSTRAINT_VIOLATED,
    ERROR;

    public String wireName() {
        return name().toLowerCase();
    }

    public static NodeStatus fromWireName(String value) {
        return valueOf(value.toUpperCase());
    }
}
