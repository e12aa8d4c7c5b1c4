package com.devicesim.core.model;

/** Which part of an action a branch condition was derived from. */
public enum BranchSource {
    PRECONDITION,
    POSTCONDITION;

    public String wireName() {
        return name().toLowerCase();
    }

    public static BranchSource fromWireName(String value) {
        return valueOf(value.toUpperCase());
    }
}
