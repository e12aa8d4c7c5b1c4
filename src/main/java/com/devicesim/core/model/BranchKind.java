package com.devicesim.core.model;

/** Role of a branch among its siblings. */
public enum BranchKind {
    IF,
    ELIF,
    ELSE,
    SUCCESS,
    FAIL;

    public String wireName() {
        return name().toLowerCase();
    }

    public static BranchKind fromWireName(String value) {
        return valueOf(value.toUpperCase());
    }
}
