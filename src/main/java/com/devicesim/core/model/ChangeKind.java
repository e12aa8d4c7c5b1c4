package com.devicesim.core.model;

/** What kind of write produced an {@link AttributeChange}. */
public enum ChangeKind {
    VALUE,
    TREND,
    NARROWING,
    CONSTRAINT;

    public String wireName() {
        return name().toLowerCase();
    }

    public static ChangeKind fromWireName(String value) {
        return valueOf(value.toUpperCase());
    }
}
