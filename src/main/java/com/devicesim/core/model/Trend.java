package com.devicesim.core.model;

/**
 * Direction in which an attribute is drifting since it was last observed.
 */
public enum Trend {
    UP,
    DOWN,
    NONE;

    public String wireName() {
        return name().toLowerCase();
    }

    public static Trend fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.toLowerCase()) {
            case "up" -> UP;
            case "down" -> DOWN;
            case "none" -> NONE;
            default -> throw new IllegalArgumentException("Unknown trend direction: " + value);
        };
    }
}
