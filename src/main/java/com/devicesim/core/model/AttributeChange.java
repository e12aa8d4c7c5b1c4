package com.devicesim.core.model;

import java.io.Serializable;

/**
 * One attribute difference between a node and its parent.
 *
 * @param attribute attribute path, e.g. {@code battery.level}
 * @param before    rendered value before the action
 * @param after     rendered value after the action
 * @param kind      what produced the change
 */
public record AttributeChange(
    String attribute,
    String before,
    String after,
    ChangeKind kind
) implements Serializable {

    public boolean isNoOp() {
        return before != null && before.equals(after);
    }

    public String describe() {
        return attribute + ": " + before + " -> " + after + (kind == ChangeKind.VALUE ? "" : " (" + kind.wireName() + ")");
    }
}
