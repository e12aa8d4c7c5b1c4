package com.devicesim.core.engine;

import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributeChange;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.NodeStatus;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Result of applying one action to one concrete instance.
 *
 * @param status                 outcome status
 * @param message                rejection, violation or error text, {@code null} when ok
 * @param clarificationQuestion  {@code What is <path>?} when a rejection traces to an unknown attribute
 * @param clarificationAttribute the attribute the question is about
 * @param after                  resulting instance; {@code null} when rejected before effects ran
 * @param changes                ordered attribute diffs
 * @param violations             violated constraint messages
 * @param valueWrites            attributes that received a concrete value, in write order
 * @param trendWrites            attributes that received a trend
 */
public record TransitionOutcome(
    NodeStatus status,
    String message,
    String clarificationQuestion,
    AttributePath clarificationAttribute,
    DeviceInstance after,
    List<AttributeChange> changes,
    List<String> violations,
    Set<AttributePath> valueWrites,
    Set<AttributePath> trendWrites
) {

    public TransitionOutcome {
        changes = changes == null ? List.of() : List.copyOf(changes);
        violations = violations == null ? List.of() : List.copyOf(violations);
        valueWrites = valueWrites == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(valueWrites));
        trendWrites = trendWrites == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(trendWrites));
    }

    static TransitionOutcome rejected(String message, AttributePath unknownAttribute) {
        String question = unknownAttribute == null ? null : "What is " + unknownAttribute + "?";
        return new TransitionOutcome(NodeStatus.REJECTED, message, question, unknownAttribute,
                null, List.of(), List.of(), Set.of(), Set.of());
    }

    static TransitionOutcome error(String message) {
        return new TransitionOutcome(NodeStatus.ERROR, message, null, null,
                null, List.of(), List.of(), Set.of(), Set.of());
    }

    static TransitionOutcome applied(DeviceInstance after, EffectTrace trace, List<String> violations) {
        var status = violations.isEmpty() ? NodeStatus.OK : NodeStatus.CONSTRAINT_VIOLATED;
        String message = violations.isEmpty() ? null : String.join("; ", violations);
        return new TransitionOutcome(status, message, null, null, after, trace.changes(), violations,
                trace.valueWrites(), trace.trendWrites());
    }

    public boolean needsClarification() {
        return clarificationQuestion != null;
    }

    public boolean wrote(AttributePath path) {
        return valueWrites.contains(path) || trendWrites.contains(path);
    }
}
