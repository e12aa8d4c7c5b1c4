package com.devicesim.core.engine;

import com.devicesim.core.model.ActionRequest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of a branching simulation.
 *
 * @param deviceType        device type to instantiate
 * @param actions           actions to apply in order
 * @param initialValues     attribute path to initial value overrides
 * @param unknownAttributes attribute paths to start as {@code unknown}
 * @param simulationId      id to use, or {@code null} to generate one
 */
public record SimulationRequest(
    String deviceType,
    List<ActionRequest> actions,
    Map<String, String> initialValues,
    List<String> unknownAttributes,
    String simulationId
) {

    public SimulationRequest {
        actions = actions == null ? List.of() : List.copyOf(actions);
        initialValues = initialValues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(initialValues));
        unknownAttributes = unknownAttributes == null ? List.of() : List.copyOf(unknownAttributes);
    }

    public static SimulationRequest of(String deviceType, List<ActionRequest> actions) {
        return new SimulationRequest(deviceType, actions, Map.of(), List.of(), null);
    }
}
