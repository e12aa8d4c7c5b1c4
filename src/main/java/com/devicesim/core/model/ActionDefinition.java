package com.devicesim.core.model;

import com.devicesim.core.condition.Condition;
import com.devicesim.core.effect.Effect;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A parameterized action. Preconditions are combined conjunctively; effects run in order.
 *
 * @param name                 action name
 * @param deviceType           device type the action belongs to, or {@link #GENERIC}
 * @param requiredCapabilities capabilities a device needs for a generic action to apply
 * @param parameters           declared parameters
 * @param preconditions        ordered preconditions
 * @param effects              ordered effects
 * @param description          free text for listings
 */
public record ActionDefinition(
    String name,
    String deviceType,
    List<String> requiredCapabilities,
    List<ParameterSpec> parameters,
    List<Condition> preconditions,
    List<Effect> effects,
    String description
) implements Serializable {

    public static final String GENERIC = "generic";

    public ActionDefinition {
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        preconditions = preconditions == null ? List.of() : List.copyOf(preconditions);
        effects = effects == null ? List.of() : List.copyOf(effects);
        description = description == null ? "" : description;
    }

    public boolean isGeneric() {
        return GENERIC.equals(deviceType);
    }

    public Optional<ParameterSpec> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }

    /**
     * Appends a device behavior's preconditions and effects to this action's own.
     */
    public ActionDefinition withBehavior(DeviceBehavior behavior, String forDeviceType) {
        var mergedPreconditions = new ArrayList<>(preconditions);
        mergedPreconditions.addAll(behavior.preconditions());
        var mergedEffects = new ArrayList<>(effects);
        mergedEffects.addAll(behavior.effects());
        return new ActionDefinition(name, forDeviceType, requiredCapabilities, parameters,
                mergedPreconditions, mergedEffects, description);
    }

    /**
     * An action defined only by a device behavior.
     */
    public static ActionDefinition fromBehavior(DeviceBehavior behavior, String forDeviceType) {
        return new ActionDefinition(behavior.actionName(), forDeviceType, List.of(), List.of(),
                behavior.preconditions(), behavior.effects(), "");
    }
}
