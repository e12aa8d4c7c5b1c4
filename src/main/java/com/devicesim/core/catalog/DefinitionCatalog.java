package com.devicesim.core.catalog;

import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.AttributeSpec;
import com.devicesim.core.model.CapabilitySpec;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable bundle of everything loaded before a simulation: value domains, capabilities,
 * device types and actions. Passed explicitly to the evaluator and the engine.
 */
public final class DefinitionCatalog {

    private final Map<String, OrderedDomain> domains;
    private final Map<String, CapabilitySpec> capabilities;
    private final Map<String, DeviceType> deviceTypes;
    private final Map<String, Map<String, ActionDefinition>> actionsByDeviceType;

    private DefinitionCatalog(Builder builder) {
        this.domains = Collections.unmodifiableMap(new LinkedHashMap<>(builder.domains));
        this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(builder.capabilities));
        this.deviceTypes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.deviceTypes));
        var actions = new LinkedHashMap<String, Map<String, ActionDefinition>>();
        builder.actions.forEach((type, byName) ->
                actions.put(type, Collections.unmodifiableMap(new LinkedHashMap<>(byName))));
        this.actionsByDeviceType = Collections.unmodifiableMap(actions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, OrderedDomain> domains() {
        return domains;
    }

    public Map<String, CapabilitySpec> capabilities() {
        return capabilities;
    }

    public Map<String, DeviceType> deviceTypes() {
        return deviceTypes;
    }

    public Optional<OrderedDomain> domain(String id) {
        return Optional.ofNullable(domains.get(id));
    }

    public OrderedDomain requireDomain(String id) {
        return domain(id).orElseThrow(() -> new CatalogException("Unknown value domain: " + id));
    }

    public DeviceType requireDeviceType(String name) {
        var type = deviceTypes.get(name);
        if (type == null) {
            throw new CatalogException("Unknown device type: " + name + ". Known types: " + deviceTypes.keySet());
        }
        return type;
    }

    /**
     * Domain of an attribute on a device type, empty when the attribute or its domain is undeclared.
     */
    public Optional<OrderedDomain> domainOf(DeviceType type, AttributePath path) {
        return type.attribute(path).map(AttributeSpec::domainId).flatMap(this::domain);
    }

    public int actionCount() {
        return actionsByDeviceType.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Whether every attribute the capability requires exists on the device with the required domain.
     */
    public boolean supports(DeviceType type, String capabilityName) {
        var capability = capabilities.get(capabilityName);
        if (capability == null) {
            return false;
        }
        for (var entry : capability.attributes().entrySet()) {
            var spec = type.attribute(entry.getKey());
            if (spec.isEmpty() || !spec.get().domainId().equals(entry.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves an action for a device type: its own action merged with the device behavior,
     * then a generic action whose capabilities the device supports, then a behavior-only action.
     */
    public Optional<ActionDefinition> resolveAction(String deviceTypeName, String actionName) {
        var type = deviceTypes.get(deviceTypeName);
        if (type == null) {
            return Optional.empty();
        }
        var behavior = type.behaviors().get(actionName);

        var own = actionsByDeviceType.getOrDefault(deviceTypeName, Map.of()).get(actionName);
        if (own != null) {
            return Optional.of(behavior != null ? own.withBehavior(behavior, deviceTypeName) : own);
        }

        var generic = actionsByDeviceType.getOrDefault(ActionDefinition.GENERIC, Map.of()).get(actionName);
        if (generic != null && generic.requiredCapabilities().stream().allMatch(c -> supports(type, c))) {
            return Optional.of(behavior != null ? generic.withBehavior(behavior, deviceTypeName) : generic);
        }

        if (behavior != null) {
            return Optional.of(ActionDefinition.fromBehavior(behavior, deviceTypeName));
        }
        return Optional.empty();
    }

    /**
     * Names of every action that resolves for the device type, sorted.
     */
    public List<String> availableActions(String deviceTypeName) {
        var names = new ArrayList<String>();
        actionsByDeviceType.values().forEach(byName -> byName.keySet().forEach(n -> {
            if (!names.contains(n)) {
                names.add(n);
            }
        }));
        var type = deviceTypes.get(deviceTypeName);
        if (type != null) {
            type.behaviors().keySet().forEach(n -> {
                if (!names.contains(n)) {
                    names.add(n);
                }
            });
        }
        return names.stream()
                .filter(n -> resolveAction(deviceTypeName, n).isPresent())
                .sorted()
                .toList();
    }

    /**
     * Collects definitions and interns attribute specs so equal specs share one object.
     */
    public static final class Builder {

        private final Map<String, OrderedDomain> domains = new LinkedHashMap<>();
        private final Map<String, CapabilitySpec> capabilities = new LinkedHashMap<>();
        private final Map<String, DeviceType> deviceTypes = new LinkedHashMap<>();
        private final Map<String, Map<String, ActionDefinition>> actions = new LinkedHashMap<>();
        private final Map<AttributeSpec, AttributeSpec> specPool = new HashMap<>();

        private Builder() {}

        public Builder domain(OrderedDomain domain) {
            domains.put(domain.id(), domain);
            return this;
        }

        public Builder capability(CapabilitySpec capability) {
            capabilities.put(capability.name(), capability);
            return this;
        }

        public Builder deviceType(DeviceType type) {
            deviceTypes.put(type.name(), type);
            return this;
        }

        public Builder action(ActionDefinition action) {
            actions.computeIfAbsent(action.deviceType(), k -> new LinkedHashMap<>()).put(action.name(), action);
            return this;
        }

        public AttributeSpec intern(AttributeSpec spec) {
            return specPool.computeIfAbsent(spec, s -> s);
        }

        public boolean hasDomain(String id) {
            return domains.containsKey(id);
        }

        public DefinitionCatalog build() {
            return new DefinitionCatalog(this);
        }
    }
}
