package com.devicesim.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declared structure of a device: parts with their attributes, global attributes, dependency
 * constraints and per-action behaviors.
 *
 * @param name        device type name
 * @param parts       part name to (attribute name to spec), in declaration order
 * @param globals     global attribute name to spec
 * @param constraints dependency constraints checked after every transition
 * @param behaviors   action name to device-specific behavior
 */
public record DeviceType(
    String name,
    Map<String, Map<String, AttributeSpec>> parts,
    Map<String, AttributeSpec> globals,
    List<DependencyConstraint> constraints,
    Map<String, DeviceBehavior> behaviors
) implements Serializable {

    public DeviceType {
        var partsCopy = new LinkedHashMap<String, Map<String, AttributeSpec>>();
        parts.forEach((part, attrs) -> partsCopy.put(part, Collections.unmodifiableMap(new LinkedHashMap<>(attrs))));
        parts = Collections.unmodifiableMap(partsCopy);
        globals = globals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(globals));
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        behaviors = behaviors == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(behaviors));
    }

    public Optional<AttributeSpec> attribute(AttributePath path) {
        if (path.isGlobal()) {
            return Optional.ofNullable(globals.get(path.attribute()));
        }
        var attrs = parts.get(path.part());
        return attrs == null ? Optional.empty() : Optional.ofNullable(attrs.get(path.attribute()));
    }

    /**
     * All attribute paths, parts first in declaration order, then globals.
     */
    public List<AttributePath> attributePaths() {
        var result = new ArrayList<AttributePath>();
        parts.forEach((part, attrs) -> attrs.keySet().forEach(a -> result.add(new AttributePath(part, a))));
        globals.keySet().forEach(a -> result.add(new AttributePath(null, a)));
        return result;
    }
}
