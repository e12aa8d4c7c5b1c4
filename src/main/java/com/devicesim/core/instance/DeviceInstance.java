package com.devicesim.core.instance;

import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.model.AttributePath;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One concrete device: per-part attribute instances plus global attributes.
 * Each branch of a simulation owns its own copy.
 */
public class DeviceInstance {

    private final String typeName;
    private final Map<String, Map<String, AttributeInstance>> parts;
    private final Map<String, AttributeInstance> globals;

    public DeviceInstance(String typeName,
                          Map<String, Map<String, AttributeInstance>> parts,
                          Map<String, AttributeInstance> globals) {
        this.typeName = typeName;
        this.parts = parts;
        this.globals = globals;
    }

    public String typeName() {
        return typeName;
    }

    public Optional<AttributeInstance> find(AttributePath path) {
        if (path.isGlobal()) {
            return Optional.ofNullable(globals.get(path.attribute()));
        }
        var attrs = parts.get(path.part());
        return attrs == null ? Optional.empty() : Optional.ofNullable(attrs.get(path.attribute()));
    }

    public AttributeInstance attribute(AttributePath path) {
        return find(path).orElseThrow(() -> new EvaluationException(
                "Unknown attribute '" + path + "' on " + typeName));
    }

    /**
     * Replaces an attribute's state with a copy of {@code source}.
     */
    public void restore(AttributePath path, AttributeInstance source) {
        var copy = source.copy();
        if (path.isGlobal()) {
            requirePresent(globals, path).put(path.attribute(), copy);
        } else {
            requirePresent(parts.get(path.part()), path).put(path.attribute(), copy);
        }
    }

    private Map<String, AttributeInstance> requirePresent(Map<String, AttributeInstance> attrs, AttributePath path) {
        if (attrs == null || !attrs.containsKey(path.attribute())) {
            throw new EvaluationException("Unknown attribute '" + path + "' on " + typeName);
        }
        return attrs;
    }

    /**
     * Attribute paths in declaration order, parts first.
     */
    public List<AttributePath> paths() {
        var result = new ArrayList<AttributePath>();
        parts.forEach((part, attrs) -> attrs.keySet().forEach(a -> result.add(new AttributePath(part, a))));
        globals.keySet().forEach(a -> result.add(new AttributePath(null, a)));
        return result;
    }

    public DeviceInstance deepCopy() {
        var partsCopy = new LinkedHashMap<String, Map<String, AttributeInstance>>();
        parts.forEach((part, attrs) -> {
            var attrsCopy = new LinkedHashMap<String, AttributeInstance>();
            attrs.forEach((name, attr) -> attrsCopy.put(name, attr.copy()));
            partsCopy.put(part, attrsCopy);
        });
        var globalsCopy = new LinkedHashMap<String, AttributeInstance>();
        globals.forEach((name, attr) -> globalsCopy.put(name, attr.copy()));
        return new DeviceInstance(typeName, partsCopy, globalsCopy);
    }
}
