package com.devicesim.core.instance;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.AttributeSpec;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a fresh instance of a device type with every attribute at its declared default.
 */
public final class DeviceInstanceFactory {

    private DeviceInstanceFactory() {}

    public static DeviceInstance instantiate(DeviceType type) {
        var parts = new LinkedHashMap<String, Map<String, AttributeInstance>>();
        type.parts().forEach((part, specs) -> parts.put(part, instances(specs)));
        return new DeviceInstance(type.name(), parts, instances(type.globals()));
    }

    /**
     * Fresh instance with overrides applied. A value of {@code unknown} marks the attribute unobserved.
     *
     * @throws IllegalArgumentException for an undeclared attribute or a value outside its domain
     */
    public static DeviceInstance instantiate(DefinitionCatalog catalog, DeviceType type,
                                             Map<String, String> initialValues, List<String> unknownAttributes) {
        var instance = instantiate(type);
        initialValues.forEach((rawPath, value) -> {
            var path = AttributePath.parse(rawPath);
            var attribute = require(instance, type, rawPath, path);
            if (OrderedDomain.UNKNOWN.equals(value)) {
                attribute.markUnknown();
                return;
            }
            var domain = catalog.domainOf(type, path)
                    .orElseThrow(() -> new IllegalArgumentException("No value domain for " + rawPath));
            if (!domain.contains(value)) {
                throw new IllegalArgumentException("Invalid value '" + value + "' for " + rawPath
                        + "; expected one of " + domain.levels());
            }
            attribute.writeValue(value);
        });
        for (String rawPath : unknownAttributes) {
            require(instance, type, rawPath, AttributePath.parse(rawPath)).markUnknown();
        }
        return instance;
    }

    private static AttributeInstance require(DeviceInstance instance, DeviceType type, String rawPath, AttributePath path) {
        return instance.find(path)
                .orElseThrow(() -> new IllegalArgumentException("Unknown attribute '" + rawPath + "' on " + type.name()));
    }

    private static Map<String, AttributeInstance> instances(Map<String, AttributeSpec> specs) {
        var result = new LinkedHashMap<String, AttributeInstance>();
        specs.forEach((name, spec) -> result.put(name, new AttributeInstance(spec, spec.defaultValue())));
        return result;
    }
}
