package com.devicesim.io;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.AttributeSpec;
import com.devicesim.core.model.CapabilitySpec;
import com.devicesim.core.model.ConstraintReset;
import com.devicesim.core.model.DependencyConstraint;
import com.devicesim.core.model.DeviceBehavior;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.ParameterSpec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Reads domains, capabilities, device types and actions from YAML into a {@link DefinitionCatalog}.
 * <p>
 * A path may name a single file or a directory, in which case every {@code *.yaml} / {@code *.yml}
 * file in it is read in name order. Domains and capabilities from all files are registered before
 * any device or action is parsed, so files may reference each other freely.
 */
public class DefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionLoader.class);

    private final ObjectMapper objectMapper;

    public DefinitionLoader() {
        this.objectMapper = new ObjectMapper(new YAMLFactory());
    }

    public DefinitionCatalog load(Path path) {
        var files = definitionFiles(path);
        var documents = new LinkedHashMap<Path, JsonNode>();
        for (Path file : files) {
            documents.put(file, read(file));
        }

        var builder = DefinitionCatalog.builder();
        documents.forEach((file, root) -> loadDomains(file, root, builder));
        documents.forEach((file, root) -> loadCapabilities(file, root, builder));
        var types = new LinkedHashMap<String, DeviceType>();
        documents.forEach((file, root) -> loadDevices(file, root, builder, types));
        types.values().forEach(builder::deviceType);
        var actionKeys = new HashSet<String>();
        documents.forEach((file, root) -> loadActions(file, root, builder, types, actionKeys));

        var catalog = builder.build();
        log.info("Loaded {} domains, {} capabilities, {} device types and {} actions from {} file(s) under {}",
                catalog.domains().size(), catalog.capabilities().size(), catalog.deviceTypes().size(),
                catalog.actionCount(), files.size(), path);
        return catalog;
    }

    private List<Path> definitionFiles(Path path) {
        if (!Files.exists(path)) {
            throw new DefinitionLoadException(path, "no such file or directory");
        }
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }
        try (Stream<Path> entries = Files.list(path)) {
            var files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.endsWith(".yaml") || name.endsWith(".yml");
                    })
                    .sorted()
                    .toList();
            if (files.isEmpty()) {
                throw new DefinitionLoadException(path, "directory contains no .yaml or .yml files");
            }
            return files;
        } catch (IOException e) {
            throw new DefinitionLoadException(path, "cannot list directory", e);
        }
    }

    private JsonNode read(Path file) {
        try {
            JsonNode root = objectMapper.readTree(file.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                return objectMapper.createObjectNode();
            }
            if (!root.isObject()) {
                throw new DefinitionLoadException(file, "top level must be a mapping");
            }
            return root;
        } catch (IOException e) {
            throw new DefinitionLoadException(file, "invalid YAML: " + e.getMessage(), e);
        }
    }

    // --- pass 1 ---

    private void loadDomains(Path file, JsonNode root, DefinitionCatalog.Builder builder) {
        var domains = root.get("domains");
        if (domains == null) {
            return;
        }
        requireMapping(file, domains, "domains");
        domains.fields().forEachRemaining(entry -> {
            String id = entry.getKey();
            if (builder.hasDomain(id)) {
                throw new DefinitionLoadException(file, "domain '" + id + "' is defined more than once");
            }
            if (!entry.getValue().isArray()) {
                throw new DefinitionLoadException(file, "domain '" + id + "' must be a list of levels");
            }
            try {
                builder.domain(new OrderedDomain(id, RuleParser.scalars(entry.getValue())));
            } catch (IllegalArgumentException e) {
                throw new DefinitionLoadException(file, e.getMessage(), e);
            }
        });
    }

    private void loadCapabilities(Path file, JsonNode root, DefinitionCatalog.Builder builder) {
        var capabilities = root.get("capabilities");
        if (capabilities == null) {
            return;
        }
        requireMapping(file, capabilities, "capabilities");
        capabilities.fields().forEachRemaining(entry -> {
            var attributes = new LinkedHashMap<AttributePath, String>();
            entry.getValue().path("attributes").fields().forEachRemaining(attr -> {
                String domainId = attr.getValue().asText();
                if (!builder.hasDomain(domainId)) {
                    throw new DefinitionLoadException(file, "capability '" + entry.getKey()
                            + "' references unknown domain '" + domainId + "'");
                }
                attributes.put(AttributePath.parse(attr.getKey()), domainId);
            });
            builder.capability(new CapabilitySpec(entry.getKey(), attributes));
        });
    }

    // --- pass 2 ---

    private void loadDevices(Path file, JsonNode root, DefinitionCatalog.Builder builder,
                             Map<String, DeviceType> types) {
        var devices = root.get("devices");
        if (devices == null) {
            return;
        }
        requireMapping(file, devices, "devices");
        var domains = builder.build().domains();
        devices.fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            if (types.containsKey(name)) {
                throw new DefinitionLoadException(file, "device type '" + name + "' is defined more than once");
            }
            types.put(name, deviceType(file, name, entry.getValue(), builder, domains));
        });
    }

    private DeviceType deviceType(Path file, String name, JsonNode node, DefinitionCatalog.Builder builder,
                                  Map<String, OrderedDomain> domains) {
        String where = "device '" + name + "'";
        var parts = new LinkedHashMap<String, Map<String, AttributeSpec>>();
        node.path("parts").fields().forEachRemaining(part -> {
            var attrs = new LinkedHashMap<String, AttributeSpec>();
            part.getValue().path("attributes").fields().forEachRemaining(attr -> attrs.put(attr.getKey(),
                    attributeSpec(file, where + " part '" + part.getKey() + "'", attr.getKey(), attr.getValue(),
                            builder, domains)));
            parts.put(part.getKey(), attrs);
        });
        var globals = new LinkedHashMap<String, AttributeSpec>();
        node.path("global_attributes").fields().forEachRemaining(attr -> globals.put(attr.getKey(),
                attributeSpec(file, where, attr.getKey(), attr.getValue(), builder, domains)));

        // partial type so rules can resolve the attributes declared above
        var skeleton = new DeviceType(name, parts, globals, List.of(), Map.of());
        var parser = new RuleParser(file);
        var attributeScope = new RuleParser.Scope(where, path -> domainOf(skeleton, path, domains), null);

        var constraints = new ArrayList<DependencyConstraint>();
        for (JsonNode constraint : node.path("constraints")) {
            constraints.add(constraint(file, where, constraint, parser, attributeScope, skeleton, domains));
        }

        var behaviors = new LinkedHashMap<String, DeviceBehavior>();
        node.path("behaviors").fields().forEachRemaining(behavior -> {
            var scope = new RuleParser.Scope(where + " behavior '" + behavior.getKey() + "'",
                    attributeScope.domainOf(), null);
            behaviors.put(behavior.getKey(), new DeviceBehavior(behavior.getKey(),
                    parser.conditions(behavior.getValue().get("preconditions"), scope),
                    parser.effects(behavior.getValue().get("effects"), scope)));
        });

        return new DeviceType(name, parts, globals, constraints, behaviors);
    }

    private AttributeSpec attributeSpec(Path file, String where, String name, JsonNode node,
                                        DefinitionCatalog.Builder builder, Map<String, OrderedDomain> domains) {
        String domainId = node.path("domain").asText(null);
        if (domainId == null || domainId.isBlank()) {
            throw new DefinitionLoadException(file, where + ": attribute '" + name + "' has no domain");
        }
        var domain = domains.get(domainId);
        if (domain == null) {
            throw new DefinitionLoadException(file, where + ": attribute '" + name
                    + "' references unknown domain '" + domainId + "'");
        }
        String defaultValue = node.hasNonNull("default")
                ? RuleParser.scalar(node.get("default"))
                : domain.levels().get(0);
        if (!OrderedDomain.UNKNOWN.equals(defaultValue) && !domain.contains(defaultValue)) {
            throw new DefinitionLoadException(file, where + ": default '" + defaultValue + "' of attribute '"
                    + name + "' is not in domain '" + domainId + "' " + domain.levels());
        }
        boolean mutable = !node.has("mutable") || node.get("mutable").asBoolean(true);
        return builder.intern(new AttributeSpec(name, domainId, mutable, defaultValue));
    }

    private DependencyConstraint constraint(Path file, String where, JsonNode node, RuleParser parser,
                                            RuleParser.Scope scope, DeviceType type,
                                            Map<String, OrderedDomain> domains) {
        String kind = node.path("type").asText("dependency");
        if (!"dependency".equals(kind)) {
            throw new DefinitionLoadException(file, where + ": unsupported constraint type '" + kind + "'");
        }
        Condition condition = parser.condition(node.get("condition"), scope);
        Condition requires = parser.condition(node.get("requires"), scope);
        var resets = new ArrayList<ConstraintReset>();
        for (JsonNode reset : node.path("on_violation")) {
            var target = AttributePath.parse(reset.path("target").asText());
            var domain = domainOf(type, target, domains).orElseThrow(() -> new DefinitionLoadException(file,
                    where + ": on_violation target '" + target + "' is not a declared attribute"));
            String value = reset.hasNonNull("value") ? RuleParser.scalar(reset.get("value")) : null;
            if (value != null && !domain.contains(value)) {
                throw new DefinitionLoadException(file, where + ": on_violation value '" + value + "' for "
                        + target + " is not in domain '" + domain.id() + "'");
            }
            resets.add(new ConstraintReset(target, value, reset.path("clear_trend").asBoolean(false)));
        }
        return new DependencyConstraint(condition, requires, resets);
    }

    private void loadActions(Path file, JsonNode root, DefinitionCatalog.Builder builder,
                             Map<String, DeviceType> types, Set<String> seen) {
        var actions = root.get("actions");
        if (actions == null) {
            return;
        }
        if (!actions.isArray()) {
            throw new DefinitionLoadException(file, "'actions' must be a list");
        }
        var catalog = builder.build();
        var parser = new RuleParser(file);
        for (JsonNode node : actions) {
            String name = node.path("name").asText(null);
            if (name == null || name.isBlank()) {
                throw new DefinitionLoadException(file, "action without a name");
            }
            String device = node.path("device").asText(ActionDefinition.GENERIC);
            if (!seen.add(device + "/" + name)) {
                throw new DefinitionLoadException(file, "action '" + name + "' for '" + device
                        + "' is defined more than once");
            }
            var capabilities = node.has("required_capabilities")
                    ? RuleParser.scalars(node.get("required_capabilities"))
                    : List.<String>of();
            for (String capability : capabilities) {
                if (!catalog.capabilities().containsKey(capability)) {
                    throw new DefinitionLoadException(file, "action '" + name
                            + "' requires unknown capability '" + capability + "'");
                }
            }

            var parameters = new ArrayList<ParameterSpec>();
            node.path("parameters").fields().forEachRemaining(p -> parameters.add(new ParameterSpec(p.getKey(),
                    p.getValue().has("choices") ? RuleParser.scalars(p.getValue().get("choices")) : List.of(),
                    p.getValue().path("required").asBoolean(true))));
            Set<String> parameterNames = new HashSet<>();
            parameters.forEach(p -> parameterNames.add(p.name()));

            var scope = new RuleParser.Scope("action '" + name + "'",
                    actionDomains(file, name, device, capabilities, types, catalog), parameterNames);
            builder.action(new ActionDefinition(name, device, capabilities, parameters,
                    parser.conditions(node.get("preconditions"), scope),
                    parser.effects(node.get("effects"), scope),
                    node.path("description").asText("")));
        }
    }

    /**
     * Attributes an action may reference: the device's own for device-specific actions, the
     * required capabilities' for generic ones.
     */
    private Function<AttributePath, Optional<OrderedDomain>> actionDomains(
            Path file, String action, String device, List<String> capabilities,
            Map<String, DeviceType> types, DefinitionCatalog catalog) {
        if (!ActionDefinition.GENERIC.equals(device)) {
            var type = types.get(device);
            if (type == null) {
                throw new DefinitionLoadException(file, "action '" + action + "' targets unknown device type '"
                        + device + "'");
            }
            return path -> domainOf(type, path, catalog.domains());
        }
        var scoped = new LinkedHashMap<AttributePath, OrderedDomain>();
        for (String capability : capabilities) {
            catalog.capabilities().get(capability).attributes()
                    .forEach((path, domainId) -> scoped.put(path, catalog.requireDomain(domainId)));
        }
        return path -> Optional.ofNullable(scoped.get(path));
    }

    private static Optional<OrderedDomain> domainOf(DeviceType type, AttributePath path,
                                                    Map<String, OrderedDomain> domains) {
        return type.attribute(path).map(spec -> domains.get(spec.domainId()));
    }

    private static void requireMapping(Path file, JsonNode node, String field) {
        if (!node.isObject()) {
            throw new DefinitionLoadException(file, "'" + field + "' must be a mapping");
        }
    }
}
