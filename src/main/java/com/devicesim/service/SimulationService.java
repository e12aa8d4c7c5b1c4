package com.devicesim.service;

import com.devicesim.config.SimulatorProperties;
import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.engine.ClarificationResolver;
import com.devicesim.core.engine.ClarificationSession;
import com.devicesim.core.engine.SimulationEngine;
import com.devicesim.core.engine.SimulationRequest;
import com.devicesim.core.engine.TransitionEvaluator;
import com.devicesim.core.engine.TransitionOutcome;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.instance.DeviceInstanceFactory;
import com.devicesim.core.metrics.SimulationMetrics;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.snapshot.SnapshotCapture;
import com.devicesim.core.snapshot.WorldSnapshot;
import com.devicesim.io.DefinitionLoader;
import com.devicesim.io.GraphSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for the command line: loads and caches definition catalogs, runs linear
 * transitions with clarification, and runs branching simulations.
 */
@Service
public class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final DefinitionLoader loader;
    private final GraphSerializer serializer;
    private final SimulatorProperties properties;
    private final SimulationMetrics metrics;
    private final Map<Path, DefinitionCatalog> catalogs = new ConcurrentHashMap<>();

    public SimulationService(DefinitionLoader loader, GraphSerializer serializer,
                             SimulatorProperties properties, SimulationMetrics metrics) {
        this.loader = loader;
        this.serializer = serializer;
        this.properties = properties;
        this.metrics = metrics;
    }

    /**
     * Outcome of a linear transition.
     *
     * @param before  snapshot of the starting instance
     * @param outcome final outcome after clarification
     * @param after   snapshot of the resulting instance, {@code null} when no effect ran
     * @param answers clarification answers that were accepted
     */
    public record ApplyResult(WorldSnapshot before, TransitionOutcome outcome, WorldSnapshot after,
                              Map<AttributePath, String> answers) {}

    /**
     * Catalog for {@code definitionsPath}, or for the configured default path when {@code null}.
     */
    public DefinitionCatalog catalog(String definitionsPath) {
        Path path = resolveDefinitions(definitionsPath);
        return catalogs.computeIfAbsent(path.toAbsolutePath().normalize(), loader::load);
    }

    public Path resolveDefinitions(String definitionsPath) {
        return Path.of(definitionsPath != null ? definitionsPath : properties.getDefinitionsPath());
    }

    public ApplyResult apply(String definitionsPath, String deviceType, ActionRequest request,
                             Map<String, String> initialValues, List<String> unknownAttributes,
                             ClarificationResolver resolver) {
        var catalog = catalog(definitionsPath);
        var type = catalog.requireDeviceType(deviceType);
        var action = catalog.resolveAction(type.name(), request.name())
                .orElseThrow(() -> new CatalogException("Unknown action '" + request.name() + "' for device type "
                        + type.name() + ". Available: " + catalog.availableActions(type.name())));
        var instance = DeviceInstanceFactory.instantiate(catalog, type, initialValues, unknownAttributes);
        var capture = new SnapshotCapture(catalog);
        var before = capture.capture(instance);

        var session = new ClarificationSession(catalog, new TransitionEvaluator(catalog),
                properties.getClarificationMaxAttempts());
        ClarificationResolver counting = (question, attribute, choices) -> {
            var answer = resolver.answer(question, attribute, choices);
            metrics.recordClarification(answer.isPresent());
            return answer;
        };
        var result = session.run(instance, action, request.parameters(), counting);
        log.info("Applied {} to {}: {}", request.describe(), type.name(), result.outcome().status().wireName());
        var after = result.outcome().after() != null ? capture.capture(result.outcome().after()) : null;
        return new ApplyResult(before, result.outcome(), after, result.answers());
    }

    public SimulationGraph simulate(String definitionsPath, SimulationRequest request) {
        var catalog = catalog(definitionsPath);
        var engine = new SimulationEngine(catalog, metrics, properties.getLayerWarningThreshold());
        return engine.run(request);
    }

    /**
     * Writes the graph; a bare file name lands in the configured output directory.
     */
    public Path save(SimulationGraph graph, String file) {
        Path target = Path.of(file);
        if (target.getParent() == null) {
            target = Path.of(properties.getOutputDirectory()).resolve(target);
        }
        serializer.write(graph, target);
        return target;
    }

    public SimulationGraph read(Path file) {
        return serializer.read(file);
    }
}
