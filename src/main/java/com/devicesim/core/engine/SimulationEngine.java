package com.devicesim.core.engine;

import com.devicesim.core.branch.BranchContext;
import com.devicesim.core.branch.BranchPlan;
import com.devicesim.core.branch.BranchPlanner;
import com.devicesim.core.branch.DeMorganNegator;
import com.devicesim.core.branch.PostconditionBrancher;
import com.devicesim.core.branch.UnknownDetector;
import com.devicesim.core.branch.ValueSetCalculator;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.graph.GraphStatistics;
import com.devicesim.core.graph.LayerCache;
import com.devicesim.core.graph.NodeFactory;
import com.devicesim.core.graph.SimulationGraph;
import com.devicesim.core.graph.TreeNode;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.instance.DeviceInstanceFactory;
import com.devicesim.core.logging.MdcContext;
import com.devicesim.core.metrics.SimulationMetrics;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.ActionRequest;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.NodeStatus;
import com.devicesim.core.snapshot.ConstraintFixup;
import com.devicesim.core.snapshot.SnapshotCapture;
import com.devicesim.core.snapshot.SnapshotDiff;
import com.devicesim.core.snapshot.SnapshotNarrower;
import com.devicesim.core.snapshot.WorldSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Drives a branching simulation: starting from one instance, applies each requested action to
 * every open branch and collects the distinct resulting states as the next layer.
 * <p>
 * An action whose preconditions and guards reference only known attributes is applied
 * linearly. Otherwise every reachable outcome becomes its own child node. Identical states
 * reached within one layer share a node. Total node count is bounded only by the product of
 * the per-action branch factors.
 */
public class SimulationEngine {

    private static final Logger log = LoggerFactory.getLogger(SimulationEngine.class);
    private static final DateTimeFormatter ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final int DEFAULT_LAYER_WARNING_THRESHOLD = 256;

    private final DefinitionCatalog catalog;
    private final SimulationMetrics metrics;
    private final int layerWarningThreshold;
    private final TransitionEvaluator evaluator;
    private final SnapshotCapture capture;
    private final SnapshotNarrower narrower;
    private final ConstraintFixup fixup;
    private final ConstraintSplitter splitter;
    private final UnknownDetector detector;
    private final BranchPlanner planner;
    private final NodeFactory nodeFactory;

    public SimulationEngine(DefinitionCatalog catalog, SimulationMetrics metrics, int layerWarningThreshold) {
        this.catalog = catalog;
        this.metrics = metrics;
        this.layerWarningThreshold = layerWarningThreshold;
        this.evaluator = new TransitionEvaluator(catalog);
        this.capture = new SnapshotCapture(catalog);
        this.narrower = new SnapshotNarrower(catalog);
        this.fixup = new ConstraintFixup(catalog);
        this.splitter = new ConstraintSplitter(new ConstraintChecker(evaluator.conditions()));
        this.detector = new UnknownDetector();
        var calculator = new ValueSetCalculator();
        var negator = new DeMorganNegator(calculator);
        this.planner = new BranchPlanner(negator, new PostconditionBrancher(calculator, negator));
        this.nodeFactory = new NodeFactory();
    }

    public SimulationEngine(DefinitionCatalog catalog) {
        this(catalog, new SimulationMetrics(new SimpleMeterRegistry()), DEFAULT_LAYER_WARNING_THRESHOLD);
    }

    private record Leaf(TreeNode node, DeviceInstance instance) {}

    public SimulationGraph run(SimulationRequest request) {
        String simulationId = request.simulationId() != null
                ? request.simulationId()
                : "sim_" + LocalDateTime.now().format(ID_FORMAT);
        long start = System.currentTimeMillis();
        MdcContext.setSimulation(simulationId, request.deviceType());
        try {
            DeviceType type = catalog.requireDeviceType(request.deviceType());
            DeviceInstance instance = DeviceInstanceFactory.instantiate(catalog, type,
                    request.initialValues(), request.unknownAttributes());

            var graph = new SimulationGraph(simulationId, type.name(), request.actions());
            var root = TreeNode.root(graph.nextNodeId(), capture.capture(instance));
            graph.addNode(root);
            log.info("Simulation {} started: {} with {} action(s)", simulationId, type.name(), request.actions().size());

            List<Leaf> leaves = List.of(new Leaf(root, instance));
            int layer = 0;
            for (ActionRequest action : request.actions()) {
                layer++;
                MdcContext.setLayer(layer, action.name());
                var cache = new LayerCache();
                var seen = new HashSet<String>();
                var next = new ArrayList<Leaf>();
                for (Leaf leaf : leaves) {
                    for (NodeFactory.Result result : expand(graph, cache, type, leaf, action)) {
                        if (seen.add(result.node().id())) {
                            next.add(new Leaf(result.node(), result.instance()));
                        }
                    }
                }
                log.info("Layer {} ({}): {} branch(es) -> {} node(s)", layer, action.describe(), leaves.size(), next.size());
                if (next.size() > layerWarningThreshold) {
                    log.warn("Layer {} holds {} nodes, above the warning threshold of {}",
                            layer, next.size(), layerWarningThreshold);
                }
                metrics.recordLayerWidth(next.size());
                leaves = next;
                MdcContext.clearLayer();
            }

            var stats = GraphStatistics.of(graph);
            metrics.recordGraph(stats);
            metrics.recordSimulationDuration(type.name(), System.currentTimeMillis() - start);
            log.info("Simulation {} finished: {} node(s), {} leaf node(s), {} merged",
                    simulationId, stats.totalNodes(), stats.leafNodes(), stats.mergedNodes());
            return graph;
        } finally {
            MdcContext.clear();
        }
    }

    private List<NodeFactory.Result> expand(SimulationGraph graph, LayerCache cache, DeviceType type,
                                            Leaf leaf, ActionRequest request) {
        var resolved = catalog.resolveAction(type.name(), request.name());
        if (resolved.isEmpty()) {
            log.warn("Action '{}' is not defined for {}", request.name(), type.name());
            return List.of(errorNode(graph, cache, leaf, request,
                    "Unknown action '" + request.name() + "' for device type " + type.name()));
        }
        ActionDefinition action = resolved.get();
        Map<String, String> parameters = request.parameters();

        try {
            if (evaluator.validateParameters(action, parameters) != null) {
                return List.of(linear(graph, cache, leaf, action, parameters));
            }
            var ctx = new BranchContext(catalog, type, leaf.node().snapshot(), parameters);
            var detection = detector.detect(action, ctx);
            if (!detection.hasUnknowns()) {
                return List.of(linear(graph, cache, leaf, action, parameters));
            }
            if (detection.preconditionUnknowns().isEmpty()) {
                var outcome = evaluator.apply(leaf.instance(), action, parameters);
                if (outcome.status() == NodeStatus.REJECTED || outcome.status() == NodeStatus.ERROR) {
                    return List.of(linear(graph, cache, leaf, action, parameters));
                }
            }

            var plans = planner.plan(action, detection, ctx);
            if (plans.isEmpty()) {
                log.warn("No branch could be derived for {} from {}", action.name(), leaf.node().id());
                return List.of(errorNode(graph, cache, leaf, request, "No branches could be derived for action " + action.name()));
            }
            if (plans.size() == 1 && !plans.get(0).success() && plans.get(0).configuration().isUnconstrained()) {
                return List.of(linear(graph, cache, leaf, action, parameters));
            }

            log.debug("Branching {} from {} on {} / {}: {} child(ren)", action.name(), leaf.node().id(),
                    detection.preconditionUnknowns(), detection.postconditionUnknowns(), plans.size());
            var results = new ArrayList<NodeFactory.Result>();
            for (BranchPlan plan : plans) {
                if (plan.success()) {
                    results.addAll(successNodes(graph, cache, type, leaf, action, parameters, plan));
                } else {
                    results.add(failNode(graph, cache, type, leaf, action, parameters, plan));
                }
            }
            return results;
        } catch (EvaluationException e) {
            log.warn("Action {} failed on {}: {}", action.name(), leaf.node().id(), e.getMessage());
            return List.of(errorNode(graph, cache, leaf, request, e.getMessage()));
        }
    }

    private NodeFactory.Result linear(SimulationGraph graph, LayerCache cache, Leaf leaf,
                                      ActionDefinition action, Map<String, String> parameters) {
        var parent = leaf.node();
        var outcome = evaluator.apply(leaf.instance(), action, parameters);
        if (outcome.after() == null) {
            var arrival = new NodeFactory.Arrival(parent.id(), action.name(), parameters, outcome.status(),
                    outcome.message(), null, List.of());
            return record(nodeFactory.createOrMerge(graph, cache, parent.snapshot(), leaf.instance().deepCopy(), arrival));
        }
        var written = union(outcome.valueWrites(), outcome.trendWrites());
        var snapshot = capture.capture(outcome.after(), parent.snapshot(), written);
        var changes = SnapshotDiff.diff(parent.snapshot(), snapshot, outcome.valueWrites(), outcome.trendWrites(), Set.of());
        var arrival = new NodeFactory.Arrival(parent.id(), action.name(), parameters, outcome.status(),
                outcome.message(), null, changes);
        return record(nodeFactory.createOrMerge(graph, cache, snapshot, outcome.after(), arrival));
    }

    /**
     * Applies the effects to a representative of the branch (first value of every narrowed set),
     * then restores the attributes left as multi-valued sets before snapshotting. Constraints are
     * judged on the narrowed snapshot, which may split it into a violating and a satisfying state.
     */
    private List<NodeFactory.Result> successNodes(SimulationGraph graph, LayerCache cache, DeviceType type, Leaf leaf,
                                                  ActionDefinition action, Map<String, String> parameters, BranchPlan plan) {
        var parent = leaf.node();
        var constraints = plan.configuration().constraints();
        var representative = leaf.instance().deepCopy();
        constraints.forEach((path, values) -> representative.attribute(path).writeValue(values.get(0)));

        var outcome = evaluator.applyEffects(representative, action, parameters);
        if (outcome.after() == null) {
            var arrival = new NodeFactory.Arrival(parent.id(), action.name(), parameters, outcome.status(),
                    outcome.message(), plan.condition(), List.of());
            return List.of(record(nodeFactory.createOrMerge(graph, cache, parent.snapshot(), leaf.instance().deepCopy(), arrival)));
        }

        var carried = outcome.after();
        constraints.forEach((path, values) -> {
            if (values.size() > 1 && !outcome.wrote(path)) {
                carried.restore(path, leaf.instance().attribute(path));
            }
        });
        var written = union(outcome.valueWrites(), outcome.trendWrites());
        WorldSnapshot snapshot = capture.capture(carried, parent.snapshot(), written);
        snapshot = narrower.narrow(snapshot, type, constraints, outcome.valueWrites(), outcome.trendWrites());

        var splittable = new LinkedHashSet<>(type.attributePaths());
        splittable.removeAll(written);
        var results = new ArrayList<NodeFactory.Result>();
        for (ConstraintSplitter.World world : splitter.judge(type, snapshot, carried, parameters, splittable)) {
            var status = world.violations().isEmpty() ? NodeStatus.OK : NodeStatus.CONSTRAINT_VIOLATED;
            String message = world.violations().isEmpty() ? null : String.join("; ", world.violations());
            var changes = SnapshotDiff.diff(parent.snapshot(), world.snapshot(),
                    outcome.valueWrites(), outcome.trendWrites(), Set.of());
            var arrival = new NodeFactory.Arrival(parent.id(), action.name(), parameters, status,
                    message, plan.condition(), changes);
            results.add(record(nodeFactory.createOrMerge(graph, cache, world.snapshot(), world.instance(), arrival)));
        }
        return results;
    }

    private NodeFactory.Result failNode(SimulationGraph graph, LayerCache cache, DeviceType type, Leaf leaf,
                                        ActionDefinition action, Map<String, String> parameters, BranchPlan plan) {
        var parent = leaf.node();
        var constraints = plan.configuration().constraints();
        var carried = leaf.instance().deepCopy();
        constraints.forEach((path, values) -> {
            if (values.size() == 1) {
                carried.attribute(path).writeValue(values.get(0));
            }
        });
        WorldSnapshot snapshot = capture.capture(carried, parent.snapshot(), Set.of());
        snapshot = narrower.narrow(snapshot, type, constraints);
        var repaired = fixup.repair(snapshot, type, carried);

        var changes = SnapshotDiff.diff(parent.snapshot(), repaired.snapshot(), Set.of(), Set.of(), repaired.repaired());
        var arrival = new NodeFactory.Arrival(parent.id(), action.name(), parameters, NodeStatus.REJECTED,
                plan.failureMessage(), plan.condition(), changes);
        return record(nodeFactory.createOrMerge(graph, cache, repaired.snapshot(), carried, arrival));
    }

    private NodeFactory.Result errorNode(SimulationGraph graph, LayerCache cache, Leaf leaf,
                                         ActionRequest request, String message) {
        var parent = leaf.node();
        var arrival = new NodeFactory.Arrival(parent.id(), request.name(), request.parameters(), NodeStatus.ERROR,
                message, null, List.of());
        return record(nodeFactory.createOrMerge(graph, cache, parent.snapshot(), leaf.instance().deepCopy(), arrival));
    }

    private NodeFactory.Result record(NodeFactory.Result result) {
        if (result.merged()) {
            metrics.recordNodeMerged();
        } else {
            metrics.recordNodeCreated(result.node().status());
        }
        return result;
    }

    private static Set<AttributePath> union(Set<AttributePath> a, Set<AttributePath> b) {
        var result = new LinkedHashSet<>(a);
        result.addAll(b);
        return result;
    }
}
