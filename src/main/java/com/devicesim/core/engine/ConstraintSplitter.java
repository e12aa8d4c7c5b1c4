package com.devicesim.core.engine;

import com.devicesim.core.condition.ConditionDescriber;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DependencyConstraint;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.snapshot.SnapshotValue;
import com.devicesim.core.snapshot.WorldSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Judges dependency constraints against a narrowed snapshot rather than one concrete instance.
 * <p>
 * Every combination of the value-sets a constraint reads is checked. A constraint violated by
 * all of them is a violation of the state. When one attribute alone decides the outcome, its
 * set is split into a violating and a satisfying world. Any other mix is not reported.
 */
public class ConstraintSplitter {

    private static final Logger log = LoggerFactory.getLogger(ConstraintSplitter.class);
    static final int MAX_COMBINATIONS = 4096;

    private final ConstraintChecker checker;

    public ConstraintSplitter(ConstraintChecker checker) {
        this.checker = checker;
    }

    /**
     * One resulting state.
     *
     * @param snapshot   narrowed snapshot, possibly split further
     * @param instance   instance carried forward; singleton splits are written into it
     * @param violations messages of the constraints violated for every value left
     */
    public record World(WorldSnapshot snapshot, DeviceInstance instance, List<String> violations) {

        public World {
            violations = List.copyOf(violations);
        }
    }

    /**
     * @param splittable attributes whose sets may be split; attributes the action set a trend on
     *                   are left whole
     */
    public List<World> judge(DeviceType type, WorldSnapshot snapshot, DeviceInstance instance,
                             Map<String, String> parameters, Set<AttributePath> splittable) {
        List<World> worlds = List.of(new World(snapshot, instance, List.of()));
        for (DependencyConstraint constraint : type.constraints()) {
            var next = new ArrayList<World>();
            for (World world : worlds) {
                next.addAll(judge(constraint, type, world, parameters, splittable));
            }
            worlds = next;
        }
        return worlds;
    }

    private List<World> judge(DependencyConstraint constraint, DeviceType type, World world,
                              Map<String, String> parameters, Set<AttributePath> splittable) {
        var sets = new LinkedHashMap<AttributePath, List<String>>();
        var read = new LinkedHashSet<>(ConditionDescriber.attributes(constraint.condition()));
        read.addAll(ConditionDescriber.attributes(constraint.requires()));
        long combinations = 1;
        for (AttributePath path : read) {
            if (!world.snapshot().has(path.toString())) {
                continue;
            }
            var value = world.snapshot().value(path.toString());
            if (value instanceof SnapshotValue.ValueSet set) {
                sets.put(path, set.values());
                combinations *= set.values().size();
            } else if (value instanceof SnapshotValue.Single single && !single.isUnknown()
                    && world.instance().attribute(path).isUnknown()) {
                // narrowed to one level while the instance still holds unknown
                sets.put(path, List.of(single.value()));
            }
        }
        if (combinations > MAX_COMBINATIONS) {
            log.warn("Not judging '{}': {} value combinations", constraint.describe(), combinations);
            return List.of(world);
        }

        var outcomes = new LinkedHashMap<Map<AttributePath, String>, Boolean>();
        for (Map<AttributePath, String> combination : combinations(sets)) {
            var candidate = world.instance().deepCopy();
            combination.forEach((path, value) -> candidate.attribute(path).writeValue(value));
            outcomes.put(combination, checker.violates(constraint, type, candidate, parameters));
        }

        String message = "Constraint violated: " + constraint.describe();
        if (outcomes.values().stream().allMatch(Boolean::booleanValue)) {
            return List.of(withViolation(world, message));
        }
        if (outcomes.values().stream().noneMatch(Boolean::booleanValue)) {
            return List.of(world);
        }

        for (AttributePath path : sets.keySet()) {
            if (!splittable.contains(path) || sets.get(path).size() < 2) {
                continue;
            }
            var violating = separating(path, sets.get(path), outcomes);
            if (violating == null) {
                continue;
            }
            var satisfying = new ArrayList<>(sets.get(path));
            satisfying.removeAll(violating);
            log.debug("Splitting {} on '{}': {} / {}", path, constraint.describe(), violating, satisfying);
            return List.of(withViolation(restrict(world, path, violating), message), restrict(world, path, satisfying));
        }
        log.debug("'{}' holds for some values only, not reported", constraint.describe());
        return List.of(world);
    }

    /**
     * Values of {@code path} for which every combination violates, when every other value never
     * does; {@code null} when the outcome depends on more than this attribute.
     */
    private static List<String> separating(AttributePath path, List<String> values,
                                           Map<Map<AttributePath, String>, Boolean> outcomes) {
        var violating = new ArrayList<String>();
        for (String value : values) {
            var verdicts = outcomes.entrySet().stream()
                    .filter(e -> value.equals(e.getKey().get(path)))
                    .map(Map.Entry::getValue)
                    .distinct()
                    .toList();
            if (verdicts.size() != 1) {
                return null;
            }
            if (verdicts.get(0)) {
                violating.add(value);
            }
        }
        return violating;
    }

    private static World restrict(World world, AttributePath path, List<String> values) {
        var state = world.snapshot().state(path.toString());
        var snapshot = world.snapshot().with(path.toString(), state.withValue(SnapshotValue.of(values)));
        var instance = world.instance();
        if (values.size() == 1) {
            instance = instance.deepCopy();
            instance.attribute(path).writeValue(values.get(0));
        }
        return new World(snapshot, instance, world.violations());
    }

    private static World withViolation(World world, String message) {
        var violations = new ArrayList<>(world.violations());
        violations.add(message);
        return new World(world.snapshot(), world.instance(), violations);
    }

    private static List<Map<AttributePath, String>> combinations(Map<AttributePath, List<String>> sets) {
        List<Map<AttributePath, String>> result = new ArrayList<>();
        result.add(Map.of());
        for (var entry : sets.entrySet()) {
            var next = new ArrayList<Map<AttributePath, String>>();
            for (Map<AttributePath, String> partial : result) {
                for (String value : entry.getValue()) {
                    var extended = new LinkedHashMap<>(partial);
                    extended.put(entry.getKey(), value);
                    next.add(extended);
                }
            }
            result = next;
        }
        return result;
    }
}
