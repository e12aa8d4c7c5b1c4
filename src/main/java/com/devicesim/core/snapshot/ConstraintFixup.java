package com.devicesim.core.snapshot;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ConstraintReset;
import com.devicesim.core.model.DependencyConstraint;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.Trend;
import com.devicesim.core.model.ValueRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Repairs a narrowed snapshot that breaks a dependency constraint.
 * <p>
 * A constraint is broken when its condition may hold for some remaining value while its
 * requirement can hold for none. The repair sets the condition's attribute to the first domain
 * level for which the condition is false, then applies the constraint's declared resets. The
 * carried instance is updated to match. Only constraints whose both sides are single attribute
 * comparisons with literal operands are considered.
 */
public class ConstraintFixup {

    private static final Logger log = LoggerFactory.getLogger(ConstraintFixup.class);

    private final DefinitionCatalog catalog;

    public ConstraintFixup(DefinitionCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @param snapshot repaired snapshot
     * @param repaired attributes the repair wrote, in order
     */
    public record Result(WorldSnapshot snapshot, Set<AttributePath> repaired) {}

    public Result repair(WorldSnapshot snapshot, DeviceType type, DeviceInstance instance) {
        WorldSnapshot result = snapshot;
        var repaired = new LinkedHashSet<AttributePath>();
        for (DependencyConstraint constraint : type.constraints()) {
            if (!constraint.isRepairable()) {
                continue;
            }
            var condition = (AttributeCondition) constraint.condition();
            var requires = (AttributeCondition) constraint.requires();
            if (!(condition.value() instanceof ValueRef.Literal) || !(requires.value() instanceof ValueRef.Literal)) {
                continue;
            }
            var conditionDomain = catalog.domainOf(type, condition.target());
            var requiresDomain = catalog.domainOf(type, requires.target());
            if (conditionDomain.isEmpty() || requiresDomain.isEmpty()) {
                log.warn("Skipping repair of '{}': undeclared attribute domain", constraint.describe());
                continue;
            }
            if (!possiblyHolds(result, condition, conditionDomain.get())
                    || possiblyHolds(result, requires, requiresDomain.get())) {
                continue;
            }

            var operand = condition.value().resolve(Map.of());
            var domain = conditionDomain.get();
            var replacement = domain.complement(domain.valuesSatisfying(condition.operator(), operand))
                    .stream().findFirst();
            if (replacement.isEmpty()) {
                log.warn("Cannot repair '{}': every level of {} satisfies the condition",
                        constraint.describe(), condition.target());
                continue;
            }

            log.debug("Repairing '{}': {} -> {}", constraint.describe(), condition.target(), replacement.get());
            result = write(result, instance, condition.target(), replacement.get());
            repaired.add(condition.target());
            for (ConstraintReset reset : constraint.resets()) {
                result = applyReset(result, instance, reset);
                repaired.add(reset.target());
            }
        }
        return new Result(result, Collections.unmodifiableSet(repaired));
    }

    private static boolean possiblyHolds(WorldSnapshot snapshot, AttributeCondition condition, OrderedDomain domain) {
        List<String> operand = condition.value().resolve(Map.of());
        var possible = snapshot.value(condition.target().toString()).possibleValues(domain);
        return possible.stream().anyMatch(v -> condition.operator().test(domain, v, operand));
    }

    private static WorldSnapshot write(WorldSnapshot snapshot, DeviceInstance instance, AttributePath path, String value) {
        instance.attribute(path).writeValue(value);
        return snapshot.with(path.toString(), new AttributeState(SnapshotValue.single(value), Trend.NONE));
    }

    private static WorldSnapshot applyReset(WorldSnapshot snapshot, DeviceInstance instance, ConstraintReset reset) {
        WorldSnapshot result = snapshot;
        if (reset.value() != null) {
            result = write(result, instance, reset.target(), reset.value());
        }
        if (reset.clearTrend()) {
            instance.attribute(reset.target()).clearTrend();
            var state = result.state(reset.target().toString());
            result = result.with(reset.target().toString(), state.withTrend(Trend.NONE));
        }
        return result;
    }
}
