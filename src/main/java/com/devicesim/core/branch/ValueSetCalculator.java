package com.devicesim.core.branch;

import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ImplicationCondition;
import com.devicesim.core.condition.NotCondition;
import com.devicesim.core.condition.OrCondition;
import com.devicesim.core.condition.ParameterEqualsCondition;
import com.devicesim.core.condition.ParameterValidCondition;
import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.OrderedDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Partitions an attribute's possible values into those that satisfy a condition and those
 * that fail it. A concrete value is treated as a domain of one, so known and unknown
 * attributes go through the same code.
 */
public class ValueSetCalculator {

    private static final Logger log = LoggerFactory.getLogger(ValueSetCalculator.class);

    /**
     * @param domain     domain of the attribute
     * @param possible   values the attribute may hold
     * @param satisfying possible values for which the comparison holds
     * @param failing    possible values for which it does not
     */
    public record Partition(
        OrderedDomain domain,
        List<String> possible,
        List<String> satisfying,
        List<String> failing
    ) {

        public boolean alwaysHolds() {
            return failing.isEmpty();
        }

        public boolean neverHolds() {
            return satisfying.isEmpty();
        }
    }

    /**
     * Partition for one comparison; empty when the attribute's domain cannot be resolved,
     * which is logged and leaves the attribute out of branching.
     */
    public Optional<Partition> partition(AttributeCondition condition, BranchContext ctx) {
        var domain = ctx.domain(condition.target());
        if (domain.isEmpty()) {
            log.warn("No value domain for {} on {}; leaving it out of branching",
                    condition.target(), ctx.deviceType().name());
            return Optional.empty();
        }
        var possible = ctx.possibleValues(condition.target(), domain.get());
        var operand = condition.value().resolve(ctx.parameters());
        if (condition.operator().isOrdered()) {
            for (String value : operand) {
                if (!domain.get().contains(value)) {
                    throw new EvaluationException("Value '" + value + "' compared with " + condition.target()
                            + " is not in domain '" + domain.get().id() + "' " + domain.get().levels());
                }
            }
        }
        var satisfying = condition.operator().filter(domain.get(), possible, operand);
        var failing = new ArrayList<String>();
        for (String value : possible) {
            if (!satisfying.contains(value)) {
                failing.add(value);
            }
        }
        return Optional.of(new Partition(domain.get(), possible, satisfying, failing));
    }

    /**
     * Per-attribute satisfying values of a condition tree: And intersects, Or unions.
     * Not and Implication swap to the failing side of their negated operands.
     */
    public Map<AttributePath, List<String>> satisfyingValues(Condition condition, BranchContext ctx) {
        return collect(condition, ctx, true);
    }

    /**
     * Per-attribute failing values: the dual of {@link #satisfyingValues}, And unions and Or intersects.
     */
    public Map<AttributePath, List<String>> failingValues(Condition condition, BranchContext ctx) {
        return collect(condition, ctx, false);
    }

    private Map<AttributePath, List<String>> collect(Condition condition, BranchContext ctx, boolean satisfying) {
        if (condition instanceof AttributeCondition c) {
            var result = new LinkedHashMap<AttributePath, List<String>>();
            partition(c, ctx).ifPresent(p -> result.put(c.target(), satisfying ? p.satisfying() : p.failing()));
            return result;
        } else if (condition instanceof AndCondition c) {
            return combine(c.operands(), ctx, satisfying, satisfying);
        } else if (condition instanceof OrCondition c) {
            return combine(c.operands(), ctx, satisfying, !satisfying);
        } else if (condition instanceof NotCondition c) {
            return collect(c.operand(), ctx, !satisfying);
        } else if (condition instanceof ImplicationCondition c) {
            var parts = List.of(new NotCondition(c.antecedent()), c.consequent());
            return combine(parts, ctx, satisfying, !satisfying);
        } else if (condition instanceof ParameterEqualsCondition || condition instanceof ParameterValidCondition) {
            return new LinkedHashMap<>();
        }
        throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
    }

    private Map<AttributePath, List<String>> combine(List<Condition> operands, BranchContext ctx,
                                                     boolean satisfying, boolean intersect) {
        var result = new LinkedHashMap<AttributePath, List<String>>();
        for (Condition operand : operands) {
            collect(operand, ctx, satisfying).forEach((path, values) -> result.merge(path, values,
                    (a, b) -> intersect ? intersection(a, b) : union(a, b)));
        }
        return result;
    }

    private static List<String> intersection(List<String> a, List<String> b) {
        return a.stream().filter(b::contains).toList();
    }

    private static List<String> union(List<String> a, List<String> b) {
        var result = new ArrayList<>(a);
        b.stream().filter(v -> !result.contains(v)).forEach(result::add);
        return result;
    }
}
