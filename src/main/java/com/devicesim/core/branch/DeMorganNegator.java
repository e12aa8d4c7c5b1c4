package com.devicesim.core.branch;

import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ImplicationCondition;
import com.devicesim.core.condition.NotCondition;
import com.devicesim.core.condition.OrCondition;
import com.devicesim.core.condition.ParameterEqualsCondition;
import com.devicesim.core.condition.ParameterValidCondition;

import java.util.List;

/**
 * Turns a condition tree into the configurations under which it holds ({@link #satisfy}) or
 * fails ({@link #negate}). Both are pure functions of the condition and the context.
 * <p>
 * Rules, with {@code [{}]} meaning "unconditionally" and {@code []} meaning "never":
 * <ul>
 *   <li>a comparison maps to its satisfying or failing values; a known operand folds to
 *       {@code [{}]} or {@code []}</li>
 *   <li>{@code not(A and B)} is the union of {@code not A} and {@code not B}</li>
 *   <li>{@code not(A or B)} is the cross-merge of {@code not A} and {@code not B}</li>
 *   <li>{@code not not A} is {@code A}; {@code p implies q} is {@code not p or q}</li>
 * </ul>
 */
public class DeMorganNegator {

    private static final List<Configuration> ALWAYS = List.of(Configuration.unconstrained());
    private static final List<Configuration> NEVER = List.of();

    private final ValueSetCalculator calculator;

    public DeMorganNegator(ValueSetCalculator calculator) {
        this.calculator = calculator;
    }

    public List<Configuration> satisfy(Condition condition, BranchContext ctx) {
        if (condition instanceof AttributeCondition c) {
            return calculator.partition(c, ctx)
                    .map(p -> {
                        if (p.neverHolds()) return NEVER;
                        if (p.alwaysHolds()) return ALWAYS;
                        return List.of(Configuration.of(c.target(), p.satisfying()));
                    })
                    .orElse(ALWAYS);
        } else if (condition instanceof AndCondition c) {
            List<Configuration> result = ALWAYS;
            for (Condition operand : c.operands()) {
                result = Configuration.crossMerge(result, satisfy(operand, ctx));
            }
            return result;
        } else if (condition instanceof OrCondition c) {
            List<Configuration> result = NEVER;
            for (Condition operand : c.operands()) {
                result = Configuration.union(result, satisfy(operand, ctx));
            }
            return result;
        } else if (condition instanceof NotCondition c) {
            return negate(c.operand(), ctx);
        } else if (condition instanceof ImplicationCondition c) {
            return Configuration.union(negate(c.antecedent(), ctx), satisfy(c.consequent(), ctx));
        } else if (condition instanceof ParameterEqualsCondition c) {
            return c.value().equals(ctx.parameters().get(c.parameter())) ? ALWAYS : NEVER;
        } else if (condition instanceof ParameterValidCondition c) {
            String actual = ctx.parameters().get(c.parameter());
            return actual != null && c.validValues().contains(actual) ? ALWAYS : NEVER;
        }
        throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
    }

    public List<Configuration> negate(Condition condition, BranchContext ctx) {
        if (condition instanceof AttributeCondition c) {
            return calculator.partition(c, ctx)
                    .map(p -> {
                        if (p.alwaysHolds()) return NEVER;
                        if (p.neverHolds()) return ALWAYS;
                        return List.of(Configuration.of(c.target(), p.failing()));
                    })
                    .orElse(NEVER);
        } else if (condition instanceof AndCondition c) {
            List<Configuration> result = NEVER;
            for (Condition operand : c.operands()) {
                result = Configuration.union(result, negate(operand, ctx));
            }
            return result;
        } else if (condition instanceof OrCondition c) {
            List<Configuration> result = ALWAYS;
            for (Condition operand : c.operands()) {
                result = Configuration.crossMerge(result, negate(operand, ctx));
            }
            return result;
        } else if (condition instanceof NotCondition c) {
            return satisfy(c.operand(), ctx);
        } else if (condition instanceof ImplicationCondition c) {
            return Configuration.crossMerge(satisfy(c.antecedent(), ctx), negate(c.consequent(), ctx));
        } else if (condition instanceof ParameterEqualsCondition || condition instanceof ParameterValidCondition) {
            return satisfy(condition, ctx).isEmpty() ? ALWAYS : NEVER;
        }
        throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
    }
}
