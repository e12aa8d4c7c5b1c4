package com.devicesim.core.engine;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ConditionDescriber;
import com.devicesim.core.condition.ImplicationCondition;
import com.devicesim.core.condition.NotCondition;
import com.devicesim.core.condition.OrCondition;
import com.devicesim.core.condition.ParameterEqualsCondition;
import com.devicesim.core.condition.ParameterValidCondition;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.OrderedDomain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Evaluates conditions against a concrete device instance.
 * <p>
 * A comparison against an attribute holding {@code unknown} is false and records the
 * attribute, so callers can ask for clarification. Negating such a comparison stays false:
 * an unknown value never makes a condition true.
 */
public class ConditionEvaluator {

    private final DefinitionCatalog catalog;

    public ConditionEvaluator(DefinitionCatalog catalog) {
        this.catalog = catalog;
    }

    public ConditionResult evaluate(Condition condition, DeviceType type, DeviceInstance instance,
                                    Map<String, String> parameters) {
        if (condition instanceof AttributeCondition c) {
            return evaluateAttribute(c, type, instance, parameters);
        } else if (condition instanceof AndCondition c) {
            for (Condition operand : c.operands()) {
                var result = evaluate(operand, type, instance, parameters);
                if (!result.satisfied()) {
                    return result;
                }
            }
            return ConditionResult.pass(ConditionDescriber.describe(c));
        } else if (condition instanceof OrCondition c) {
            var details = new ArrayList<String>();
            AttributePath unknown = null;
            for (Condition operand : c.operands()) {
                var result = evaluate(operand, type, instance, parameters);
                if (result.satisfied()) {
                    return result;
                }
                details.add(result.detail());
                if (unknown == null) {
                    unknown = result.unknownAttribute();
                }
            }
            return ConditionResult.fail("(" + String.join(" OR ", details) + ")", unknown);
        } else if (condition instanceof NotCondition c) {
            var inner = evaluate(c.operand(), type, instance, parameters);
            if (inner.unknownAttribute() != null) {
                return ConditionResult.fail("NOT " + inner.detail(), inner.unknownAttribute());
            }
            return inner.satisfied()
                    ? ConditionResult.fail("NOT " + inner.detail(), null)
                    : ConditionResult.pass("NOT " + inner.detail());
        } else if (condition instanceof ImplicationCondition c) {
            var antecedent = evaluate(c.antecedent(), type, instance, parameters);
            if (antecedent.unknownAttribute() != null) {
                return ConditionResult.fail(ConditionDescriber.describe(c), antecedent.unknownAttribute());
            }
            if (!antecedent.satisfied()) {
                return ConditionResult.pass(ConditionDescriber.describe(c));
            }
            var consequent = evaluate(c.consequent(), type, instance, parameters);
            return consequent.satisfied()
                    ? consequent
                    : ConditionResult.fail("IF " + antecedent.detail() + " THEN " + consequent.detail(),
                            consequent.unknownAttribute());
        } else if (condition instanceof ParameterEqualsCondition c) {
            String actual = parameters.get(c.parameter());
            String detail = "$" + c.parameter() + " == " + c.value() + " (actual: " + actual + ")";
            return c.value().equals(actual) ? ConditionResult.pass(detail) : ConditionResult.fail(detail, null);
        } else if (condition instanceof ParameterValidCondition c) {
            String actual = parameters.get(c.parameter());
            String detail = "$" + c.parameter() + " in [" + String.join(", ", c.validValues()) + "] (actual: " + actual + ")";
            return actual != null && c.validValues().contains(actual)
                    ? ConditionResult.pass(detail)
                    : ConditionResult.fail(detail, null);
        }
        throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
    }

    public boolean holds(Condition condition, DeviceType type, DeviceInstance instance, Map<String, String> parameters) {
        return evaluate(condition, type, instance, parameters).satisfied();
    }

    private ConditionResult evaluateAttribute(AttributeCondition c, DeviceType type, DeviceInstance instance,
                                              Map<String, String> parameters) {
        var attribute = instance.attribute(c.target());
        var domain = catalog.domainOf(type, c.target())
                .orElseThrow(() -> new EvaluationException("No value domain for attribute " + c.target()));
        List<String> operand = c.value().resolve(parameters);
        String detail = c.target() + " " + c.operator().symbol() + " " + render(operand)
                + " (actual: " + attribute.current() + ")";

        if (attribute.isUnknown()) {
            return ConditionResult.fail(detail, c.target());
        }
        if (c.operator().isOrdered()) {
            checkInDomain(domain, operand, c);
        }
        return c.operator().test(domain, attribute.current(), operand)
                ? ConditionResult.pass(detail)
                : ConditionResult.fail(detail, null);
    }

    private static void checkInDomain(OrderedDomain domain, List<String> operand, AttributeCondition c) {
        for (String value : operand) {
            if (!domain.contains(value)) {
                throw new EvaluationException("Value '" + value + "' compared with " + c.target()
                        + " is not in domain '" + domain.id() + "' " + domain.levels());
            }
        }
    }

    static String render(List<String> values) {
        return values.size() == 1 ? values.get(0) : "[" + String.join(", ", values) + "]";
    }
}
