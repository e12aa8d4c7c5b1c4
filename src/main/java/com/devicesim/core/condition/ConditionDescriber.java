package com.devicesim.core.condition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.devicesim.core.model.AttributePath;

/**
 * Renders conditions as human-readable text and collects the attributes they mention.
 */
public final class ConditionDescriber {

    private ConditionDescriber() {}

    public static String describe(Condition condition) {
        if (condition instanceof AttributeCondition c) {
            return c.target() + " " + c.operator().symbol() + " " + c.value().render();
        } else if (condition instanceof AndCondition c) {
            return join(c.operands(), " AND ");
        } else if (condition instanceof OrCondition c) {
            return join(c.operands(), " OR ");
        } else if (condition instanceof NotCondition c) {
            return "NOT " + describe(c.operand());
        } else if (condition instanceof ImplicationCondition c) {
            return "IF " + describe(c.antecedent()) + " THEN " + describe(c.consequent());
        } else if (condition instanceof ParameterEqualsCondition c) {
            return "$" + c.parameter() + " == " + c.value();
        } else if (condition instanceof ParameterValidCondition c) {
            return "$" + c.parameter() + " in [" + String.join(", ", c.validValues()) + "]";
        }
        throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
    }

    /**
     * Attribute paths referenced anywhere in the condition, in first-seen order.
     */
    public static Set<AttributePath> attributes(Condition condition) {
        var result = new LinkedHashSet<AttributePath>();
        collect(condition, result);
        return result;
    }

    private static void collect(Condition condition, Set<AttributePath> into) {
        if (condition instanceof AttributeCondition c) {
            into.add(c.target());
        } else if (condition instanceof AndCondition c) {
            c.operands().forEach(op -> collect(op, into));
        } else if (condition instanceof OrCondition c) {
            c.operands().forEach(op -> collect(op, into));
        } else if (condition instanceof NotCondition c) {
            collect(c.operand(), into);
        } else if (condition instanceof ImplicationCondition c) {
            collect(c.antecedent(), into);
            collect(c.consequent(), into);
        } else if (!(condition instanceof ParameterEqualsCondition) && !(condition instanceof ParameterValidCondition)) {
            throw new IllegalStateException("Unhandled condition type: " + condition.getClass().getName());
        }
    }

    private static String join(List<Condition> operands, String separator) {
        return operands.stream()
                .map(ConditionDescriber::describe)
                .collect(Collectors.joining(separator, "(", ")"));
    }
}
