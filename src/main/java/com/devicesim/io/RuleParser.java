package com.devicesim.io;

import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ImplicationCondition;
import com.devicesim.core.condition.NotCondition;
import com.devicesim.core.condition.OrCondition;
import com.devicesim.core.condition.ParameterEqualsCondition;
import com.devicesim.core.condition.ParameterValidCondition;
import com.devicesim.core.effect.ConditionalEffect;
import com.devicesim.core.effect.Effect;
import com.devicesim.core.effect.SetAttributeEffect;
import com.devicesim.core.effect.SetTrendEffect;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ComparisonOperator;
import com.devicesim.core.model.OrderedDomain;
import com.devicesim.core.model.Trend;
import com.devicesim.core.model.ValueRef;
import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Parses condition and effect trees from YAML nodes and checks them against the attributes
 * and parameters in scope.
 */
class RuleParser {

    /**
     * What a rule may reference.
     *
     * @param description   used in error messages, e.g. {@code action 'turn_on'}
     * @param domainOf      domain of an attribute in scope, empty when the attribute is not declared
     * @param parameters    parameter names in scope, {@code null} to skip the check
     */
    record Scope(String description, Function<AttributePath, Optional<OrderedDomain>> domainOf, Set<String> parameters) {}

    private final Path source;

    RuleParser(Path source) {
        this.source = source;
    }

    List<Condition> conditions(JsonNode node, Scope scope) {
        var result = new ArrayList<Condition>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw fail(scope, "expected a list of conditions");
        }
        node.forEach(c -> result.add(condition(c, scope)));
        return result;
    }

    Condition condition(JsonNode node, Scope scope) {
        if (node == null || !node.isObject()) {
            throw fail(scope, "a condition must be a mapping");
        }
        String type = text(node, "type", scope);
        return switch (type) {
            case "attribute_check" -> attributeCheck(node, scope);
            case "and" -> new AndCondition(operands(node, scope));
            case "or" -> new OrCondition(operands(node, scope));
            case "not" -> new NotCondition(condition(required(node, "condition", scope), scope));
            case "implication" -> new ImplicationCondition(
                    condition(required(node, "if", scope), scope),
                    condition(required(node, "then", scope), scope));
            case "parameter_equals" -> {
                String parameter = checkParameter(text(node, "parameter", scope), scope);
                yield new ParameterEqualsCondition(parameter, scalar(required(node, "value", scope)));
            }
            case "parameter_valid" -> {
                String parameter = checkParameter(text(node, "parameter", scope), scope);
                yield new ParameterValidCondition(parameter, scalars(required(node, "valid_values", scope)));
            }
            default -> throw fail(scope, "unknown condition type '" + type + "'");
        };
    }

    List<Effect> effects(JsonNode node, Scope scope) {
        var result = new ArrayList<Effect>();
        if (node == null || node.isNull()) {
            return result;
        }
        if (!node.isArray()) {
            throw fail(scope, "expected a list of effects");
        }
        node.forEach(e -> result.add(effect(e, scope)));
        return result;
    }

    private Effect effect(JsonNode node, Scope scope) {
        if (node == null || !node.isObject()) {
            throw fail(scope, "an effect must be a mapping");
        }
        String type = text(node, "type", scope);
        return switch (type) {
            case "set_attribute" -> {
                var target = target(node, scope);
                var value = valueRef(required(node, "value", scope), scope);
                checkLiterals(target, value, scope);
                yield new SetAttributeEffect(target, value);
            }
            case "set_trend" -> {
                var target = target(node, scope);
                try {
                    yield new SetTrendEffect(target, Trend.fromWireName(text(node, "direction", scope)));
                } catch (IllegalArgumentException e) {
                    throw fail(scope, e.getMessage());
                }
            }
            case "conditional" -> new ConditionalEffect(
                    condition(required(node, "condition", scope), scope),
                    effects(node.get("then"), scope),
                    effects(node.get("else"), scope));
            default -> throw fail(scope, "unknown effect type '" + type + "'");
        };
    }

    private AttributeCondition attributeCheck(JsonNode node, Scope scope) {
        var target = target(node, scope);
        ComparisonOperator operator;
        try {
            operator = ComparisonOperator.fromWireName(node.has("operator") ? node.get("operator").asText() : "equals");
        } catch (IllegalArgumentException e) {
            throw fail(scope, e.getMessage());
        }
        var value = valueRef(required(node, "value", scope), scope);
        checkLiterals(target, value, scope);
        return new AttributeCondition(target, operator, value);
    }

    private List<Condition> operands(JsonNode node, Scope scope) {
        var operands = conditions(required(node, "conditions", scope), scope);
        if (operands.isEmpty()) {
            throw fail(scope, "'" + node.get("type").asText() + "' needs at least one condition");
        }
        return operands;
    }

    private AttributePath target(JsonNode node, Scope scope) {
        AttributePath path;
        try {
            path = AttributePath.parse(text(node, "target", scope));
        } catch (IllegalArgumentException e) {
            throw fail(scope, e.getMessage());
        }
        if (scope.domainOf().apply(path).isEmpty()) {
            throw fail(scope, "target '" + path + "' is not a declared attribute");
        }
        return path;
    }

    private ValueRef valueRef(JsonNode node, Scope scope) {
        if (node.isObject()) {
            if (!"parameter_ref".equals(node.path("type").asText())) {
                throw fail(scope, "a value mapping must be a parameter_ref");
            }
            return ValueRef.parameter(checkParameter(text(node, "name", scope), scope));
        }
        if (node.isArray()) {
            return ValueRef.of(scalars(node));
        }
        return ValueRef.of(scalar(node));
    }

    private void checkLiterals(AttributePath target, ValueRef value, Scope scope) {
        if (!(value instanceof ValueRef.Literal literal)) {
            return;
        }
        var domain = scope.domainOf().apply(target).orElseThrow();
        for (String v : literal.values()) {
            if (!domain.contains(v)) {
                throw fail(scope, "value '" + v + "' for " + target + " is not in domain '"
                        + domain.id() + "' " + domain.levels());
            }
        }
    }

    private String checkParameter(String name, Scope scope) {
        if (scope.parameters() != null && !scope.parameters().contains(name)) {
            throw fail(scope, "references undeclared parameter '" + name + "'");
        }
        return name;
    }

    private JsonNode required(JsonNode node, String field, Scope scope) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw fail(scope, "missing '" + field + "'");
        }
        return value;
    }

    private String text(JsonNode node, String field, Scope scope) {
        return scalar(required(node, field, scope));
    }

    /**
     * Scalar as text; YAML booleans become {@code on}/{@code off}.
     */
    static String scalar(JsonNode node) {
        if (node.isBoolean()) {
            return node.asBoolean() ? "on" : "off";
        }
        return node.asText();
    }

    static List<String> scalars(JsonNode node) {
        var result = new ArrayList<String>();
        if (node.isArray()) {
            node.forEach(n -> result.add(scalar(n)));
        } else {
            result.add(scalar(node));
        }
        return result;
    }

    DefinitionLoadException fail(Scope scope, String message) {
        return new DefinitionLoadException(source, scope.description() + ": " + message);
    }
}
