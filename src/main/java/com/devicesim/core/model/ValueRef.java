package com.devicesim.core.model;

import com.devicesim.core.engine.EvaluationException;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Right-hand side of a condition or a {@code set_attribute} effect: either literal levels
 * or a reference to an action parameter resolved at evaluation time.
 */
public sealed interface ValueRef extends Serializable permits ValueRef.Literal, ValueRef.ParameterRef {

    List<String> resolve(Map<String, String> parameters);

    String render();

    static ValueRef of(String value) {
        return new Literal(List.of(value));
    }

    static ValueRef of(List<String> values) {
        return new Literal(values);
    }

    static ValueRef parameter(String name) {
        return new ParameterRef(name);
    }

    /**
     * @param values one value, or several for membership operators
     */
    record Literal(List<String> values) implements ValueRef {

        public Literal {
            values = List.copyOf(values);
        }

        @Override
        public List<String> resolve(Map<String, String> parameters) {
            return values;
        }

        @Override
        public String render() {
            return values.size() == 1 ? values.get(0) : "[" + String.join(", ", values) + "]";
        }
    }

    /**
     * @param name name of the action parameter supplying the value
     */
    record ParameterRef(String name) implements ValueRef {

        @Override
        public List<String> resolve(Map<String, String> parameters) {
            String value = parameters.get(name);
            if (value == null) {
                throw new EvaluationException("Missing required parameter: " + name);
            }
            return List.of(value);
        }

        @Override
        public String render() {
            return "$" + name;
        }
    }
}
