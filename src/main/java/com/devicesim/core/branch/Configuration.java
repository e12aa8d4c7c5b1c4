package com.devicesim.core.branch;

import com.devicesim.core.model.AttributePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One way a condition can come out true (or false): each constrained attribute mapped to the
 * values it must take. The empty configuration constrains nothing. A list of configurations
 * is read as a disjunction; each entry becomes one sibling node.
 */
public final class Configuration {

    private static final Configuration UNCONSTRAINED = new Configuration(Map.of());

    private final Map<AttributePath, List<String>> constraints;

    private Configuration(Map<AttributePath, List<String>> constraints) {
        this.constraints = constraints;
    }

    public static Configuration unconstrained() {
        return UNCONSTRAINED;
    }

    public static Configuration of(AttributePath path, List<String> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Configuration for " + path + " needs at least one value");
        }
        var map = new LinkedHashMap<AttributePath, List<String>>();
        map.put(path, List.copyOf(values));
        return new Configuration(Collections.unmodifiableMap(map));
    }

    public Map<AttributePath, List<String>> constraints() {
        return constraints;
    }

    public boolean isUnconstrained() {
        return constraints.isEmpty();
    }

    public boolean constrains(AttributePath path) {
        return constraints.containsKey(path);
    }

    public List<String> values(AttributePath path) {
        return constraints.get(path);
    }

    /**
     * Conjunction of two configurations. Shared attributes are intersected; empty when some
     * intersection is empty.
     */
    public Optional<Configuration> merge(Configuration other) {
        if (other.isUnconstrained()) {
            return Optional.of(this);
        }
        if (isUnconstrained()) {
            return Optional.of(other);
        }
        var merged = new LinkedHashMap<>(constraints);
        for (var entry : other.constraints.entrySet()) {
            var existing = merged.get(entry.getKey());
            if (existing == null) {
                merged.put(entry.getKey(), entry.getValue());
                continue;
            }
            var kept = new ArrayList<String>();
            for (String value : existing) {
                if (entry.getValue().contains(value)) {
                    kept.add(value);
                }
            }
            if (kept.isEmpty()) {
                return Optional.empty();
            }
            merged.put(entry.getKey(), List.copyOf(kept));
        }
        return Optional.of(new Configuration(Collections.unmodifiableMap(merged)));
    }

    /**
     * Pairwise merge of two disjunctions, dropping pairs that cannot hold together.
     */
    public static List<Configuration> crossMerge(List<Configuration> left, List<Configuration> right) {
        var result = new ArrayList<Configuration>();
        for (Configuration a : left) {
            for (Configuration b : right) {
                a.merge(b).filter(c -> !result.contains(c)).ifPresent(result::add);
            }
        }
        return result;
    }

    /**
     * Disjunction of two lists. Any unconstrained entry absorbs the rest.
     */
    public static List<Configuration> union(List<Configuration> left, List<Configuration> right) {
        var result = new ArrayList<Configuration>();
        for (Configuration c : left) {
            if (!result.contains(c)) {
                result.add(c);
            }
        }
        for (Configuration c : right) {
            if (!result.contains(c)) {
                result.add(c);
            }
        }
        if (result.stream().anyMatch(Configuration::isUnconstrained)) {
            return List.of(UNCONSTRAINED);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Configuration other)) return false;
        return constraints.equals(other.constraints);
    }

    @Override
    public int hashCode() {
        return constraints.hashCode();
    }

    @Override
    public String toString() {
        if (constraints.isEmpty()) {
            return "{}";
        }
        return constraints.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
