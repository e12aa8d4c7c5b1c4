package com.devicesim.core.branch;

import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.BranchKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One outcome of postcondition branching.
 *
 * @param configuration  values the guard attributes are narrowed to
 * @param kind           {@code IF}, {@code ELIF} or {@code ELSE} of the first branched dimension;
 *                       {@code null} when nothing was branched
 * @param attributeKinds the outcome each narrowed attribute was branched into
 */
public record PostconditionBranch(
    Configuration configuration,
    BranchKind kind,
    Map<AttributePath, BranchKind> attributeKinds
) {

    public PostconditionBranch {
        attributeKinds = Collections.unmodifiableMap(new LinkedHashMap<>(attributeKinds));
    }

    public PostconditionBranch(Configuration configuration, BranchKind kind) {
        this(configuration, kind, kindsFor(configuration, kind));
    }

    public static PostconditionBranch none() {
        return new PostconditionBranch(Configuration.unconstrained(), null);
    }

    public BranchKind kindOf(AttributePath path) {
        return attributeKinds.get(path);
    }

    /**
     * Both outcomes at once; empty when their configurations contradict.
     */
    public Optional<PostconditionBranch> and(PostconditionBranch other) {
        return configuration.merge(other.configuration).map(merged -> {
            var kinds = new LinkedHashMap<>(attributeKinds);
            other.attributeKinds.forEach(kinds::putIfAbsent);
            return new PostconditionBranch(merged, kind != null ? kind : other.kind, kinds);
        });
    }

    private static Map<AttributePath, BranchKind> kindsFor(Configuration configuration, BranchKind kind) {
        var kinds = new LinkedHashMap<AttributePath, BranchKind>();
        if (kind != null) {
            configuration.constraints().keySet().forEach(path -> kinds.put(path, kind));
        }
        return kinds;
    }
}
