package com.devicesim.core.branch;

import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ConditionDescriber;
import com.devicesim.core.effect.ConditionalEffect;
import com.devicesim.core.effect.Effect;
import com.devicesim.core.effect.SetAttributeEffect;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.AttributePath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the attributes an action would have to branch on: those referenced by its
 * preconditions or by the guards of its top-level conditional effects that are unknown or a
 * multi-valued set in the parent snapshot. Effect bodies are not searched, and a guard on an
 * attribute an earlier top-level effect already set is not uncertain.
 * <p>
 * Every top-level conditional with an uncertain guard contributes to a
 * {@link PostconditionGroup}. Conditionals whose head guard compares the same attribute are
 * read as one if/elif/else run; any other conditional is a group of its own.
 */
public class UnknownDetector {

    /**
     * One independent postcondition branching dimension.
     *
     * @param effects      top-level conditionals in action order; more than one only when every
     *                     head guard compares the same attribute
     * @param writtenBefore attributes set by earlier top-level effects, with the value they hold
     *                      when the first conditional of the group runs
     */
    public record PostconditionGroup(
        List<ConditionalEffect> effects,
        Map<AttributePath, String> writtenBefore
    ) {

        public PostconditionGroup {
            effects = List.copyOf(effects);
            writtenBefore = Collections.unmodifiableMap(new LinkedHashMap<>(writtenBefore));
        }

        public ConditionalEffect head() {
            return effects.get(0);
        }

        public boolean isFlatRun() {
            return effects.size() > 1;
        }
    }

    /**
     * @param preconditionUnknowns  uncertain attributes referenced by preconditions
     * @param postconditionUnknowns uncertain attributes referenced by branching conditional guards
     * @param groups                postcondition branching dimensions, empty when no guard is uncertain
     */
    public record Detection(
        Set<AttributePath> preconditionUnknowns,
        Set<AttributePath> postconditionUnknowns,
        List<PostconditionGroup> groups
    ) {

        public boolean hasUnknowns() {
            return !preconditionUnknowns.isEmpty() || !postconditionUnknowns.isEmpty();
        }
    }

    public Detection detect(ActionDefinition action, BranchContext ctx) {
        var pre = new LinkedHashSet<AttributePath>();
        for (Condition precondition : action.preconditions()) {
            for (AttributePath path : ConditionDescriber.attributes(precondition)) {
                if (ctx.isUncertain(path)) {
                    pre.add(path);
                }
            }
        }

        var post = new LinkedHashSet<AttributePath>();
        var written = new LinkedHashMap<AttributePath, String>();
        var groups = new ArrayList<GroupBuilder>();
        var openRuns = new LinkedHashMap<AttributePath, GroupBuilder>();
        for (Effect effect : action.effects()) {
            if (effect instanceof SetAttributeEffect set) {
                written.put(set.target(), set.value().resolve(ctx.parameters()).get(0));
                openRuns.remove(set.target());
            } else if (effect instanceof ConditionalEffect conditional) {
                var uncertain = new LinkedHashSet<AttributePath>();
                for (ConditionalEffect clause = conditional; clause != null; clause = clause.elseIf()) {
                    for (AttributePath path : ConditionDescriber.attributes(clause.condition())) {
                        if (!written.containsKey(path) && ctx.isUncertain(path)) {
                            uncertain.add(path);
                        }
                    }
                }
                if (!uncertain.isEmpty()) {
                    post.addAll(uncertain);
                    AttributePath runKey = runKey(conditional, uncertain);
                    var run = runKey == null ? null : openRuns.get(runKey);
                    if (run == null) {
                        run = new GroupBuilder(written);
                        groups.add(run);
                        if (runKey != null) {
                            openRuns.put(runKey, run);
                        }
                    }
                    run.effects.add(conditional);
                }
                // a body that writes the run's attribute changes what later guards read
                bodyWrites(conditional).forEach(openRuns::remove);
            }
        }
        return new Detection(Collections.unmodifiableSet(pre), Collections.unmodifiableSet(post),
                groups.stream().map(GroupBuilder::build).toList());
    }

    private static AttributePath runKey(ConditionalEffect conditional, Set<AttributePath> uncertain) {
        if (conditional.condition() instanceof AttributeCondition guard && uncertain.contains(guard.target())) {
            return guard.target();
        }
        return null;
    }

    private static Set<AttributePath> bodyWrites(ConditionalEffect conditional) {
        var result = new LinkedHashSet<AttributePath>();
        collectWrites(conditional.thenEffects(), result);
        collectWrites(conditional.elseEffects(), result);
        return result;
    }

    private static void collectWrites(List<Effect> effects, Set<AttributePath> into) {
        for (Effect effect : effects) {
            if (effect instanceof SetAttributeEffect set) {
                into.add(set.target());
            } else if (effect instanceof ConditionalEffect nested) {
                into.addAll(bodyWrites(nested));
            }
        }
    }

    private static final class GroupBuilder {
        private final List<ConditionalEffect> effects = new ArrayList<>();
        private final Map<AttributePath, String> writtenBefore;

        private GroupBuilder(Map<AttributePath, String> writtenBefore) {
            this.writtenBefore = new LinkedHashMap<>(writtenBefore);
        }

        private PostconditionGroup build() {
            return new PostconditionGroup(effects, writtenBefore);
        }
    }
}
