package com.devicesim.core.branch;

import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.condition.ConditionDescriber;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.BranchKind;
import com.devicesim.core.model.BranchSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Combines precondition and postcondition branching into the list of children to create.
 * <p>
 * Success children are every precondition success configuration merged with every
 * postcondition branch: disjoint attributes give the Cartesian product, a shared attribute is
 * intersected and empty pairs are dropped. Fail children are the configurations of the negated
 * preconditions, one per alternative.
 */
public class BranchPlanner {

    private static final Logger log = LoggerFactory.getLogger(BranchPlanner.class);

    private final DeMorganNegator negator;
    private final PostconditionBrancher postconditions;

    public BranchPlanner(DeMorganNegator negator, PostconditionBrancher postconditions) {
        this.negator = negator;
        this.postconditions = postconditions;
    }

    public List<BranchPlan> plan(ActionDefinition action, UnknownDetector.Detection detection, BranchContext ctx) {
        Condition preconditions = new AndCondition(action.preconditions());
        var satisfied = negator.satisfy(preconditions, ctx);
        var failed = negator.negate(preconditions, ctx);
        var postBranches = postconditions.branches(detection.groups(), ctx);
        log.debug("Action {}: {} success configuration(s), {} fail configuration(s), {} postcondition branch(es)",
                action.name(), satisfied.size(), failed.size(), postBranches.size());

        var plans = new ArrayList<BranchPlan>();
        for (Configuration pre : satisfied) {
            for (PostconditionBranch post : postBranches) {
                pre.merge(post.configuration()).ifPresent(merged -> {
                    if (plans.stream().noneMatch(p -> p.success() && p.configuration().equals(merged))) {
                        plans.add(new BranchPlan(merged, true, successCondition(merged, post), null));
                    }
                });
            }
        }
        for (Configuration fail : failed) {
            plans.add(new BranchPlan(fail, false, failCondition(fail), failureMessage(action, fail)));
        }
        return plans;
    }

    private static BranchCondition successCondition(Configuration merged, PostconditionBranch post) {
        if (merged.isUnconstrained()) {
            return null;
        }
        var subs = new ArrayList<BranchCondition>();
        for (var entry : merged.constraints().entrySet()) {
            var postKind = post.kindOf(entry.getKey());
            subs.add(BranchCondition.simple(entry.getKey().toString(), entry.getValue(),
                    postKind != null ? BranchSource.POSTCONDITION : BranchSource.PRECONDITION,
                    postKind != null ? postKind : BranchKind.SUCCESS));
        }
        var kind = post.kind() != null ? post.kind() : BranchKind.SUCCESS;
        var source = post.kind() != null ? BranchSource.POSTCONDITION : BranchSource.PRECONDITION;
        return BranchCondition.compound(BranchCondition.Combinator.AND, subs, source, kind);
    }

    private static BranchCondition failCondition(Configuration fail) {
        if (fail.isUnconstrained()) {
            return null;
        }
        var subs = new ArrayList<BranchCondition>();
        fail.constraints().forEach((path, values) -> subs.add(
                BranchCondition.simple(path.toString(), values, BranchSource.PRECONDITION, BranchKind.FAIL)));
        return BranchCondition.compound(BranchCondition.Combinator.AND, subs, BranchSource.PRECONDITION, BranchKind.FAIL);
    }

    /**
     * {@code Precondition failed: <preconditions touching the branch> (actual: <narrowed values>)}.
     */
    private static String failureMessage(ActionDefinition action, Configuration fail) {
        var relevant = new ArrayList<Condition>();
        for (Condition precondition : action.preconditions()) {
            var attrs = ConditionDescriber.attributes(precondition);
            if (fail.isUnconstrained() || attrs.stream().anyMatch(fail::constrains)) {
                relevant.add(precondition);
            }
        }
        String described = relevant.stream().map(ConditionDescriber::describe).collect(Collectors.joining(" AND "));
        if (fail.isUnconstrained()) {
            return "Precondition failed: " + described;
        }
        String actual;
        if (fail.constraints().size() == 1) {
            actual = render(fail.constraints().values().iterator().next());
        } else {
            actual = fail.constraints().entrySet().stream()
                    .map(e -> e.getKey() + " = " + render(e.getValue()))
                    .collect(Collectors.joining(", "));
        }
        return "Precondition failed: " + described + " (actual: " + actual + ")";
    }

    private static String render(List<String> values) {
        return values.size() == 1 ? values.get(0) : "{" + String.join(", ", values) + "}";
    }
}
