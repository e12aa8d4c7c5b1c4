package com.devicesim.core.branch;

import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.effect.ConditionalEffect;
import com.devicesim.core.model.BranchKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Splits a conditional effect with an uncertain guard into one branch per outcome.
 * <p>
 * An if/else-if chain testing one attribute gives one branch per clause, each narrowed to the
 * values that satisfy that clause and none before it, plus an else branch for the rest.
 * Clauses left without values are skipped. Any other guard is split with
 * {@link DeMorganNegator}: then-branches from {@code satisfy}, else-branches from {@code negate}.
 * <p>
 * Several top-level conditionals on one attribute are partitioned by which of their guards
 * fire, so every value in a branch drives the effects the same way. Independent groups are
 * combined pairwise, dropping combinations that contradict each other.
 */
public class PostconditionBrancher {

    private static final Logger log = LoggerFactory.getLogger(PostconditionBrancher.class);

    private final ValueSetCalculator calculator;
    private final DeMorganNegator negator;

    public PostconditionBrancher(ValueSetCalculator calculator, DeMorganNegator negator) {
        this.calculator = calculator;
        this.negator = negator;
    }

    public List<PostconditionBranch> branches(List<UnknownDetector.PostconditionGroup> groups, BranchContext ctx) {
        List<PostconditionBranch> result = List.of(PostconditionBranch.none());
        for (UnknownDetector.PostconditionGroup group : groups) {
            var next = new ArrayList<PostconditionBranch>();
            for (PostconditionBranch left : result) {
                for (PostconditionBranch right : branches(group, ctx)) {
                    left.and(right).filter(b -> !next.contains(b)).ifPresent(next::add);
                }
            }
            result = next;
        }
        if (result.isEmpty()) {
            log.warn("Postcondition groups {} admit no common outcome", groups.size());
        }
        return result;
    }

    /**
     * Branches of one group, with attributes set earlier in the action read at their written value.
     */
    public List<PostconditionBranch> branches(UnknownDetector.PostconditionGroup group, BranchContext ctx) {
        var pinned = ctx.withValues(group.writtenBefore());
        return group.isFlatRun() ? runBranches(group.effects(), pinned) : branches(group.head(), pinned);
    }

    public List<PostconditionBranch> branches(ConditionalEffect effect, BranchContext ctx) {
        if (effect == null) {
            return List.of(PostconditionBranch.none());
        }
        if (effect.condition() instanceof AttributeCondition guard) {
            if (!ctx.isUncertain(guard.target())) {
                // known guard: either it fires, or the live part of the chain starts further down
                var partition = calculator.partition(guard, ctx);
                if (partition.isEmpty() || partition.get().alwaysHolds() || effect.elseIf() == null) {
                    return List.of(PostconditionBranch.none());
                }
                return branches(effect.elseIf(), ctx);
            }
            return chainBranches(effect, guard, ctx);
        }

        var result = new ArrayList<PostconditionBranch>();
        negator.satisfy(effect.condition(), ctx)
                .forEach(c -> result.add(new PostconditionBranch(c, BranchKind.IF)));
        negator.negate(effect.condition(), ctx)
                .forEach(c -> result.add(new PostconditionBranch(c, BranchKind.ELSE)));
        return result.isEmpty() ? List.of(PostconditionBranch.none()) : result;
    }

    private List<PostconditionBranch> chainBranches(ConditionalEffect head, AttributeCondition headGuard, BranchContext ctx) {
        var first = calculator.partition(headGuard, ctx);
        if (first.isEmpty()) {
            return List.of(PostconditionBranch.none());
        }
        var target = headGuard.target();
        var possible = first.get().possible();
        var taken = new ArrayList<String>();
        var result = new ArrayList<PostconditionBranch>();

        BranchKind kind = BranchKind.IF;
        for (ConditionalEffect clause = head; clause != null; clause = clause.elseIf()) {
            if (!(clause.condition() instanceof AttributeCondition guard) || !guard.target().equals(target)) {
                break;
            }
            var partition = calculator.partition(guard, ctx);
            if (partition.isEmpty()) {
                break;
            }
            var values = partition.get().satisfying().stream().filter(v -> !taken.contains(v)).toList();
            if (!values.isEmpty()) {
                result.add(new PostconditionBranch(Configuration.of(target, values), kind));
                taken.addAll(values);
            }
            kind = BranchKind.ELIF;
        }

        var remaining = possible.stream().filter(v -> !taken.contains(v)).toList();
        if (!remaining.isEmpty()) {
            result.add(new PostconditionBranch(Configuration.of(target, remaining), BranchKind.ELSE));
        }
        return result;
    }

    /**
     * Groups the attribute's values by the clause that fires in each conditional of the run.
     * The branch where the first conditional's first clause fires is {@code IF}, one where none
     * fires is {@code ELSE}, any other is {@code ELIF}.
     */
    private List<PostconditionBranch> runBranches(List<ConditionalEffect> run, BranchContext ctx) {
        var target = ((AttributeCondition) run.get(0).condition()).target();
        var clauses = new ArrayList<List<List<String>>>();
        List<String> possible = null;
        for (ConditionalEffect effect : run) {
            var satisfying = new ArrayList<List<String>>();
            for (ConditionalEffect clause = effect; clause != null; clause = clause.elseIf()) {
                if (!(clause.condition() instanceof AttributeCondition guard) || !guard.target().equals(target)) {
                    break;
                }
                var partition = calculator.partition(guard, ctx);
                if (partition.isEmpty()) {
                    return List.of(PostconditionBranch.none());
                }
                possible = partition.get().possible();
                satisfying.add(partition.get().satisfying());
            }
            clauses.add(satisfying);
        }

        var bySignature = new LinkedHashMap<List<Integer>, List<String>>();
        for (String value : possible) {
            var signature = new ArrayList<Integer>();
            for (List<List<String>> effectClauses : clauses) {
                int fired = -1;
                for (int i = 0; i < effectClauses.size() && fired < 0; i++) {
                    if (effectClauses.get(i).contains(value)) {
                        fired = i;
                    }
                }
                signature.add(fired);
            }
            bySignature.computeIfAbsent(List.copyOf(signature), k -> new ArrayList<>()).add(value);
        }

        return bySignature.entrySet().stream()
                .sorted((a, b) -> compareFired(a.getKey(), b.getKey()))
                .map(e -> new PostconditionBranch(Configuration.of(target, e.getValue()), runKind(e.getKey())))
                .toList();
    }

    /**
     * Position of the first firing clause across the run; runs where nothing fires sort last.
     */
    private static List<Integer> firstFired(List<Integer> signature) {
        for (int i = 0; i < signature.size(); i++) {
            if (signature.get(i) >= 0) {
                return List.of(i, signature.get(i));
            }
        }
        return List.of(Integer.MAX_VALUE, 0);
    }

    private static int compareFired(List<Integer> a, List<Integer> b) {
        var first = firstFired(a);
        var second = firstFired(b);
        int byEffect = Integer.compare(first.get(0), second.get(0));
        return byEffect != 0 ? byEffect : Integer.compare(first.get(1), second.get(1));
    }

    private static BranchKind runKind(List<Integer> signature) {
        var first = firstFired(signature);
        if (first.get(0) == Integer.MAX_VALUE) {
            return BranchKind.ELSE;
        }
        return first.get(0) == 0 && first.get(1) == 0 ? BranchKind.IF : BranchKind.ELIF;
    }
}
