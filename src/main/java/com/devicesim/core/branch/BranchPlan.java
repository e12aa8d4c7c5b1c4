package com.devicesim.core.branch;

import com.devicesim.core.model.BranchCondition;

/**
 * One child node to materialize.
 *
 * @param configuration   attribute values the child is narrowed to
 * @param success         whether the preconditions hold in this branch
 * @param condition       branch condition, {@code null} for an unconstrained branch
 * @param failureMessage  rejection text for a failing branch
 */
public record BranchPlan(
    Configuration configuration,
    boolean success,
    BranchCondition condition,
    String failureMessage
) {}
