package com.devicesim.core.engine;

import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.DependencyConstraint;
import com.devicesim.core.model.DeviceType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks a device's dependency constraints against a concrete instance.
 */
public class ConstraintChecker {

    private final ConditionEvaluator conditions;

    public ConstraintChecker(ConditionEvaluator conditions) {
        this.conditions = conditions;
    }

    /**
     * Messages for every violated constraint. A requirement that cannot be decided because an
     * attribute is unknown does not count as violated.
     */
    public List<String> violations(DeviceType type, DeviceInstance instance, Map<String, String> parameters) {
        var result = new ArrayList<String>();
        for (DependencyConstraint constraint : type.constraints()) {
            if (violates(constraint, type, instance, parameters)) {
                result.add("Constraint violated: " + constraint.describe());
            }
        }
        return result;
    }

    public boolean violates(DependencyConstraint constraint, DeviceType type, DeviceInstance instance,
                            Map<String, String> parameters) {
        if (!conditions.holds(constraint.condition(), type, instance, parameters)) {
            return false;
        }
        var requirement = conditions.evaluate(constraint.requires(), type, instance, parameters);
        return !requirement.satisfied() && requirement.unknownAttribute() == null;
    }
}
