package com.devicesim.core.engine;

import com.devicesim.core.catalog.CatalogException;
import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.condition.Condition;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.DeviceType;
import com.devicesim.core.model.ParameterSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Deterministic, non-branching application of one action to one instance.
 * <p>
 * Parameters are validated first, then preconditions are evaluated against the untouched
 * instance. Effects run on a deep copy, and dependency constraints are checked on the result.
 * The input instance is never modified.
 */
public class TransitionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(TransitionEvaluator.class);

    private final DefinitionCatalog catalog;
    private final ConditionEvaluator conditions;
    private final EffectApplier effects;
    private final ConstraintChecker constraints;

    public TransitionEvaluator(DefinitionCatalog catalog) {
        this.catalog = catalog;
        this.conditions = new ConditionEvaluator(catalog);
        this.effects = new EffectApplier(catalog, conditions);
        this.constraints = new ConstraintChecker(conditions);
    }

    public ConditionEvaluator conditions() {
        return conditions;
    }

    public TransitionOutcome apply(DeviceInstance instance, ActionDefinition action, Map<String, String> parameters) {
        return run(instance, action, parameters, true);
    }

    /**
     * Applies effects without checking preconditions, for branches whose precondition outcome
     * is already decided.
     */
    public TransitionOutcome applyEffects(DeviceInstance instance, ActionDefinition action, Map<String, String> parameters) {
        return run(instance, action, parameters, false);
    }

    private TransitionOutcome run(DeviceInstance instance, ActionDefinition action,
                                  Map<String, String> parameters, boolean checkPreconditions) {
        try {
            DeviceType type = catalog.requireDeviceType(instance.typeName());

            String invalid = validateParameters(action, parameters);
            if (invalid != null) {
                log.debug("Action {} rejected: {}", action.name(), invalid);
                return TransitionOutcome.rejected(invalid, null);
            }

            if (checkPreconditions) {
                for (Condition precondition : action.preconditions()) {
                    var result = conditions.evaluate(precondition, type, instance, parameters);
                    if (!result.satisfied()) {
                        log.debug("Action {} rejected: {}", action.name(), result.detail());
                        return TransitionOutcome.rejected("Precondition failed: " + result.detail(),
                                result.unknownAttribute());
                    }
                }
            }

            DeviceInstance after = instance.deepCopy();
            var trace = new EffectTrace();
            effects.apply(action.effects(), type, after, parameters, trace);

            var violations = constraints.violations(type, after, parameters);
            if (!violations.isEmpty()) {
                log.debug("Action {} violated constraints: {}", action.name(), violations);
            }
            return TransitionOutcome.applied(after, trace, violations);
        } catch (EvaluationException | CatalogException e) {
            log.debug("Action {} failed: {}", action.name(), e.getMessage());
            return TransitionOutcome.error(e.getMessage());
        }
    }

    /**
     * @return the rejection message for missing or out-of-choice parameters, or {@code null}
     */
    public String validateParameters(ActionDefinition action, Map<String, String> parameters) {
        for (ParameterSpec spec : action.parameters()) {
            String value = parameters.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    return "Missing required parameter: " + spec.name();
                }
                continue;
            }
            if (!spec.choices().isEmpty() && !spec.choices().contains(value)) {
                return "Parameter " + spec.name() + " must be one of " + spec.choices();
            }
        }
        return null;
    }
}
