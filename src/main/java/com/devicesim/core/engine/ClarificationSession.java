package com.devicesim.core.engine;

import com.devicesim.core.catalog.DefinitionCatalog;
import com.devicesim.core.instance.DeviceInstance;
import com.devicesim.core.model.ActionDefinition;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.NodeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Linear application of an action that asks for missing values instead of branching.
 * Each answer is checked against the attribute's domain, written into a working copy of the
 * instance, and the action is retried.
 */
public class ClarificationSession {

    private static final Logger log = LoggerFactory.getLogger(ClarificationSession.class);

    private final DefinitionCatalog catalog;
    private final TransitionEvaluator evaluator;
    private final int maxAttempts;

    public ClarificationSession(DefinitionCatalog catalog, TransitionEvaluator evaluator, int maxAttempts) {
        this.catalog = catalog;
        this.evaluator = evaluator;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @param outcome final outcome after the last retry
     * @param answers accepted answers in the order they were given
     */
    public record Result(TransitionOutcome outcome, Map<AttributePath, String> answers) {}

    public Result run(DeviceInstance instance, ActionDefinition action, Map<String, String> parameters,
                      ClarificationResolver resolver) {
        DeviceInstance working = instance.deepCopy();
        var answers = new LinkedHashMap<AttributePath, String>();
        var type = catalog.requireDeviceType(instance.typeName());

        TransitionOutcome outcome = evaluator.apply(working, action, parameters);
        int attempts = 0;
        while (outcome.status() == NodeStatus.REJECTED && outcome.needsClarification() && attempts < maxAttempts) {
            attempts++;
            AttributePath path = outcome.clarificationAttribute();
            var domain = catalog.domainOf(type, path);
            if (domain.isEmpty()) {
                log.warn("Cannot clarify {}: no value domain", path);
                break;
            }
            var answer = resolver.answer(outcome.clarificationQuestion(), path, domain.get().levels());
            if (answer.isEmpty()) {
                log.info("Clarification for {} declined", path);
                break;
            }
            String value = answer.get().trim();
            if (!domain.get().contains(value)) {
                log.warn("Ignoring answer '{}' for {}: expected one of {}", value, path, domain.get().levels());
                continue;
            }
            working.attribute(path).writeValue(value);
            answers.put(path, value);
            outcome = evaluator.apply(working, action, parameters);
        }
        return new Result(outcome, Collections.unmodifiableMap(answers));
    }
}
