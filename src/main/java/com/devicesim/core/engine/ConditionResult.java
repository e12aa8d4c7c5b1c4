package com.devicesim.core.engine;

import com.devicesim.core.model.AttributePath;

/**
 * Result of evaluating a condition against a concrete instance.
 *
 * @param satisfied        whether the condition holds
 * @param detail           rendered operands of the deciding comparison, for messages
 * @param unknownAttribute first attribute holding {@code unknown} that made the condition
 *                         fail, or {@code null}
 */
public record ConditionResult(
    boolean satisfied,
    String detail,
    AttributePath unknownAttribute
) {

    public static ConditionResult pass(String detail) {
        return new ConditionResult(true, detail, null);
    }

    public static ConditionResult fail(String detail, AttributePath unknownAttribute) {
        return new ConditionResult(false, detail, unknownAttribute);
    }

    public boolean blockedByUnknown() {
        return !satisfied && unknownAttribute != null;
    }
}
