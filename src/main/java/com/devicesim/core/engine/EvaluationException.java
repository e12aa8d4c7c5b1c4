package com.devicesim.core.engine;

/**
 * Raised while evaluating a condition or effect that references something that does not
 * exist, such as an undeclared attribute or a value outside its domain. The evaluator turns
 * it into an {@code ERROR} outcome; it never escapes a transition.
 */
public class EvaluationException extends RuntimeException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
