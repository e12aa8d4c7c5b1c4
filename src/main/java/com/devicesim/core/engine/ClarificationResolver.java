package com.devicesim.core.engine;

import com.devicesim.core.model.AttributePath;

import java.util.List;
import java.util.Optional;

/**
 * Supplies an answer to a clarification question, e.g. from an interactive prompt.
 */
@FunctionalInterface
public interface ClarificationResolver {

    /**
     * @param question  text of the form {@code What is <path>?}
     * @param attribute the attribute being asked about
     * @param choices   the attribute's domain levels
     * @return the answer, or empty to give up
     */
    Optional<String> answer(String question, AttributePath attribute, List<String> choices);
}
