package com.devicesim.core.branch;

import com.devicesim.core.model.BranchCondition;
import com.devicesim.core.model.BranchKind;
import com.devicesim.core.model.BranchSource;
import com.devicesim.core.model.ComparisonOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BranchPlannerTest {

    private BranchPlanner planner;
    private UnknownDetector detector;

    @BeforeEach
    void setUp() {
        var calculator = new ValueSetCalculator();
        var negator = new DeMorganNegator(calculator);
        planner = new BranchPlanner(negator, new PostconditionBrancher(calculator, negator));
        detector = new UnknownDetector();
    }

    private List<BranchPlan> plan(String device, String action, Map<String, String> initial, List<String> unknown) {
        var ctx = BranchFixtures.context(device, initial, unknown);
        var definition = BranchFixtures.action(device, action);
        return planner.plan(definition, detector.detect(definition, ctx), ctx);
    }

    @Test
    @DisplayName("success configurations are merged with postcondition branches and empty pairs dropped")
    void mergesPostconditions() {
        var plans = plan("flashlight", "turn_on", Map.of(), List.of("battery.level"));

        assertEquals(3, plans.size());
        var full = plans.get(0);
        assertTrue(full.success());
        assertEquals(BranchCondition.simple("battery.level", List.of("full"), BranchSource.POSTCONDITION, BranchKind.IF),
                full.condition());
        var partial = plans.get(1);
        assertEquals(ComparisonOperator.IN, partial.condition().operator());
        assertEquals(List.of("low", "medium", "high"), partial.condition().values());
        assertEquals(BranchKind.ELIF, partial.condition().kind());

        var fail = plans.get(2);
        assertFalse(fail.success());
        assertEquals(BranchKind.FAIL, fail.condition().kind());
        assertEquals("Precondition failed: battery.level != empty (actual: empty)", fail.failureMessage());
    }

    @Test
    @DisplayName("each failing alternative gets a message naming the narrowed values")
    void failureMessages() {
        var plans = plan("mixer", "start", Map.of(), List.of("lid.position", "bowl.seating", "override.key"));

        var fails = plans.stream().filter(p -> !p.success()).toList();
        assertEquals(2, fails.size());
        assertEquals("Precondition failed: ((lid.position == closed AND bowl.seating == seated) OR override.key == engaged)"
                + " (actual: lid.position = open, override.key = disengaged)", fails.get(0).failureMessage());
        assertTrue(fails.get(0).condition().isCompound());
        assertEquals(BranchCondition.Combinator.AND, fails.get(0).condition().combinator());
        assertEquals(List.of("bowl.seating", "override.key"), fails.get(1).condition().attributes());
    }

    @Test
    @DisplayName("precondition-only branching keeps precondition provenance")
    void preconditionOnly() {
        var plans = plan("mixer", "start", Map.of("bowl.seating", "seated"), List.of("lid.position", "override.key"));

        var successes = plans.stream().filter(BranchPlan::success).toList();
        assertEquals(2, successes.size());
        successes.forEach(p -> {
            assertEquals(BranchSource.PRECONDITION, p.condition().source());
            assertEquals(BranchKind.SUCCESS, p.condition().kind());
        });
        assertEquals(1, plans.size() - successes.size());
    }
}
