package com.devicesim.core.branch;

import com.devicesim.core.condition.AndCondition;
import com.devicesim.core.condition.AttributeCondition;
import com.devicesim.core.condition.OrCondition;
import com.devicesim.core.engine.EvaluationException;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.ComparisonOperator;
import com.devicesim.core.model.ValueRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueSetCalculatorTest {

    private static final AttributePath BATTERY = AttributePath.parse("battery.level");

    private final ValueSetCalculator calculator = new ValueSetCalculator();

    private static AttributeCondition battery(ComparisonOperator op, String... values) {
        return new AttributeCondition(BATTERY, op, ValueRef.of(List.of(values)));
    }

    @Test
    @DisplayName("ordered comparison partitions an unknown attribute over its domain")
    void orderedPartition() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of("battery.level"));

        var partition = calculator.partition(battery(ComparisonOperator.GTE, "medium"), ctx).orElseThrow();

        assertEquals(List.of("empty", "low", "medium", "high", "full"), partition.possible());
        assertEquals(List.of("medium", "high", "full"), partition.satisfying());
        assertEquals(List.of("empty", "low"), partition.failing());
        assertFalse(partition.alwaysHolds());
        assertFalse(partition.neverHolds());
    }

    @Test
    @DisplayName("a known value is a domain of one")
    void knownValue() {
        var ctx = BranchFixtures.context("flashlight", Map.of("battery.level", "low"), List.of());

        var partition = calculator.partition(battery(ComparisonOperator.IN, "low", "high"), ctx).orElseThrow();

        assertEquals(List.of("low"), partition.possible());
        assertTrue(partition.alwaysHolds());
    }

    @Test
    @DisplayName("ordered comparison with a value outside the domain fails")
    void outsideDomain() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of("battery.level"));
        assertThrows(EvaluationException.class,
                () -> calculator.partition(battery(ComparisonOperator.LT, "dim"), ctx));
    }

    @Test
    @DisplayName("and intersects satisfying values while or unions them")
    void combinators() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of("battery.level"));
        var atLeastLow = battery(ComparisonOperator.GTE, "low");
        var atMostMedium = battery(ComparisonOperator.LTE, "medium");

        assertEquals(Map.of(BATTERY, List.of("low", "medium")),
                calculator.satisfyingValues(new AndCondition(List.of(atLeastLow, atMostMedium)), ctx));
        assertEquals(Map.of(BATTERY, List.of("empty", "high", "full")),
                calculator.failingValues(new AndCondition(List.of(atLeastLow, atMostMedium)), ctx));
        assertEquals(Map.of(BATTERY, List.of("low", "medium", "high", "full", "empty")),
                calculator.satisfyingValues(new OrCondition(List.of(atLeastLow, atMostMedium)), ctx));
    }
}
