package com.devicesim.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Nested
    @DisplayName("AttributePath")
    class AttributePathTests {

        @Test
        @DisplayName("parses part.attribute")
        void parsesPartAttribute() {
            var path = AttributePath.parse("battery.level");
            assertEquals("battery", path.part());
            assertEquals("level", path.attribute());
            assertFalse(path.isGlobal());
            assertEquals("battery.level", path.toString());
        }

        @Test
        @DisplayName("a bare name is a global attribute")
        void bareNameIsGlobal() {
            var path = AttributePath.parse("temperature");
            assertTrue(path.isGlobal());
            assertEquals("temperature", path.toString());
        }

        @Test
        @DisplayName("rejects malformed paths")
        void rejectsMalformed() {
            assertThrows(IllegalArgumentException.class, () -> AttributePath.parse("a.b.c"));
            assertThrows(IllegalArgumentException.class, () -> AttributePath.parse(".level"));
            assertThrows(IllegalArgumentException.class, () -> AttributePath.parse(" "));
        }
    }

    @Nested
    @DisplayName("ActionRequest")
    class ActionRequestTests {

        @Test
        @DisplayName("parses name and parameters")
        void parsesParameters() {
            var request = ActionRequest.parse("set_brightness:level=high,mode=eco");
            assertEquals("set_brightness", request.name());
            assertEquals(Map.of("level", "high", "mode", "eco"), request.parameters());
            assertEquals("set_brightness(level=high, mode=eco)", request.describe());
        }

        @Test
        @DisplayName("a plain name has no parameters")
        void plainName() {
            var request = ActionRequest.parse("turn_on");
            assertTrue(request.parameters().isEmpty());
            assertEquals("turn_on", request.describe());
        }

        @Test
        @DisplayName("rejects a parameter without a value separator")
        void rejectsMalformedParameter() {
            assertThrows(IllegalArgumentException.class, () -> ActionRequest.parse("fill:amount"));
        }
    }

    @Nested
    @DisplayName("BranchCondition")
    class BranchConditionTests {

        @Test
        @DisplayName("simple condition uses == for one value and in for several")
        void simpleOperator() {
            var one = BranchCondition.simple("battery.level", List.of("empty"), BranchSource.PRECONDITION, BranchKind.FAIL);
            var many = BranchCondition.simple("battery.level", List.of("low", "medium"), BranchSource.PRECONDITION, BranchKind.SUCCESS);
            assertEquals(ComparisonOperator.EQUALS, one.operator());
            assertEquals(ComparisonOperator.IN, many.operator());
            assertEquals("battery.level == empty", one.describe());
            assertEquals("battery.level in {low, medium}", many.describe());
        }

        @Test
        @DisplayName("compound of one sub-condition collapses to it")
        void compoundCollapses() {
            var sub = BranchCondition.simple("lid.position", List.of("open"), BranchSource.PRECONDITION, BranchKind.FAIL);
            var compound = BranchCondition.compound(BranchCondition.Combinator.AND, List.of(sub),
                    BranchSource.PRECONDITION, BranchKind.FAIL);
            assertSame(sub, compound);
        }

        @Test
        @DisplayName("compound describes and lists its attributes")
        void compoundDescribe() {
            var a = BranchCondition.simple("lid.position", List.of("open"), BranchSource.PRECONDITION, BranchKind.FAIL);
            var b = BranchCondition.simple("override.key", List.of("disengaged"), BranchSource.PRECONDITION, BranchKind.FAIL);
            var compound = BranchCondition.compound(BranchCondition.Combinator.AND, List.of(a, b),
                    BranchSource.PRECONDITION, BranchKind.FAIL);
            assertTrue(compound.isCompound());
            assertEquals("(lid.position == open AND override.key == disengaged)", compound.describe());
            assertEquals(List.of("lid.position", "override.key"), compound.attributes());
        }

        @Test
        @DisplayName("compound with no sub-conditions is rejected")
        void emptyCompound() {
            assertThrows(IllegalArgumentException.class, () -> BranchCondition.compound(
                    BranchCondition.Combinator.OR, List.of(), BranchSource.PRECONDITION, BranchKind.SUCCESS));
        }
    }

    @Nested
    @DisplayName("Wire names")
    class WireNames {

        @Test
        @DisplayName("enums round-trip through their wire names")
        void roundTrip() {
            for (NodeStatus status : NodeStatus.values()) {
                assertEquals(status, NodeStatus.fromWireName(status.wireName()));
            }
            assertEquals("constraint_violated", NodeStatus.CONSTRAINT_VIOLATED.wireName());
            assertEquals(Trend.NONE, Trend.fromWireName(""));
            assertEquals(ComparisonOperator.GTE, ComparisonOperator.fromWireName(">="));
            assertEquals(ComparisonOperator.NOT_IN, ComparisonOperator.fromWireName("not_in"));
        }
    }
}
