package com.devicesim.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderedDomainTest {

    private final OrderedDomain battery = new OrderedDomain("battery_level",
            List.of("empty", "low", "medium", "high", "full"));

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("rejects duplicate levels")
        void rejectsDuplicates() {
            var e = assertThrows(IllegalArgumentException.class,
                    () -> new OrderedDomain("d", List.of("a", "b", "a")));
            assertTrue(e.getMessage().contains("duplicate level 'a'"));
        }

        @Test
        @DisplayName("rejects an empty level list")
        void rejectsEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new OrderedDomain("d", List.of()));
        }

        @Test
        @DisplayName("reserves the unknown sentinel")
        void reservesUnknown() {
            assertThrows(IllegalArgumentException.class,
                    () -> new OrderedDomain("d", List.of("low", OrderedDomain.UNKNOWN)));
        }

        @Test
        @DisplayName("levels are immutable")
        void levelsImmutable() {
            assertThrows(UnsupportedOperationException.class, () -> battery.levels().add("overfull"));
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("compare follows declaration order")
        void compare() {
            assertTrue(battery.compare("low", "high") < 0);
            assertTrue(battery.compare("full", "empty") > 0);
            assertEquals(0, battery.compare("medium", "medium"));
        }

        @Test
        @DisplayName("indexOf rejects values outside the domain")
        void indexOfUnknown() {
            assertThrows(IllegalArgumentException.class, () -> battery.indexOf("overfull"));
        }

        @Test
        @DisplayName("ordered sorts into domain order and drops strangers")
        void ordered() {
            assertEquals(List.of("low", "high"), battery.ordered(List.of("high", "bogus", "low")));
        }

        @Test
        @DisplayName("complement keeps domain order")
        void complement() {
            assertEquals(List.of("empty", "medium", "full"), battery.complement(List.of("high", "low")));
        }
    }

    @Nested
    @DisplayName("Trend expansion")
    class TrendExpansion {

        @Test
        @DisplayName("down yields every level at or below the value")
        void down() {
            assertEquals(List.of("empty", "low", "medium"), battery.levelsFrom("medium", Trend.DOWN));
        }

        @Test
        @DisplayName("up yields every level at or above the value")
        void up() {
            assertEquals(List.of("high", "full"), battery.levelsFrom("high", Trend.UP));
        }

        @Test
        @DisplayName("none yields the value itself")
        void none() {
            assertEquals(List.of("low"), battery.levelsFrom("low", Trend.NONE));
        }
    }

    @Test
    @DisplayName("ordered operators select levels by position")
    void valuesSatisfying() {
        assertEquals(List.of("high", "full"), battery.valuesSatisfying(ComparisonOperator.GTE, List.of("high")));
        assertEquals(List.of("empty", "low"), battery.valuesSatisfying(ComparisonOperator.LT, List.of("medium")));
        assertEquals(List.of("low", "full"), battery.valuesSatisfying(ComparisonOperator.IN, List.of("full", "low")));
        assertEquals(List.of("empty", "medium", "high"),
                battery.valuesSatisfying(ComparisonOperator.NOT_IN, List.of("full", "low")));
    }

    @Test
    @DisplayName("filter keeps candidate order and ignores levels outside the candidates")
    void operatorFilter() {
        assertEquals(List.of("full", "high"),
                ComparisonOperator.GTE.filter(battery, List.of("full", "low", "high"), List.of("high")));
        assertEquals(List.of(), ComparisonOperator.NOT_IN.filter(battery, List.of("low"), List.of("low")));
    }
}
