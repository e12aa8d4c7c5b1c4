package com.devicesim.core.branch;

import com.devicesim.core.effect.ConditionalEffect;
import com.devicesim.core.model.AttributePath;
import com.devicesim.core.model.BranchKind;
import com.devicesim.core.snapshot.AttributeState;
import com.devicesim.core.snapshot.SnapshotValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PostconditionBrancherTest {

    private static final AttributePath BATTERY = AttributePath.parse("battery.level");

    private PostconditionBrancher brancher;
    private ConditionalEffect brightnessChain;

    @BeforeEach
    void setUp() {
        var calculator = new ValueSetCalculator();
        brancher = new PostconditionBrancher(calculator, new DeMorganNegator(calculator));
        brightnessChain = (ConditionalEffect) BranchFixtures.action("flashlight", "turn_on").effects().get(1);
    }

    @Test
    @DisplayName("if/else-if chain gives one branch per clause plus else")
    void chain() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of("battery.level"));

        var branches = brancher.branches(brightnessChain, ctx);

        assertEquals(List.of(BranchKind.IF, BranchKind.ELIF, BranchKind.ELSE),
                branches.stream().map(PostconditionBranch::kind).toList());
        assertEquals(List.of("full"), branches.get(0).configuration().values(BATTERY));
        assertEquals(List.of("low", "medium", "high"), branches.get(1).configuration().values(BATTERY));
        assertEquals(List.of("empty"), branches.get(2).configuration().values(BATTERY));
    }

    @Test
    @DisplayName("clauses with no remaining values are skipped")
    void partialSet() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of("battery.level"));
        var narrowed = new BranchContext(ctx.catalog(), ctx.deviceType(),
                ctx.snapshot().with("battery.level", new AttributeState(
                        SnapshotValue.of(List.of("low", "medium")), null)),
                Map.of());

        var branches = brancher.branches(brightnessChain, narrowed);

        assertEquals(1, branches.size());
        assertEquals(BranchKind.ELIF, branches.get(0).kind());
        assertEquals(List.of("low", "medium"), branches.get(0).configuration().values(BATTERY));
    }

    @Test
    @DisplayName("no branching effect gives a single unconstrained branch")
    void none() {
        var ctx = BranchFixtures.context("flashlight", Map.of(), List.of());
        var branches = brancher.branches((ConditionalEffect) null, ctx);
        assertEquals(1, branches.size());
        assertTrue(branches.get(0).configuration().isUnconstrained());
        assertNull(branches.get(0).kind());
    }

    @Nested
    @DisplayName("Groups of top-level conditionals")
    class Groups {

        private final UnknownDetector detector = new UnknownDetector();
        private final AttributePath position = AttributePath.parse("switch.position");

        private List<PostconditionBranch> branch(String action, BranchContext ctx) {
            var detection = detector.detect(BranchFixtures.action("lantern", action), ctx);
            return brancher.branches(detection.groups(), ctx);
        }

        @Test
        @DisplayName("a run on one attribute reads as if/elif/else")
        void flatRun() {
            var ctx = BranchFixtures.context("lantern", Map.of(), List.of("battery.level"));

            var branches = branch("match_level", ctx);

            assertEquals(List.of(BranchKind.IF, BranchKind.ELIF, BranchKind.ELSE),
                    branches.stream().map(PostconditionBranch::kind).toList());
            assertEquals(List.of("full"), branches.get(0).configuration().values(BATTERY));
            assertEquals(List.of("high"), branches.get(1).configuration().values(BATTERY));
            assertEquals(List.of("empty", "low", "medium"), branches.get(2).configuration().values(BATTERY));
        }

        @Test
        @DisplayName("a run only sees the values still possible")
        void flatRunOnSet() {
            var ctx = BranchFixtures.withSet(BranchFixtures.context("lantern", Map.of(), List.of()),
                    "battery.level", List.of("medium", "high"));

            var branches = branch("match_level", ctx);

            assertEquals(2, branches.size());
            assertEquals(BranchKind.ELIF, branches.get(0).kind());
            assertEquals(List.of("high"), branches.get(0).configuration().values(BATTERY));
            assertEquals(BranchKind.ELSE, branches.get(1).kind());
            assertEquals(List.of("medium"), branches.get(1).configuration().values(BATTERY));
        }

        @Test
        @DisplayName("groups on different attributes are crossed")
        void crossed() {
            var ctx = BranchFixtures.context("lantern", Map.of(), List.of("battery.level", "switch.position"));

            var branches = branch("match_level_and_switch", ctx);

            assertEquals(4, branches.size());
            var switchedOn = branches.stream()
                    .filter(b -> b.configuration().values(position).equals(List.of("on")))
                    .toList();
            assertEquals(2, switchedOn.size());
            assertTrue(switchedOn.stream().allMatch(b -> b.kindOf(position) == BranchKind.IF));
            assertEquals(Set.of(List.of("full"), List.of("empty", "low", "medium", "high")),
                    switchedOn.stream().map(b -> b.configuration().values(BATTERY)).collect(Collectors.toSet()));
        }

        @Test
        @DisplayName("an attribute set before the guard is read at its written value")
        void writtenGuard() {
            var ctx = BranchFixtures.context("lantern", Map.of(), List.of("battery.level", "switch.position"));

            var branches = branch("switch_and_glow", ctx);

            assertEquals(2, branches.size());
            assertTrue(branches.stream().noneMatch(b -> b.configuration().constrains(position)));
            assertEquals(List.of("full"), branches.get(0).configuration().values(BATTERY));
            assertEquals(BranchKind.IF, branches.get(0).kind());
            assertEquals(List.of("empty", "low", "medium", "high"), branches.get(1).configuration().values(BATTERY));
            assertEquals(BranchKind.ELSE, branches.get(1).kind());
        }
    }
}
