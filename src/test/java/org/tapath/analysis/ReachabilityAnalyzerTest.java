package org.tapath.analysis;

import org.tapath.automata.models.Template;
import org.tapath.automata.path.Path;
import org.tapath.core.Context;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class ReachabilityAnalyzerTest {

    private Template network;
    private SemiRealizablePathTable table;
    private ReachabilityAnalyzer analyzer;

    @BeforeAll
    void setUp() {
        network = SampleTemplates.network();
        table = new SemiRealizablePathFinder().build(network, 3);
        analyzer = new ReachabilityAnalyzer();
    }

    @Nested
    @DisplayName("可达位置")
    class ReachableTests {

        @Test
        @DisplayName("从初始位置出发可达 l0、l1、l2，按发现顺序")
        void testReachableLocations() {
            assertEquals(List.of("id0", "id1", "id2"), List.copyOf(analyzer.findReachableLocations(network, table)));
        }

        @Test
        @DisplayName("半可实现但从零出发不可实现的位置不可达")
        void testSemiRealizableButUnreachable() {
            assertAll("l5",
                    () -> assertFalse(table.get("id0", "id5", 1).isEmpty(), "路径表中有 l0 -> l5"),
                    () -> assertFalse(analyzer.findReachableLocations(network, table).contains("id5"))
            );
        }

        @Test
        @DisplayName("没有入边的位置与守卫矛盾的位置不可达")
        void testUnreachable() {
            Set<String> reachable = analyzer.findReachableLocations(network, table);
            assertAll("unreachable",
                    () -> assertFalse(reachable.contains("id3")),
                    () -> assertFalse(reachable.contains("id4"))
            );
        }

        @Test
        @DisplayName("初始位置自身的不变量不成立时没有任何可达位置")
        void testInitialLocationNotRealizable() {
            Template t = Template.builder("blocked", Context.parse("clock x;"))
                    .location("id0", "l0", "x >= 1")
                    .location("id1", "l1")
                    .transition("id0", "id1", null, null)
                    .build();
            SemiRealizablePathTable blockedTable = new SemiRealizablePathFinder().build(t, 1);
            assertTrue(analyzer.findReachableLocations(t, blockedTable).isEmpty());
        }
    }

    @Nested
    @DisplayName("上游赋值")
    class UpstreamAssignmentTests {

        @Test
        @DisplayName("守卫阈值由上游迁移赋值时，目标位置仍然可达")
        void testVariableAssignedUpstream() {
            Template t = SampleTemplates.upstreamThreshold();
            Path full = PathUtils.convertToPath(t, "l0", 0, "l1", 1, "l2");
            SemiRealizablePathTable upstream = new SemiRealizablePathFinder().build(t, 2);

            assertAll("upstream",
                    () -> assertTrue(new PathRealizabilityChecker().check(t, full, RealizabilityOptions.defaults()).isRealizable(),
                            "i = 5 之后 x 可以取 3"),
                    () -> assertEquals(List.of("id0", "id1", "id2"), List.copyOf(analyzer.findReachableLocations(t, upstream))),
                    () -> assertEquals(Set.of("id2"), analyzer.furthestReachable(t, List.of("id2"), upstream))
            );
        }
    }

    @Nested
    @DisplayName("最近的可达祖先")
    class FurthestReachableTests {

        @Test
        @DisplayName("目标本身可达时返回目标")
        void testTargetReachable() {
            assertEquals(Set.of("id2"), analyzer.furthestReachable(network, List.of("id2"), table));
        }

        @Test
        @DisplayName("目标不可达时沿反向图找到最近的可达祖先")
        void testNearestAncestor() {
            assertAll("ancestors",
                    () -> assertEquals(Set.of("id0"), analyzer.furthestReachable(network, List.of("id4"), table)),
                    () -> assertEquals(Set.of("id0"), analyzer.furthestReachable(network, List.of("id4", "id5"), table))
            );
        }

        @Test
        @DisplayName("没有可达祖先时返回空集合")
        void testNoAncestor() {
            assertTrue(analyzer.furthestReachable(network, List.of("id3"), table).isEmpty());
        }

        @Test
        @DisplayName("同一层中的全部可达位置都被返回")
        void testWholeLayer() {
            Set<String> reachable = Set.of("id1", "id2");
            assertEquals(Set.of("id1", "id2"), analyzer.furthestReachable(network, List.of("id1", "id2"), reachable));
        }

        @Test
        @DisplayName("未知的目标位置抛出 IllegalArgumentException")
        void testUnknownTarget() {
            assertThrows(IllegalArgumentException.class, () -> analyzer.furthestReachable(network, List.of("nope"), Set.of()));
        }
    }
}
