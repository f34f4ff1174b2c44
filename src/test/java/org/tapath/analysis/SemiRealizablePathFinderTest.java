package org.tapath.analysis;

import org.tapath.automata.base.Location;
import org.tapath.automata.models.Template;
import org.tapath.automata.path.Path;
import org.tapath.symbolic.FeasibilityResult;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SemiRealizablePathFinderTest {

    private static final int MAX_LENGTH = 3;

    private Template network;
    private SemiRealizablePathTable table;

    @BeforeAll
    void setUp() {
        network = SampleTemplates.network();
        table = new SemiRealizablePathFinder().build(network, MAX_LENGTH);
    }

    @Nested
    @DisplayName("基础情形")
    class BaseCaseTests {

        @Test
        @DisplayName("每个位置的 DP[i][i][0] 恰为单位置路径")
        void testZeroLength() {
            for (Location location : network.getGraph().getLocations()) {
                assertEquals(List.of(Path.of(location)), table.get(location.getId(), location.getId(), 0),
                        "DP[" + location + "][" + location + "][0]");
            }
        }

        @Test
        @DisplayName("不同位置之间没有长度为 0 的路径")
        void testNoZeroLengthBetweenDistinctLocations() {
            assertTrue(table.get("id0", "id1", 0).isEmpty());
        }

        @Test
        @DisplayName("长度 1：只保留半可实现的迁移")
        void testLengthOne() {
            assertAll("length 1",
                    () -> assertEquals(List.of(PathUtils.convertToPath(network, "l0", 0, "l1")), table.get("id0", "id1", 1)),
                    () -> assertEquals(List.of(PathUtils.convertToPath(network, "l1", 1, "l2")), table.get("id1", "id2", 1),
                            "#2 要求 x >= 4，与 l1 的不变量 x <= 3 矛盾"),
                    () -> assertTrue(table.get("id0", "id4", 1).isEmpty(), "#5 与 l0 的不变量矛盾"),
                    () -> assertEquals(1, table.get("id0", "id5", 1).size(), "时钟初值自由时 y >= 6 可满足"),
                    () -> assertEquals(1, table.get("id3", "id0", 1).size())
            );
        }
    }

    @Nested
    @DisplayName("拼接与去重")
    class ConcatenationTests {

        @Test
        @DisplayName("长度 2 的路径由两条长度 1 的路径拼接而成")
        void testLengthTwo() {
            assertAll("length 2",
                    () -> assertEquals(List.of(PathUtils.convertToPath(network, "l0", 0, "l1", 1, "l2")), table.get("id0", "id2", 2)),
                    () -> assertEquals(List.of(PathUtils.convertToPath(network, "l2", 3, "l0", 0, "l1")), table.get("id2", "id1", 2)),
                    () -> assertTrue(table.get("id0", "id4", 2).isEmpty())
            );
        }

        @Test
        @DisplayName("环路 l0-l1-l2-l0 可由两种分割点得到，但只记录一次")
        void testCycleRecordedOnce() {
            Path cycle = PathUtils.convertToPath(network, "l0", 0, "l1", 1, "l2", 3, "l0");
            assertEquals(List.of(cycle), table.get("id0", "id0", 3));
        }

        @Test
        @DisplayName("任何单元格都没有重复路径，且路径长度与起止位置正确")
        void testCellInvariants() {
            for (String i : table.getLocationIds()) {
                for (String j : table.getLocationIds()) {
                    for (int k = 0; k <= MAX_LENGTH; k++) {
                        List<Path> paths = table.get(i, j, k);
                        assertEquals(paths.size(), new HashSet<>(paths).size(), "DP[" + i + "][" + j + "][" + k + "] 有重复");
                        for (Path path : paths) {
                            assertAll("cell " + i + "," + j + "," + k,
                                    () -> assertEquals(i, path.first().getId()),
                                    () -> assertEquals(j, path.last().getId()),
                                    () -> assertTrue(path.exists()));
                            assertEquals(k, path.length());
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("超出最大长度的查询返回空列表")
        void testOutOfRange() {
            assertAll("range",
                    () -> assertTrue(table.get("id0", "id0", MAX_LENGTH + 1).isEmpty()),
                    () -> assertTrue(table.get("id0", "id0", -1).isEmpty()),
                    () -> assertThrows(IllegalArgumentException.class, () -> table.get("nope", "id0", 0))
            );
        }
    }

    @Nested
    @DisplayName("以变量为阈值的约束")
    class VariableThresholdTests {

        @Test
        @DisplayName("子路径中阈值为变量的时钟约束被跳过，不按变量初值剪枝")
        void testUpstreamAssignmentKeepsSubPath() {
            Template t = SampleTemplates.upstreamThreshold();
            SemiRealizablePathTable upstream = new SemiRealizablePathFinder().build(t, 2);

            assertAll("variable threshold",
                    () -> assertEquals(List.of(PathUtils.convertToPath(t, "l1", 1, "l2")), upstream.get("id1", "id2", 1)),
                    () -> assertEquals(List.of(PathUtils.convertToPath(t, "l0", 0, "l1", 1, "l2")), upstream.get("id0", "id2", 2))
            );
        }
    }

    @Nested
    @DisplayName("并行构造")
    class ParallelTests {

        @Test
        @DisplayName("多线程构造的路径表与串行构造完全相同")
        void testParallelMatchesSequential() {
            SemiRealizablePathTable parallel = new SemiRealizablePathFinder().build(network, MAX_LENGTH, 4);
            for (String i : table.getLocationIds()) {
                for (String j : table.getLocationIds()) {
                    for (int k = 0; k <= MAX_LENGTH; k++) {
                        assertEquals(table.get(i, j, k), parallel.get(i, j, k), "DP[" + i + "][" + j + "][" + k + "]");
                    }
                }
            }
            assertEquals(table.totalPaths(), parallel.totalPaths());
        }

        @Test
        @DisplayName("线程数必须为正数")
        void testInvalidThreads() {
            assertThrows(IllegalArgumentException.class, () -> new SemiRealizablePathFinder().build(network, 1, 0));
        }
    }

    @Nested
    @DisplayName("无法判定的路径")
    class UndecidedTests {

        @Test
        @DisplayName("求解器返回 UNKNOWN 的路径不进入路径表，而是单独记录")
        void testUndecidedPathsAreExcluded() {
            PathRealizabilityChecker undecided = new PathRealizabilityChecker(program -> FeasibilityResult.unknown("timeout"));
            SemiRealizablePathTable result = new SemiRealizablePathFinder(undecided).build(network, 2);

            assertAll("undecided",
                    () -> assertTrue(result.get("id0", "id1", 1).isEmpty()),
                    () -> assertEquals(network.getGraph().getTransitionsInFileOrder().size(), result.getUndecidedPaths().size(),
                            "每条迁移各记录一次"),
                    () -> assertEquals(network.getGraph().size(), result.totalPaths(), "只剩长度为 0 的路径")
            );
        }
    }
}
