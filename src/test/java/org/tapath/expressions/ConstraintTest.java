package org.tapath.expressions;

import org.tapath.core.Context;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintTest {

    private static final Context CTX = Context.parse("clock x, y;\nconst int N = 10;\nint i = 3;");

    @Nested
    @DisplayName("时钟约束")
    class ClockConstraintTests {

        @Test
        @DisplayName("阈值在右侧: x <= N")
        void testThresholdOnRight() {
            ClockConstraint c = (ClockConstraint) Constraint.parse("x <= N", CTX);

            assertAll("x <= N",
                    () -> assertEquals(List.of("x"), c.getClocks()),
                    () -> assertEquals(ThresholdSide.RIGHT, c.getThresholdSide()),
                    () -> assertEquals("N", c.getThreshold()),
                    () -> assertEquals(RelationType.LE, c.getClockRelation()),
                    () -> assertTrue(c.isEquality()),
                    () -> assertFalse(c.isClockDifference())
            );
        }

        @Test
        @DisplayName("阈值在左侧: 10 > x 等价于 x < 10")
        void testThresholdOnLeft() {
            ClockConstraint c = (ClockConstraint) Constraint.parse("10 > x", CTX);

            assertAll("10 > x",
                    () -> assertEquals(ThresholdSide.LEFT, c.getThresholdSide()),
                    () -> assertEquals("10", c.getThreshold()),
                    () -> assertEquals(RelationType.GT, c.getRelation(), "按书写顺序"),
                    () -> assertEquals(RelationType.LT, c.getClockRelation(), "以时钟为左操作数"),
                    () -> assertFalse(c.isEquality()),
                    () -> assertEquals("10 > x", c.toExpressionString())
            );
        }

        @Test
        @DisplayName("时钟差分: x - y == i")
        void testClockDifference() {
            ClockConstraint c = (ClockConstraint) Constraint.parse("x - y == i", CTX);

            assertAll("x - y == i",
                    () -> assertEquals(List.of("x", "y"), c.getClocks()),
                    () -> assertTrue(c.isClockDifference()),
                    () -> assertEquals("i", c.getThreshold()),
                    () -> assertEquals(RelationType.EQ, c.getClockRelation())
            );
        }

        @Test
        @DisplayName("withThreshold 返回新约束，原约束不变")
        void testWithThreshold() {
            ClockConstraint c = (ClockConstraint) Constraint.parse("N >= x", CTX);
            ClockConstraint changed = c.withThreshold("7");

            assertAll("withThreshold",
                    () -> assertEquals("7 >= x", changed.toExpressionString()),
                    () -> assertEquals("N >= x", c.toExpressionString()),
                    () -> assertEquals(ThresholdSide.LEFT, changed.getThresholdSide())
            );
        }

        @Test
        @DisplayName("两侧都是时钟或不支持的运算符时抛出 IllegalArgumentException")
        void testRejected() {
            assertAll("rejected",
                    () -> assertThrows(IllegalArgumentException.class, () -> Constraint.parse("x <= y", CTX)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Constraint.parse("x != 3", CTX)),
                    () -> assertThrows(IllegalArgumentException.class, () -> Constraint.parse("x", CTX))
            );
        }
    }

    @Nested
    @DisplayName("一般约束与合取式")
    class GenericConstraintTests {

        @Test
        @DisplayName("不含时钟的约束可静态求值")
        void testGeneric() {
            Constraint c = Constraint.parse("i < N", CTX);

            assertAll("i < N",
                    () -> assertInstanceOf(GenericConstraint.class, c),
                    () -> assertTrue(((GenericConstraint) c).evaluate(CTX)),
                    () -> assertFalse(((GenericConstraint) Constraint.parse("i >= N", CTX)).evaluate(CTX))
            );
        }

        @Test
        @DisplayName("合取式按 && 拆分并保持顺序，空白文本得到空列表")
        void testConjunction() {
            List<Constraint> constraints = Constraint.parseConjunction("x >= 1 && i < N && x - y <= 2", CTX);

            assertAll("conjunction",
                    () -> assertEquals(3, constraints.size()),
                    () -> assertInstanceOf(ClockConstraint.class, constraints.get(0)),
                    () -> assertInstanceOf(GenericConstraint.class, constraints.get(1)),
                    () -> assertEquals("x >= 1 && i < N && x - y <= 2", Constraint.join(constraints)),
                    () -> assertTrue(Constraint.parseConjunction("  ", CTX).isEmpty()),
                    () -> assertTrue(Constraint.parseConjunction(null, CTX).isEmpty())
            );
        }
    }
}
