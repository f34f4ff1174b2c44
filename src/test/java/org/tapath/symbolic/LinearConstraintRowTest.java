package org.tapath.symbolic;

import org.tapath.utils.Rational;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LinearConstraintRowTest {

    private static final LinearConstraintRow ROW = LinearConstraintRow.of(new int[]{1, -1, 0}, Rational.valueOf(3));

    @Test
    @DisplayName("negate 同时翻转系数与右端项")
    void testNegate() {
        assertEquals(LinearConstraintRow.of(new int[]{-1, 1, 0}, Rational.valueOf(-3)), ROW.negate());
    }

    @Test
    @DisplayName("tighten 只减小右端项")
    void testTighten() {
        LinearConstraintRow tightened = ROW.tighten(Rational.valueOf(1, 1024));
        assertAll("tighten",
                () -> assertEquals(ROW.getCoefficients(), tightened.getCoefficients()),
                () -> assertEquals(Rational.valueOf(3071, 1024), tightened.getBound())
        );
    }

    @Test
    @DisplayName("isSatisfiedBy 按精确有理数比较")
    void testIsSatisfiedBy() {
        assertAll("satisfied",
                () -> assertTrue(ROW.isSatisfiedBy(List.of(Rational.valueOf(5), Rational.valueOf(2), Rational.valueOf(100)))),
                () -> assertFalse(ROW.isSatisfiedBy(List.of(Rational.valueOf(5), Rational.valueOf(1, 2), Rational.ZERO))),
                () -> assertFalse(ROW.tighten(Rational.valueOf(1, 1024))
                        .isSatisfiedBy(List.of(Rational.valueOf(3), Rational.ZERO, Rational.ZERO)))
        );
    }

    @Test
    @DisplayName("线性规划拒绝宽度不一致的行")
    void testProgramWidthChecked() {
        assertThrows(IllegalArgumentException.class, () -> new LinearProgram(List.of("a", "b"), List.of(ROW)));
    }

    @Test
    @DisplayName("线性规划的可行解必须非负")
    void testProgramNonNegative() {
        LinearProgram program = new LinearProgram(List.of("a", "b", "c"), List.of(ROW));
        assertAll("program",
                () -> assertTrue(program.isSatisfiedBy(List.of(Rational.ONE, Rational.ZERO, Rational.ZERO))),
                () -> assertFalse(program.isSatisfiedBy(List.of(Rational.ONE, Rational.valueOf(-1), Rational.ZERO))),
                () -> assertFalse(program.isSatisfiedBy(List.of(Rational.ONE)))
        );
    }
}
