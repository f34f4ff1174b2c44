package org.tapath.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class RationalTest {

    @Test
    @DisplayName("构造时约分并保证分母为正")
    void testNormalization() {
        Rational r = Rational.valueOf(6, -4);
        assertAll("normalize",
                () -> assertEquals(BigInteger.valueOf(-3), r.getNumerator()),
                () -> assertEquals(BigInteger.valueOf(2), r.getDenominator()),
                () -> assertEquals(Rational.valueOf(-3, 2), r),
                () -> assertSame(Rational.ZERO, Rational.valueOf(0, 7))
        );
    }

    @Test
    @DisplayName("四则运算与比较")
    void testArithmetic() {
        Rational half = Rational.valueOf(1, 2);
        Rational third = Rational.valueOf(1, 3);
        assertAll("arithmetic",
                () -> assertEquals(Rational.valueOf(5, 6), half.add(third)),
                () -> assertEquals(Rational.valueOf(1, 6), half.subtract(third)),
                () -> assertEquals(Rational.valueOf(1, 6), half.multiply(third)),
                () -> assertEquals(Rational.valueOf(-1, 2), half.negate()),
                () -> assertTrue(third.compareTo(half) < 0),
                () -> assertTrue(Rational.valueOf(4, 2).isInteger()),
                () -> assertEquals(0.5, half.doubleValue(), 1e-12)
        );
    }

    @Test
    @DisplayName("解析分数与小数形式")
    void testParse() {
        assertAll("parse",
                () -> assertEquals(Rational.valueOf(3, 4), Rational.valueOf("3/4")),
                () -> assertEquals(Rational.valueOf(-5, 2), Rational.valueOf("-2.5")),
                () -> assertEquals(Rational.valueOf(7), Rational.valueOf("7")),
                () -> assertEquals("-5/2", Rational.valueOf("-2.5").toString()),
                () -> assertThrows(NumberFormatException.class, () -> Rational.valueOf("abc"))
        );
    }

    @Test
    @DisplayName("分母为零时抛出 ArithmeticException")
    void testZeroDenominator() {
        assertThrows(ArithmeticException.class, () -> Rational.valueOf(1, 0));
    }
}
