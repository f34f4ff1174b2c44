package org.tapath.utils;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RatNum;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 有限有理数，分子分母均为 BigInteger，总是约分且分母为正。
 * 线性规划的右端项与见证解都用它表示，避免 EPSILON 扰动在浮点下丢失精度。
 * 此类是不可变的。
 * @author Ayalyt
 */
public final class Rational implements Comparable<Rational> {
    private static final Logger logger = LoggerFactory.getLogger(Rational.class);
    private static final int MAX_CACHE_MAGNITUDE = 1024;
    private static final ConcurrentHashMap<List<BigInteger>, Rational> CACHE = new ConcurrentHashMap<>(256);

    @Getter
    private final BigInteger numerator;
    @Getter
    private final BigInteger denominator;

    private volatile int hash;

    // 常用常量
    public static final Rational ZERO = new Rational(BigInteger.ZERO, BigInteger.ONE); // 0/1
    public static final Rational ONE = new Rational(BigInteger.ONE, BigInteger.ONE);   // 1/1

    static {
        CACHE.put(ZERO.getCacheKey(), ZERO);
        CACHE.put(ONE.getCacheKey(), ONE);
        for (int i = -16; i <= 16; i++) {
            valueOf(i);
        }
    }

    private Rational(BigInteger numerator, BigInteger denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    // ========== 工厂方法 ==========

    public static Rational valueOf(long numerator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.ONE);
    }

    public static Rational valueOf(long numerator, long denominator) {
        return valueOf(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
    }

    public static Rational valueOf(BigInteger numerator, BigInteger denominator) {
        Objects.requireNonNull(numerator, "Rational-valueOf: numerator 不能为 null");
        Objects.requireNonNull(denominator, "Rational-valueOf: denominator 不能为 null");
        if (denominator.signum() == 0) {
            logger.error("Rational-valueOf: 分母为零 ({} / 0)", numerator);
            throw new ArithmeticException("Rational-valueOf: 分母不能为零");
        }
        if (numerator.signum() == 0) {
            return ZERO;
        }
        // 分母总是正数
        if (denominator.signum() < 0) {
            numerator = numerator.negate();
            denominator = denominator.negate();
        }
        BigInteger gcd = numerator.gcd(denominator);
        if (!gcd.equals(BigInteger.ONE)) {
            numerator = numerator.divide(gcd);
            denominator = denominator.divide(gcd);
        }

        List<BigInteger> key = List.of(numerator, denominator);
        Rational cached = CACHE.get(key);
        if (cached != null) {
            return cached;
        }
        Rational result = new Rational(numerator, denominator);
        if (result.shouldCache()) {
            CACHE.put(key, result);
        }
        return result;
    }

    /**
     * 解析 "n"、"n/d" 或十进制小数形式的字符串。
     * @param s 输入字符串。
     * @return 对应的 Rational。
     * @throws NumberFormatException 如果格式非法。
     */
    public static Rational valueOf(String s) {
        String trimmed = Objects.requireNonNull(s, "Rational-valueOf: 字符串不能为 null").trim();
        int slash = trimmed.indexOf('/');
        if (slash >= 0) {
            return valueOf(new BigInteger(trimmed.substring(0, slash).trim()),
                    new BigInteger(trimmed.substring(slash + 1).trim()));
        }
        BigDecimal decimal = new BigDecimal(trimmed);
        if (decimal.scale() <= 0) {
            return valueOf(decimal.toBigIntegerExact(), BigInteger.ONE);
        }
        return valueOf(decimal.unscaledValue(), BigInteger.TEN.pow(decimal.scale()));
    }

    /**
     * 从 Z3 模型中的有理数值构造。
     * @param ratNum Z3 有理数。
     * @return 对应的 Rational。
     */
    public static Rational fromZ3(RatNum ratNum) {
        return valueOf(ratNum.getBigIntNumerator(), ratNum.getBigIntDenominator());
    }

    // ========== 运算 ==========

    public Rational add(Rational other) {
        if (this.denominator.equals(other.denominator)) {
            return valueOf(this.numerator.add(other.numerator), this.denominator);
        }
        return valueOf(this.numerator.multiply(other.denominator).add(other.numerator.multiply(this.denominator)),
                this.denominator.multiply(other.denominator));
    }

    public Rational subtract(Rational other) {
        return add(other.negate());
    }

    public Rational multiply(Rational other) {
        return valueOf(this.numerator.multiply(other.numerator), this.denominator.multiply(other.denominator));
    }

    public Rational negate() {
        return valueOf(numerator.negate(), denominator);
    }

    public int signum() {
        return numerator.signum();
    }

    public boolean isZero() {
        return numerator.signum() == 0;
    }

    public boolean isInteger() {
        return denominator.equals(BigInteger.ONE);
    }

    public double doubleValue() {
        if (isInteger()) {
            return numerator.doubleValue();
        }
        return new BigDecimal(numerator).divide(new BigDecimal(denominator), MathContext.DECIMAL64).doubleValue();
    }

    /**
     * 转换为 Z3 实数常量。
     * @param ctx Z3 Context 实例。
     * @return 对应的 Z3 ArithExpr。
     */
    public ArithExpr toZ3Real(Context ctx) {
        if (signum() < 0) {
            return ctx.mkUnaryMinus(ctx.mkReal(this.negate().toString()));
        }
        return ctx.mkReal(this.toString());
    }

    private boolean shouldCache() {
        return numerator.abs().compareTo(BigInteger.valueOf(MAX_CACHE_MAGNITUDE)) <= 0
                && denominator.compareTo(BigInteger.valueOf(MAX_CACHE_MAGNITUDE)) <= 0;
    }

    private List<BigInteger> getCacheKey() {
        return List.of(numerator, denominator);
    }

    // ========== 对象基础方法 ==========

    @Override
    public int compareTo(Rational other) {
        return this.numerator.multiply(other.denominator).compareTo(other.numerator.multiply(this.denominator));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Rational that = (Rational) o;
        // 构造时已约分，直接比较分子分母即可
        return numerator.equals(that.numerator) && denominator.equals(that.denominator);
    }

    @Override
    public int hashCode() {
        int h = hash;
        if (h == 0) {
            h = Objects.hash(numerator, denominator);
            hash = h;
        }
        return h;
    }

    @Override
    public String toString() {
        if (isInteger()) {
            return numerator.toString();
        }
        return numerator + "/" + denominator;
    }
}
