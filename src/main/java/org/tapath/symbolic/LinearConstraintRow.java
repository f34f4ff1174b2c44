package org.tapath.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.tapath.utils.Rational;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 线性规划中的一行约束 {@code a1*x1 + ... + an*xn <= b}。
 * 此类是不可变的。
 */
@Getter
public final class LinearConstraintRow implements ToZ3BoolExpr {

    private final List<Rational> coefficients;
    private final Rational bound;

    private final int hashCode;

    private LinearConstraintRow(List<Rational> coefficients, Rational bound) {
        this.coefficients = Collections.unmodifiableList(new ArrayList<>(coefficients));
        this.bound = Objects.requireNonNull(bound, "LinearConstraintRow-构造函数: bound 不能为 null");
        this.hashCode = Objects.hash(this.coefficients, bound);
    }

    public static LinearConstraintRow of(List<Rational> coefficients, Rational bound) {
        return new LinearConstraintRow(coefficients, bound);
    }

    /**
     * 以整数系数构造，便于测试与手写约束。
     */
    public static LinearConstraintRow of(int[] coefficients, Rational bound) {
        List<Rational> list = new ArrayList<>(coefficients.length);
        for (int c : coefficients) {
            list.add(Rational.valueOf(c));
        }
        return new LinearConstraintRow(list, bound);
    }

    /**
     * 整行（系数与右端项）乘以 -1。
     */
    public LinearConstraintRow negate() {
        List<Rational> negated = new ArrayList<>(coefficients.size());
        for (Rational c : coefficients) {
            negated.add(c.negate());
        }
        return new LinearConstraintRow(negated, bound.negate());
    }

    /**
     * 右端项减去 delta，系数不变。
     */
    public LinearConstraintRow tighten(Rational delta) {
        return new LinearConstraintRow(coefficients, bound.subtract(delta));
    }

    public int size() {
        return coefficients.size();
    }

    public Rational coefficient(int index) {
        return coefficients.get(index);
    }

    /**
     * @param assignment 每个变量的取值。
     * @return 该赋值是否满足本行。
     */
    public boolean isSatisfiedBy(List<Rational> assignment) {
        Rational sum = Rational.ZERO;
        for (int i = 0; i < coefficients.size(); i++) {
            if (!coefficients.get(i).isZero()) {
                sum = sum.add(coefficients.get(i).multiply(assignment.get(i)));
            }
        }
        return sum.compareTo(bound) <= 0;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, LpVariableManager varManager) {
        List<ArithExpr> terms = new ArrayList<>();
        for (int i = 0; i < coefficients.size(); i++) {
            Rational coeff = coefficients.get(i);
            if (coeff.isZero()) {
                continue;
            }
            ArithExpr var = varManager.getZ3Var(i);
            terms.add(coeff.equals(Rational.ONE) ? var : ctx.mkMul(coeff.toZ3Real(ctx), var));
        }
        ArithExpr lhs;
        if (terms.isEmpty()) {
            lhs = ctx.mkReal(0);
        } else if (terms.size() == 1) {
            lhs = terms.get(0);
        } else {
            lhs = ctx.mkAdd(terms.toArray(new ArithExpr[0]));
        }
        return ctx.mkLe(lhs, bound.toZ3Real(ctx));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraintRow that = (LinearConstraintRow) o;
        return coefficients.equals(that.coefficients) && bound.equals(that.bound);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return Arrays.toString(coefficients.toArray()) + " <= " + bound;
    }
}
