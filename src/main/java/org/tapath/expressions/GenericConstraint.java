package org.tapath.expressions;

import lombok.Getter;
import org.tapath.core.Context;

import java.util.Objects;

/**
 * 不涉及时钟的简单约束，例如 {@code i < N}，可在给定 Context 下静态求值。
 * 此类是不可变的。
 */
@Getter
public final class GenericConstraint implements Constraint {

    private final String lhs;
    private final RelationType relation;
    private final String rhs;

    GenericConstraint(String lhs, RelationType relation, String rhs) {
        this.lhs = Objects.requireNonNull(lhs, "GenericConstraint-构造函数: lhs 不能为 null");
        this.relation = Objects.requireNonNull(relation, "GenericConstraint-构造函数: relation 不能为 null");
        this.rhs = Objects.requireNonNull(rhs, "GenericConstraint-构造函数: rhs 不能为 null");
    }

    /**
     * @param ctx 当前上下文。
     * @return 约束在 ctx 下是否成立。
     */
    public boolean evaluate(Context ctx) {
        return relation.holds(ctx.getVal(lhs), ctx.getVal(rhs));
    }

    @Override
    public String toExpressionString() {
        return lhs + " " + relation.getSymbol() + " " + rhs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GenericConstraint that = (GenericConstraint) o;
        return relation == that.relation && lhs.equals(that.lhs) && rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lhs, relation, rhs);
    }

    @Override
    public String toString() {
        return toExpressionString();
    }
}
