package org.tapath.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.core.MutableContext;

import java.util.Objects;

/**
 * 对整数变量的更新，形如 {@code i = 3}、{@code i += N} 或 {@code i -= j}。
 * 右侧可以是字面量、常量或变量，不能是时钟。
 */
@Getter
public final class VariableUpdate implements Update {

    private static final Logger logger = LoggerFactory.getLogger(VariableUpdate.class);

    private final String variable;
    private final UpdateOperator operator;
    private final String operand;

    VariableUpdate(String variable, UpdateOperator operator, String operand) {
        this.variable = Objects.requireNonNull(variable, "VariableUpdate-构造函数: variable 不能为 null");
        this.operator = Objects.requireNonNull(operator, "VariableUpdate-构造函数: operator 不能为 null");
        this.operand = Objects.requireNonNull(operand, "VariableUpdate-构造函数: operand 不能为 null");
    }

    /**
     * 在可变上下文上执行此更新。
     * @param ctx 可变上下文。
     */
    public void apply(MutableContext ctx) {
        int current = ctx.getVal(variable);
        int value = operator.apply(current, ctx.getVal(operand));
        logger.debug("执行更新 {}: {} -> {}", this, current, value);
        ctx.setVal(variable, value);
    }

    @Override
    public String toExpressionString() {
        return variable + " " + operator.getSymbol() + " " + operand;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableUpdate that = (VariableUpdate) o;
        return operator == that.operator && variable.equals(that.variable) && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, operator, operand);
    }

    @Override
    public String toString() {
        return toExpressionString();
    }
}
