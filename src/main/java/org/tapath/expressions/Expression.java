package org.tapath.expressions;

/**
 * 模板中出现的简单表达式。解析时一次性确定具体种类，之后不再依赖 Context 判别。
 * <ul>
 *     <li>{@link Constraint}：{@link ClockConstraint} 或 {@link GenericConstraint}</li>
 *     <li>{@link Update}：{@link VariableUpdate} 或 {@link ClockReset}</li>
 * </ul>
 */
public sealed interface Expression permits Constraint, Update {

    /**
     * @return 表达式的文本形式。
     */
    String toExpressionString();
}
