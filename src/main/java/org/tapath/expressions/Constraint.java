package org.tapath.expressions;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.tapath.core.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 简单约束，多个简单约束以 {@code &&} 合取构成守卫或不变量。
 */
public sealed interface Constraint extends Expression permits ClockConstraint, GenericConstraint {

    String DELIMITER = " && ";

    RelationType getRelation();

    /**
     * 解析一个简单约束。只要任一侧（按 '-' 拆分后）出现时钟，就得到 {@link ClockConstraint}，
     * 否则得到可静态求值的 {@link GenericConstraint}。
     * @param text 约束文本，例如 "x - y &lt;= 10"。
     * @param ctx  用于区分时钟与其他标识符的上下文。
     * @return 解析得到的约束。
     * @throws IllegalArgumentException 如果运算符缺失或不受支持。
     */
    static Constraint parse(String text, Context ctx) {
        Objects.requireNonNull(ctx, "Constraint-parse: ctx 不能为 null");
        Triple<String, String, String> tokens = ExpressionTokenizer.tokenize(text, ExpressionTokenizer.CONSTRAINT_OPS);
        RelationType relation = RelationType.fromSymbol(tokens.getMiddle());
        List<String> parts = new ArrayList<>();
        parts.addAll(List.of(tokens.getLeft().split("-")));
        parts.addAll(List.of(tokens.getRight().split("-")));
        for (String part : parts) {
            if (ctx.isClock(part.strip())) {
                return ClockConstraint.of(tokens.getLeft(), relation, tokens.getRight(), ctx);
            }
        }
        return new GenericConstraint(tokens.getLeft(), relation, tokens.getRight());
    }

    /**
     * 解析以 {@code &&} 连接的合取式。
     * @param text 守卫或不变量文本，null 或空白视为没有约束。
     * @param ctx  上下文。
     * @return 约束列表，保持原有顺序。
     */
    static List<Constraint> parseConjunction(String text, Context ctx) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        List<Constraint> constraints = new ArrayList<>();
        for (String simple : text.split(DELIMITER.strip())) {
            if (!StringUtils.isBlank(simple)) {
                constraints.add(parse(simple, ctx));
            }
        }
        return List.copyOf(constraints);
    }

    static String join(List<? extends Constraint> constraints) {
        return constraints.stream()
                .map(Expression::toExpressionString)
                .collect(Collectors.joining(DELIMITER));
    }
}
