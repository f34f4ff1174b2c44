package org.tapath.expressions;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.tapath.core.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 迁移上的更新。多个更新以 ", " 分隔，从左到右执行。
 */
public sealed interface Update extends Expression permits VariableUpdate, ClockReset {

    String DELIMITER = ", ";

    /**
     * 解析一个简单更新。左侧为时钟时得到 {@link ClockReset}，否则得到 {@link VariableUpdate}。
     * @param text 更新文本，例如 "x = 0" 或 "i += 1"。
     * @param ctx  上下文。
     * @return 解析得到的更新。
     * @throws IllegalArgumentException 如果运算符不受支持或时钟更新不是重置为 0。
     */
    static Update parse(String text, Context ctx) {
        Triple<String, String, String> tokens = ExpressionTokenizer.tokenize(text, ExpressionTokenizer.UPDATE_OPS);
        UpdateOperator op = UpdateOperator.fromSymbol(tokens.getMiddle());
        if (ctx.isClock(tokens.getLeft())) {
            return ClockReset.of(tokens.getLeft(), op, tokens.getRight());
        }
        return new VariableUpdate(tokens.getLeft(), op, tokens.getRight());
    }

    /**
     * @param text 赋值标签文本，null 或空白视为没有更新。
     * @param ctx  上下文。
     * @return 更新列表，保持原有顺序。
     */
    static List<Update> parseList(String text, Context ctx) {
        if (StringUtils.isBlank(text)) {
            return List.of();
        }
        List<Update> updates = new ArrayList<>();
        for (String simple : text.split(DELIMITER.strip())) {
            if (!StringUtils.isBlank(simple)) {
                updates.add(parse(simple, ctx));
            }
        }
        return List.copyOf(updates);
    }

    static String join(List<? extends Update> updates) {
        return updates.stream()
                .map(Expression::toExpressionString)
                .collect(Collectors.joining(DELIMITER));
    }
}
