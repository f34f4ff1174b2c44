package org.tapath.expressions;

import org.apache.commons.lang3.tuple.ImmutableTriple;
import org.apache.commons.lang3.tuple.Triple;

import java.util.Objects;

/**
 * 将一个简单表达式切分为 (lhs, op, rhs)。
 * 从左到右找到第一个运算符字符，若紧随其后的字符也是运算符字符则视为双字符运算符。
 * 时钟差分中的 '-' 不应出现在 opChars 中，差分只在已切分出的一侧内部再次拆分。
 */
public final class ExpressionTokenizer {

    /** 约束表达式使用的运算符字符 */
    public static final String CONSTRAINT_OPS = "<>=!";
    /** 更新表达式使用的运算符字符 */
    public static final String UPDATE_OPS = "=+-";

    private ExpressionTokenizer() {
    }

    /**
     * @param string  表达式文本。
     * @param opChars 合法的运算符字符。
     * @return (lhs, op, rhs)，两侧已去除空白；找不到运算符时 op 与 rhs 为空串，lhs 为原文本。
     */
    public static Triple<String, String, String> tokenize(String string, String opChars) {
        Objects.requireNonNull(string, "ExpressionTokenizer: 表达式不能为 null");
        for (int i = 0; i < string.length(); i++) {
            char c = string.charAt(i);
            if (opChars.indexOf(c) < 0) {
                continue;
            }
            int opEnd = i + 1;
            if (opEnd < string.length() && opChars.indexOf(string.charAt(opEnd)) >= 0) {
                opEnd++;
            }
            return ImmutableTriple.of(string.substring(0, i).strip(),
                    string.substring(i, opEnd),
                    string.substring(opEnd).strip());
        }
        return ImmutableTriple.of(string.strip(), "", "");
    }
}
