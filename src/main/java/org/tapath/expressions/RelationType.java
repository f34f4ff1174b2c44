package org.tapath.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum RelationType {

    /**
     * 比较运算符枚举
     */
    LT("<"),    // Less Than
    LE("<="),   // Less Equal
    EQ("=="),   // Equal
    GE(">="),   // Greater Equal
    GT(">");    // Greater Than

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    private static final Logger logger = LoggerFactory.getLogger(RelationType.class);

    /**
     * 根据运算符文本查找关系类型。
     * @param symbol 运算符文本，例如 "<="。
     * @return 对应的 RelationType。
     * @throws IllegalArgumentException 如果运算符不受支持（例如 "!="）。
     */
    public static RelationType fromSymbol(String symbol) {
        for (RelationType type : values()) {
            if (type.symbol.equals(symbol)) {
                return type;
            }
        }
        logger.error("RelationType.fromSymbol: 不支持的比较运算符 '{}'", symbol);
        throw new IllegalArgumentException("不支持的比较运算符: '" + symbol + "'");
    }

    /**
     * 严格不等式（{@code <} 和 {@code >}）不允许取到边界值。
     */
    public boolean isStrict() {
        return this == LT || this == GT;
    }

    /**
     * 返回此关系类型在交换左右操作数后的等价关系。
     * 例如：(10 > x) -> (x < 10)。
     */
    public RelationType flip() {
        return switch (this) {
            case LT -> GT;
            case LE -> GE;
            case EQ -> EQ;
            case GE -> LE;
            case GT -> LT;
        };
    }

    /**
     * 对两个整数求值。
     */
    public boolean holds(int lhs, int rhs) {
        return switch (this) {
            case LT -> lhs < rhs;
            case LE -> lhs <= rhs;
            case EQ -> lhs == rhs;
            case GE -> lhs >= rhs;
            case GT -> lhs > rhs;
        };
    }
}
