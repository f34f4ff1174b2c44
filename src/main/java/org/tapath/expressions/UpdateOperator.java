package org.tapath.expressions;

/**
 * 更新表达式的运算符。
 */
public enum UpdateOperator {
    ASSIGN("="),
    ADD("+="),
    SUBTRACT("-=");

    private final String symbol;

    UpdateOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static UpdateOperator fromSymbol(String symbol) {
        for (UpdateOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("不支持的更新运算符: '" + symbol + "'");
    }

    /**
     * @param current 左侧变量的当前值。
     * @param operand 右侧的值。
     * @return 更新后的值。
     */
    public int apply(int current, int operand) {
        return switch (this) {
            case ASSIGN -> operand;
            case ADD -> current + operand;
            case SUBTRACT -> current - operand;
        };
    }
}
