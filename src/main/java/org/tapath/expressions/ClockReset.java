package org.tapath.expressions;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 时钟重置 {@code x = 0}。重置之后该时钟的累计延迟从零开始计算。
 * 此类是不可变的。
 */
@Getter
public final class ClockReset implements Update {

    private static final Logger logger = LoggerFactory.getLogger(ClockReset.class);

    private final String clock;

    private ClockReset(String clock) {
        this.clock = Objects.requireNonNull(clock, "ClockReset-构造函数: clock 不能为 null");
    }

    public static ClockReset of(String clock) {
        return new ClockReset(clock);
    }

    static ClockReset of(String clock, UpdateOperator operator, String value) {
        if (operator != UpdateOperator.ASSIGN || !"0".equals(value.strip())) {
            logger.error("ClockReset-of: 时钟 '{}' 只能被重置为 0，实际为 '{} {}'", clock, operator.getSymbol(), value);
            throw new IllegalArgumentException("时钟 '" + clock + "' 只能被重置为 0");
        }
        return new ClockReset(clock);
    }

    @Override
    public String toExpressionString() {
        return clock + " = 0";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return clock.equals(((ClockReset) o).clock);
    }

    @Override
    public int hashCode() {
        return clock.hashCode();
    }

    @Override
    public String toString() {
        return toExpressionString();
    }
}
