package org.tapath.expressions;

import lombok.Getter;
import org.tapath.core.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 代表一个简单时钟约束，形如 {@code x ~ c} 或时钟差分 {@code x - y ~ c}。
 * 阈值 c 是字面量、常量或变量，绝不是时钟；它可以写在任意一侧，由 {@link #getThresholdSide()} 记录。
 * 此类是不可变的。
 * @author Ayalyt
 */
@Getter
public final class ClockConstraint implements Constraint {

    private static final Logger logger = LoggerFactory.getLogger(ClockConstraint.class);

    private final String lhs;
    private final RelationType relation; // 按书写顺序的关系 (lhs ~ rhs)
    private final String rhs;
    private final ThresholdSide thresholdSide;
    private final List<String> clocks; // 一个时钟，或差分 x - y 中的 [x, y]

    private final int hashCode;

    private ClockConstraint(String lhs, RelationType relation, String rhs, ThresholdSide thresholdSide, List<String> clocks) {
        this.lhs = Objects.requireNonNull(lhs, "ClockConstraint-构造函数: lhs 不能为 null");
        this.relation = Objects.requireNonNull(relation, "ClockConstraint-构造函数: relation 不能为 null");
        this.rhs = Objects.requireNonNull(rhs, "ClockConstraint-构造函数: rhs 不能为 null");
        this.thresholdSide = Objects.requireNonNull(thresholdSide, "ClockConstraint-构造函数: thresholdSide 不能为 null");
        this.clocks = List.copyOf(clocks);
        this.hashCode = Objects.hash(lhs, relation, rhs, thresholdSide);
        logger.debug("创建了一个 ClockConstraint: {}", this);
    }

    /**
     * 从已切分的两侧构造时钟约束。
     * 阈值一侧由 Context 判定：若 lhs 是字面量、常量或变量，则阈值在左侧，否则在右侧。
     * @throws IllegalArgumentException 如果时钟一侧不是单个时钟或两个时钟之差，或阈值一侧包含时钟。
     */
    static ClockConstraint of(String lhs, RelationType relation, String rhs, Context ctx) {
        ThresholdSide side;
        String clockSide;
        String thresholdText;
        if (Context.isLiteral(lhs) || ctx.isConstant(lhs) || ctx.isVariable(lhs)) {
            side = ThresholdSide.LEFT;
            clockSide = rhs;
            thresholdText = lhs;
        } else {
            side = ThresholdSide.RIGHT;
            clockSide = lhs;
            thresholdText = rhs;
        }

        List<String> clocks = new ArrayList<>();
        for (String clock : clockSide.split("-")) {
            clocks.add(clock.strip());
        }
        if (clocks.size() > 2 || !clocks.stream().allMatch(ctx::isClock)) {
            logger.error("ClockConstraint-of: '{}' 不是单个时钟或两个时钟之差", clockSide);
            throw new IllegalArgumentException("不支持的时钟表达式: '" + clockSide + "'");
        }
        for (String part : thresholdText.split("-")) {
            if (ctx.isClock(part.strip())) {
                logger.error("ClockConstraint-of: 阈值 '{}' 中包含时钟", thresholdText);
                throw new IllegalArgumentException("阈值中不能包含时钟: '" + thresholdText + "'");
            }
        }
        return new ClockConstraint(lhs, relation, rhs, side, clocks);
    }

    /**
     * 以时钟一侧为左操作数的关系。例如 {@code 10 > x} 返回 {@link RelationType#LT}。
     */
    public RelationType getClockRelation() {
        return thresholdSide == ThresholdSide.RIGHT ? relation : relation.flip();
    }

    public String getThreshold() {
        return thresholdSide == ThresholdSide.LEFT ? lhs : rhs;
    }

    /**
     * @param threshold 新的阈值文本。
     * @return 阈值一侧被替换后的新约束。
     */
    public ClockConstraint withThreshold(String threshold) {
        Objects.requireNonNull(threshold, "ClockConstraint-withThreshold: threshold 不能为 null");
        if (thresholdSide == ThresholdSide.LEFT) {
            return new ClockConstraint(threshold, relation, rhs, thresholdSide, clocks);
        }
        return new ClockConstraint(lhs, relation, threshold, thresholdSide, clocks);
    }

    /**
     * 闭不等式（含等号）返回 true。
     */
    public boolean isEquality() {
        return !relation.isStrict();
    }

    public boolean isClockDifference() {
        return clocks.size() == 2;
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
        ClockConstraint that = (ClockConstraint) o;
        return relation == that.relation &&
                thresholdSide == that.thresholdSide &&
                lhs.equals(that.lhs) &&
                rhs.equals(that.rhs);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return toExpressionString();
    }
}
