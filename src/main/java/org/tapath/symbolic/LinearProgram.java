package org.tapath.symbolic;

import lombok.Getter;
import org.tapath.utils.Rational;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 纯可行性线性规划：所有变量非负，约束为若干行 {@code row · x <= b}，没有目标函数。
 * 此类是不可变的。
 */
@Getter
public final class LinearProgram {

    private final List<String> variableNames;
    private final List<LinearConstraintRow> rows;

    public LinearProgram(List<String> variableNames, List<LinearConstraintRow> rows) {
        this.variableNames = List.copyOf(Objects.requireNonNull(variableNames, "variableNames cannot be null"));
        this.rows = List.copyOf(Objects.requireNonNull(rows, "rows cannot be null"));
        for (LinearConstraintRow row : this.rows) {
            if (row.size() != this.variableNames.size()) {
                throw new IllegalArgumentException("约束行宽度 " + row.size() + " 与变量数 " + this.variableNames.size() + " 不一致");
            }
        }
    }

    public int getVariableCount() {
        return variableNames.size();
    }

    /**
     * @param assignment 每个变量的取值。
     * @return 赋值是否非负且满足所有行。
     */
    public boolean isSatisfiedBy(List<Rational> assignment) {
        if (assignment.size() != variableNames.size()) {
            return false;
        }
        for (Rational value : assignment) {
            if (value.signum() < 0) {
                return false;
            }
        }
        return rows.stream().allMatch(row -> row.isSatisfiedBy(assignment));
    }

    @Override
    public String toString() {
        return "LinearProgram" + variableNames + " {\n" +
                rows.stream().map(r -> "  " + r).collect(Collectors.joining("\n")) +
                "\n}";
    }
}
