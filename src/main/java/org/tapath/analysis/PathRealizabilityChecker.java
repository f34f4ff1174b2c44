package org.tapath.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.automata.base.Location;
import org.tapath.automata.base.Transition;
import org.tapath.automata.models.Template;
import org.tapath.automata.path.Path;
import org.tapath.core.Context;
import org.tapath.core.MutableContext;
import org.tapath.expressions.ClockConstraint;
import org.tapath.expressions.Constraint;
import org.tapath.expressions.RelationType;
import org.tapath.expressions.VariableUpdate;
import org.tapath.symbolic.FeasibilityOracle;
import org.tapath.symbolic.FeasibilityResult;
import org.tapath.symbolic.LinearConstraintRow;
import org.tapath.symbolic.LinearProgram;
import org.tapath.symbolic.Z3FeasibilityOracle;
import org.tapath.utils.Rational;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * 判定一条路径是否可实现：是否存在每一段的非负延迟（以及可选的时钟初值），
 * 使路径上的所有不变量与守卫同时成立。
 *
 * <p>变量布局：若给出时钟初值映射，先为每个时钟放一个初值变量；之后是每一段的延迟变量 d_k，
 * 即在第 k 个位置停留的时间。时钟 c 在某一时刻的值等于自上次重置以来所有延迟变量之和，
 * 因此每个时钟维护一个"贡献变量下标"列表，重置时清空，每走过一段追加下一个延迟变量。</p>
 *
 * <p>每个简单时钟约束生成一行 {@code row · x <= b}：时钟 c1 的贡献变量系数为 +1，
 * 差分中的 c2 为 -1；{@code >}/{@code >=} 整行取反；{@code ==} 再追加一行取反；
 * 开启 epsilon 时严格不等式的右端项再减去 {@link #EPSILON}。</p>
 * @author Ayalyt
 */
public final class PathRealizabilityChecker {

    private static final Logger logger = LoggerFactory.getLogger(PathRealizabilityChecker.class);

    /** 2^-10 */
    public static final Rational EPSILON = Rational.valueOf(1, 1024);

    private final FeasibilityOracle oracle;

    public PathRealizabilityChecker(FeasibilityOracle oracle) {
        this.oracle = Objects.requireNonNull(oracle, "FeasibilityOracle cannot be null.");
    }

    public PathRealizabilityChecker() {
        this(new Z3FeasibilityOracle());
    }

    public RealizabilityResult check(Template template, Path path, RealizabilityOptions options) {
        return check(template.getContext(), path, options);
    }

    /**
     * 检查路径的可实现性。
     * @param context 路径所属模板的声明上下文。
     * @param path    待检查的路径。
     * @param options 检查选项。
     * @return 检查结果；validatePath 开启且相邻关系不匹配时为 INFEASIBLE 且没有见证解。
     */
    public RealizabilityResult check(Context context, Path path, RealizabilityOptions options) {
        if (options.isValidatePath() && !path.exists()) {
            logger.debug("路径 {} 的相邻关系不匹配", path);
            return RealizabilityResult.invalidPath();
        }
        LinearProgram program = buildLinearProgram(context, path, options);
        FeasibilityResult result = oracle.check(program);
        if (result.isFeasible() && !program.isSatisfiedBy(result.getWitness())) {
            logger.error("求解器给出的见证解 {} 不满足线性规划 {}", result.getWitness(), program);
            throw new IllegalStateException("求解器给出的见证解不满足约束");
        }
        logger.debug("路径 {} 的检查结果: {}", path, result);
        return RealizabilityResult.of(result, program);
    }

    /**
     * @return 路径上所有时钟约束引用的时钟，去重并按字典序排列。
     */
    public static List<String> findUsedClocks(Path path) {
        TreeSet<String> clocks = new TreeSet<>();
        for (Constraint constraint : path.getConstraints()) {
            if (constraint instanceof ClockConstraint clockConstraint) {
                clocks.addAll(clockConstraint.getClocks());
            }
        }
        return new ArrayList<>(clocks);
    }

    /**
     * 把路径翻译为线性可行性问题，不调用求解器。
     * @throws IllegalArgumentException 如果约束引用了不在时钟列表中的时钟。
     */
    public LinearProgram buildLinearProgram(Context context, Path path, RealizabilityOptions options) {
        List<String> clocks = options.getClocks().orElseGet(() -> findUsedClocks(path));
        Optional<Map<String, Integer>> initialValuations = options.getInitialClockValuations();
        int delayCount = path.length();
        int delayOffset = initialValuations.isPresent() ? clocks.size() : 0;
        int variableCount = delayOffset + delayCount;

        List<String> variableNames = new ArrayList<>(variableCount);
        List<LinearConstraintRow> rows = new ArrayList<>();
        Map<String, List<Integer>> clockToDelay = new HashMap<>();

        if (initialValuations.isPresent()) {
            Map<String, Integer> pinned = initialValuations.get();
            for (int i = 0; i < clocks.size(); i++) {
                String clock = clocks.get(i);
                variableNames.add("icv_" + clock);
                List<Integer> contributors = new ArrayList<>();
                contributors.add(i);
                if (delayCount > 0) {
                    contributors.add(delayOffset);
                }
                clockToDelay.put(clock, contributors);
                Integer value = pinned.get(clock);
                if (value != null) {
                    // icv == v  <=>  -icv <= -v 且 icv <= v
                    Rational[] coefficients = zeros(variableCount);
                    coefficients[i] = Rational.ONE.negate();
                    LinearConstraintRow lower = LinearConstraintRow.of(List.of(coefficients), Rational.valueOf(value).negate());
                    rows.add(lower);
                    rows.add(lower.negate());
                }
            }
        } else {
            for (String clock : clocks) {
                List<Integer> contributors = new ArrayList<>();
                if (delayCount > 0) {
                    contributors.add(0);
                }
                clockToDelay.put(clock, contributors);
            }
        }
        for (int k = 0; k < delayCount; k++) {
            variableNames.add("d" + k);
        }

        MutableContext state = context.toMutable();
        if (delayCount == 0) {
            addRows(rows, path.first().getInvariant(), clockToDelay, variableCount, state, options);
        }
        for (int k = 0; k < delayCount; k++) {
            Location source = path.getLocations().get(k);
            Transition transition = path.getTransitions().get(k);
            Location target = path.getLocations().get(k + 1);

            addRows(rows, source.getInvariant(), clockToDelay, variableCount, state, options);
            addRows(rows, transition.getGuard(), clockToDelay, variableCount, state, options);

            for (String reset : transition.getResets()) {
                if (clockToDelay.containsKey(reset)) {
                    clockToDelay.put(reset, new ArrayList<>());
                }
            }
            for (VariableUpdate update : transition.getOtherUpdates()) {
                update.apply(state);
            }

            addRows(rows, target.getInvariant(), clockToDelay, variableCount, state, options);

            if (k + 1 < delayCount) {
                for (List<Integer> contributors : clockToDelay.values()) {
                    contributors.add(delayOffset + k + 1);
                }
            }
        }

        LinearProgram program = new LinearProgram(variableNames, rows);
        logger.debug("路径 {} 生成线性规划: {} 个变量, {} 行约束", path, variableCount, rows.size());
        return program;
    }

    private static void addRows(List<LinearConstraintRow> rows, List<Constraint> constraints,
                                Map<String, List<Integer>> clockToDelay, int variableCount,
                                Context state, RealizabilityOptions options) {
        for (Constraint constraint : constraints) {
            if (constraint instanceof ClockConstraint clockConstraint) {
                rows.addAll(computeConstraintRows(clockToDelay, clockConstraint, variableCount, state,
                        options.isAddEpsilon(), options.isValidateState()));
            }
        }
    }

    /**
     * 为一个简单时钟约束构造线性规划的行。
     * @param clockToDelay     每个时钟自上次重置以来的贡献变量下标。
     * @param constraint       时钟约束。
     * @param variableCount    行宽。
     * @param state            用于解析阈值的当前上下文。
     * @param addEpsilon       严格不等式是否收紧 EPSILON。
     * @param skipVarThreshold 阈值为变量时是否跳过该约束。
     * @return 零行（被跳过）、一行，或等式约束的两行。
     */
    static List<LinearConstraintRow> computeConstraintRows(Map<String, List<Integer>> clockToDelay,
                                                           ClockConstraint constraint, int variableCount,
                                                           Context state, boolean addEpsilon,
                                                           boolean skipVarThreshold) {
        if (skipVarThreshold && state.isVariable(constraint.getThreshold())) {
            return Collections.emptyList();
        }

        Rational[] coefficients = zeros(variableCount);
        for (int index : contributorsOf(clockToDelay, constraint.getClocks().get(0))) {
            coefficients[index] = coefficients[index].add(Rational.ONE);
        }
        if (constraint.isClockDifference()) {
            for (int index : contributorsOf(clockToDelay, constraint.getClocks().get(1))) {
                coefficients[index] = coefficients[index].subtract(Rational.ONE);
            }
        }

        LinearConstraintRow row = LinearConstraintRow.of(List.of(coefficients), Rational.valueOf(state.getVal(constraint.getThreshold())));
        RelationType relation = constraint.getClockRelation();
        if (relation == RelationType.GT || relation == RelationType.GE) {
            row = row.negate();
        }
        if (addEpsilon && !constraint.isEquality()) {
            row = row.tighten(EPSILON);
        }
        if (relation == RelationType.EQ) {
            return List.of(row, row.negate());
        }
        return List.of(row);
    }

    private static List<Integer> contributorsOf(Map<String, List<Integer>> clockToDelay, String clock) {
        List<Integer> contributors = clockToDelay.get(clock);
        if (contributors == null) {
            logger.error("时钟 '{}' 不在分析的时钟列表 {} 中", clock, clockToDelay.keySet());
            throw new IllegalArgumentException("时钟 '" + clock + "' 不在分析的时钟列表中");
        }
        return contributors;
    }

    private static Rational[] zeros(int size) {
        Rational[] values = new Rational[size];
        Arrays.fill(values, Rational.ZERO);
        return values;
    }
}
