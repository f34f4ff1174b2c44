package org.tapath.analysis;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 路径可实现性检查的选项。此类是不可变的，用 with 方法派生新选项。
 * <ul>
 *     <li>validatePath：先检查相邻关系，不匹配直接判为不可实现</li>
 *     <li>validateState：跳过阈值为变量的时钟约束（它们依赖运行时状态）</li>
 *     <li>addEpsilon：严格不等式的右端项减去 EPSILON</li>
 *     <li>initialClockValuations：缺省时所有时钟初值为 0；给出时每个时钟有一个非负初值变量，
 *     映射中出现的时钟被固定为对应值</li>
 *     <li>clocks：显式指定参与分析的时钟，缺省时从路径上收集</li>
 * </ul>
 */
@Getter
public final class RealizabilityOptions {

    private static final RealizabilityOptions DEFAULTS = new RealizabilityOptions(false, false, false, null, null);

    private final boolean validatePath;
    private final boolean validateState;
    private final boolean addEpsilon;
    private final Map<String, Integer> initialClockValuations;
    private final List<String> clocks;

    private RealizabilityOptions(boolean validatePath, boolean validateState, boolean addEpsilon,
                                 Map<String, Integer> initialClockValuations, List<String> clocks) {
        this.validatePath = validatePath;
        this.validateState = validateState;
        this.addEpsilon = addEpsilon;
        this.initialClockValuations = initialClockValuations == null ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(initialClockValuations));
        this.clocks = clocks == null ? null : List.copyOf(clocks);
    }

    public static RealizabilityOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 半可实现性检查：所有时钟初值自由（&gt;= 0），不固定任何时钟。
     */
    public static RealizabilityOptions semiRealizable() {
        return DEFAULTS.withInitialClockValuations(Map.of());
    }

    public RealizabilityOptions withValidatePath(boolean value) {
        return new RealizabilityOptions(value, validateState, addEpsilon, initialClockValuations, clocks);
    }

    public RealizabilityOptions withValidateState(boolean value) {
        return new RealizabilityOptions(validatePath, value, addEpsilon, initialClockValuations, clocks);
    }

    public RealizabilityOptions withAddEpsilon(boolean value) {
        return new RealizabilityOptions(validatePath, validateState, value, initialClockValuations, clocks);
    }

    /**
     * @param valuations 时钟初值，null 表示全部为 0；空映射表示全部自由。
     */
    public RealizabilityOptions withInitialClockValuations(Map<String, Integer> valuations) {
        return new RealizabilityOptions(validatePath, validateState, addEpsilon, valuations, clocks);
    }

    public RealizabilityOptions withClocks(List<String> value) {
        return new RealizabilityOptions(validatePath, validateState, addEpsilon, initialClockValuations, value);
    }

    public Optional<Map<String, Integer>> getInitialClockValuations() {
        return Optional.ofNullable(initialClockValuations);
    }

    public Optional<List<String>> getClocks() {
        return Optional.ofNullable(clocks);
    }

    @Override
    public String toString() {
        return "RealizabilityOptions{validatePath=" + validatePath +
                ", validateState=" + validateState +
                ", addEpsilon=" + addEpsilon +
                ", initialClockValuations=" + initialClockValuations +
                ", clocks=" + clocks + "}";
    }
}
