package org.tapath.analysis;

import lombok.Getter;
import org.tapath.symbolic.Feasibility;
import org.tapath.symbolic.FeasibilityResult;
import org.tapath.symbolic.LinearProgram;
import org.tapath.utils.Rational;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 路径可实现性检查的结果。
 * witness 按线性规划的变量顺序排列：先是各时钟的初值变量（若有），再是每一段的延迟。
 */
@Getter
public final class RealizabilityResult {

    private final Feasibility status;
    private final List<Rational> witness;
    private final LinearProgram program; // 路径不合法时为 null
    private final String reason;

    private RealizabilityResult(Feasibility status, List<Rational> witness, LinearProgram program, String reason) {
        this.status = status;
        this.witness = List.copyOf(witness);
        this.program = program;
        this.reason = reason;
    }

    static RealizabilityResult of(FeasibilityResult result, LinearProgram program) {
        return new RealizabilityResult(result.getStatus(), result.getWitness(), program, result.getReason());
    }

    static RealizabilityResult invalidPath() {
        return new RealizabilityResult(Feasibility.INFEASIBLE, List.of(), null, "路径相邻关系不匹配");
    }

    /**
     * 只有 FEASIBLE 才算可实现；UNKNOWN 不是可实现，但也不是已证明不可实现。
     */
    public boolean isRealizable() {
        return status == Feasibility.FEASIBLE;
    }

    public boolean isUnknown() {
        return status == Feasibility.UNKNOWN;
    }

    public Optional<LinearProgram> getProgram() {
        return Optional.ofNullable(program);
    }

    public List<Double> getWitnessAsDoubles() {
        return witness.stream().map(Rational::doubleValue).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "RealizabilityResult{" + status + (isRealizable() ? ", witness=" + witness : "")
                + (reason != null ? ", reason=" + reason : "") + "}";
    }
}
