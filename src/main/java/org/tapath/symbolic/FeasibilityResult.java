package org.tapath.symbolic;

import lombok.Getter;
import org.tapath.utils.Rational;

import java.util.List;
import java.util.Objects;

/**
 * 一次可行性检查的结果。只有 FEASIBLE 时 witness 非空（变量数为零时也为空）。
 */
@Getter
public final class FeasibilityResult {

    private final Feasibility status;
    private final List<Rational> witness;
    private final String reason; // UNKNOWN 时记录原因

    private FeasibilityResult(Feasibility status, List<Rational> witness, String reason) {
        this.status = Objects.requireNonNull(status, "status cannot be null");
        this.witness = List.copyOf(witness);
        this.reason = reason;
    }

    public static FeasibilityResult feasible(List<Rational> witness) {
        return new FeasibilityResult(Feasibility.FEASIBLE, witness, null);
    }

    public static FeasibilityResult infeasible() {
        return new FeasibilityResult(Feasibility.INFEASIBLE, List.of(), null);
    }

    public static FeasibilityResult unknown(String reason) {
        return new FeasibilityResult(Feasibility.UNKNOWN, List.of(), reason);
    }

    public boolean isFeasible() {
        return status == Feasibility.FEASIBLE;
    }

    @Override
    public String toString() {
        return switch (status) {
            case FEASIBLE -> "FEASIBLE" + witness;
            case INFEASIBLE -> "INFEASIBLE";
            case UNKNOWN -> "UNKNOWN(" + reason + ")";
        };
    }
}
