package org.tapath.symbolic;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tapath.core.AnalysisConfig;
import org.tapath.utils.Rational;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 Z3 的可行性判定器。
 * 每次调用创建新的 Z3 Context 与 Solver，用完即关闭，因此本对象不持有可变状态，可以并发使用。
 * 约束在实数上求解；超时或求解器异常报告为 {@link Feasibility#UNKNOWN}。
 * @author Ayalyt
 */
public final class Z3FeasibilityOracle implements FeasibilityOracle {

    private static final Logger logger = LoggerFactory.getLogger(Z3FeasibilityOracle.class);

    private final int timeoutMs;

    public Z3FeasibilityOracle(AnalysisConfig config) {
        this.timeoutMs = config.getSolverTimeoutMs();
    }

    public Z3FeasibilityOracle() {
        this(AnalysisConfig.load());
    }

    @Override
    public FeasibilityResult check(LinearProgram program) {
        try (Context ctx = new Context()) {
            Solver solver = ctx.mkSolver();
            Params params = ctx.mkParams();
            params.add("timeout", timeoutMs);
            solver.setParameters(params);

            LpVariableManager varManager = new LpVariableManager(ctx, program.getVariableNames());
            varManager.assertGlobalConstraints(solver);
            for (LinearConstraintRow row : program.getRows()) {
                solver.add(row.toZ3BoolExpr(ctx, varManager));
            }

            Status status = solver.check();
            logger.debug("Z3 求解 {} 个变量、{} 行约束: {}", program.getVariableCount(), program.getRows().size(), status);
            return switch (status) {
                case SATISFIABLE -> FeasibilityResult.feasible(readWitness(solver.getModel(), varManager, program.getVariableCount()));
                case UNSATISFIABLE -> FeasibilityResult.infeasible();
                case UNKNOWN -> {
                    String reason = solver.getReasonUnknown();
                    logger.warn("Z3 无法判定可行性: {}", reason);
                    yield FeasibilityResult.unknown(reason);
                }
            };
        } catch (Z3Exception e) {
            logger.warn("Z3 求解失败: {}", e.getMessage());
            return FeasibilityResult.unknown(e.getMessage());
        }
    }

    private static List<Rational> readWitness(Model model, LpVariableManager varManager, int count) {
        List<Rational> witness = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Expr value = model.eval(varManager.getZ3Var(i), true);
            if (!(value instanceof RatNum)) {
                logger.error("Z3 模型中变量 {} 的值不是有理数: {}", i, value);
                throw new IllegalStateException("Z3 模型中变量的值不是有理数: " + value);
            }
            witness.add(Rational.fromZ3((RatNum) value));
        }
        return witness;
    }
}
