package org.tapath.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 负责管理线性规划变量下标到 Z3 实数变量的映射。
 * 每个实例只属于一次可行性检查，与其 Z3 Context 同生命周期。
 * @author Ayalyt
 */
@Getter
public class LpVariableManager {

    private static final Logger logger = LoggerFactory.getLogger(LpVariableManager.class);

    private final Context ctx;
    private final List<ArithExpr> z3Vars;

    /**
     * 构造函数，预先为每个变量创建 Z3 变量。
     * @param ctx Z3 Context 实例。
     * @param variableNames 线性规划中按下标排列的变量名。
     */
    public LpVariableManager(Context ctx, List<String> variableNames) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        List<ArithExpr> vars = new ArrayList<>(variableNames.size());
        for (String name : variableNames) {
            vars.add(ctx.mkRealConst(name));
        }
        this.z3Vars = Collections.unmodifiableList(vars);
        logger.debug("LpVariableManager 初始化完成，管理 {} 个变量。", z3Vars.size());
    }

    /**
     * @param index 变量下标。
     * @return 对应的 Z3 ArithExpr 变量。
     */
    public ArithExpr getZ3Var(int index) {
        return z3Vars.get(index);
    }

    /**
     * 向 Solver 断言所有变量的非负约束 (xi >= 0)。
     * @param solver Z3 Solver 实例。
     */
    public void assertGlobalConstraints(Solver solver) {
        for (ArithExpr var : z3Vars) {
            solver.add(ctx.mkGe(var, ctx.mkReal(0)));
        }
        logger.debug("断言 {} 个变量的非负约束", z3Vars.size());
    }
}
