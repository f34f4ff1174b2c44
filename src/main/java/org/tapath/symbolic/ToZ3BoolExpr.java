package org.tapath.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;

/**
 * 定义将 Java 对象转换为 Z3 布尔表达式 (BoolExpr) 的接口。
 */
public interface ToZ3BoolExpr {

    /**
     * 将此对象转换为 Z3 布尔表达式。
     * @param ctx Z3 Context 实例。
     * @param varManager LpVariableManager 实例，用于管理变量下标到 Z3 变量的映射。
     * @return 对应的 Z3 BoolExpr。
     */
    BoolExpr toZ3BoolExpr(Context ctx, LpVariableManager varManager);
}
