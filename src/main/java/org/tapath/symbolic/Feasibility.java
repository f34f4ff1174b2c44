package org.tapath.symbolic;

/**
 * 可行性检查的三种结果。UNKNOWN（超时或求解器出错）与 INFEASIBLE 必须区分。
 */
public enum Feasibility {
    FEASIBLE,
    INFEASIBLE,
    UNKNOWN
}
